package org.lsst.fits.stacker.stats;

/**
 * One detected source: its background-subtracted flux, centre of mass and
 * the shape of its half maximum isophote.
 */
public class Source {

    private final int npix;
    private final double flux;
    private final double x;
    private final double y;
    private final double peak;
    private final double fwhm;
    private final double elongation;
    private final boolean touchesEdge;

    Source(int npix, double flux, double x, double y, double peak, double fwhm, double elongation, boolean touchesEdge) {
        this.npix = npix;
        this.flux = flux;
        this.x = x;
        this.y = y;
        this.peak = peak;
        this.fwhm = fwhm;
        this.elongation = elongation;
        this.touchesEdge = touchesEdge;
    }

    public int getPixelCount() {
        return npix;
    }

    public double getFlux() {
        return flux;
    }

    /**
     * @return Centre of mass column (0 based, pixel centres at integers)
     */
    public double getX() {
        return x;
    }

    /**
     * @return Centre of mass row (0 based)
     */
    public double getY() {
        return y;
    }

    public double getPeak() {
        return peak;
    }

    public boolean touchesEdge() {
        return touchesEdge;
    }

    /**
     * @return Ratio of the major to the minor axis of the ellipse fitted to
     * the half maximum isophote, or NaN if it could not be measured
     */
    public double getElongation() {
        return elongation;
    }

    /**
     * @return Diameter in pixels of the circle with the same area as the half
     * maximum isophote, or NaN if it could not be measured
     */
    public double getFwhm() {
        return fwhm;
    }

    @Override
    public String toString() {
        return String.format("Source{x=%.2f, y=%.2f, flux=%.1f, npix=%d}", x, y, flux, npix);
    }
}
