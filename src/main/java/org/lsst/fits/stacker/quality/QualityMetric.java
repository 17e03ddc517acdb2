package org.lsst.fits.stacker.quality;

/**
 * Image quality of one aligned frame.
 */
public class QualityMetric {

    private final double fwhm;
    private final double elongation;

    /**
     * @param fwhm Median stellar FWHM in arcseconds
     * @param elongation Median ratio of stellar major to minor axis
     */
    public QualityMetric(double fwhm, double elongation) {
        this.fwhm = fwhm;
        this.elongation = elongation;
    }

    public double getFwhm() {
        return fwhm;
    }

    public double getElongation() {
        return elongation;
    }

    @Override
    public String toString() {
        return String.format("QualityMetric{fwhm=%.3f\", elongation=%.3f}", fwhm, elongation);
    }
}
