package org.lsst.fits.stacker.phot;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import org.lsst.fits.stacker.DelegateFailureException;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.stats.Segmentation;
import org.lsst.fits.stacker.stats.Source;
import org.lsst.fits.stacker.stats.Statistics;

/**
 * Aperture photometry of a final stack. Stars are detected by segmentation,
 * the aperture radius is a multiple of the median stellar FWHM and the local
 * sky is the median of an annulus around each star. Results are written as a
 * whitespace separated {@code .pcmp} table next to the stack, with the FWHM
 * in the comment header. Magnitudes are instrumental.
 */
public class AperturePhotometer {

    private static final Logger LOG = Logger.getLogger(AperturePhotometer.class.getName());

    private final Segmentation segmentation;
    private final double apertureFactor;

    public AperturePhotometer() {
        this(new Segmentation(5.0, 5), 1.5);
    }

    public AperturePhotometer(Segmentation segmentation, double apertureFactor) {
        this.segmentation = segmentation;
        this.apertureFactor = apertureFactor;
    }

    /**
     * @param stack The stack to measure
     * @param catalogs Reference catalogs for later calibration, recorded in
     * the table header
     * @return The photometry table
     * @throws DelegateFailureException If the stack cannot be read or has no
     * usable stars
     */
    public Path measure(Path stack, List<String> catalogs) throws DelegateFailureException {
        ImageFrame image;
        try {
            image = FitsImages.readImage(stack, 0);
        } catch (IOException | FitsException x) {
            throw new DelegateFailureException("Cannot read stack " + stack, x);
        }
        List<Source> stars = new ArrayList<>();
        for (Source source : segmentation.detect(image.getData())) {
            if (!source.touchesEdge() && Double.isFinite(source.getFwhm())) {
                stars.add(source);
            }
        }
        if (stars.isEmpty()) {
            throw new DelegateFailureException("No stars found in " + stack);
        }
        List<Double> widths = new ArrayList<>();
        for (Source star : stars) {
            widths.add(star.getFwhm());
        }
        double fwhm = Statistics.median(widths);
        double radius = Math.max(1.0, apertureFactor * fwhm);
        double inner = radius + 2;
        double outer = inner + Math.max(3.0, radius);
        Path output = stack.resolveSibling(FitsImages.baseName(stack) + ".pcmp");
        try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(output, StandardCharsets.US_ASCII))) {
            out.printf(Locale.ROOT, "# FILE = %s%n", stack.getFileName());
            out.printf(Locale.ROOT, "# FWHM = %.4f%n", fwhm);
            out.printf(Locale.ROOT, "# APERTURE = %.4f%n", radius);
            out.printf(Locale.ROOT, "# REFCAT = %s%n", String.join(",", catalogs));
            out.println("# X Y FLUX FLUX_ERR MAG MAG_ERR SKY");
            int written = 0;
            for (Source star : stars) {
                double[] m = measureStar(image.getData(), star.getX(), star.getY(), radius, inner, outer);
                if (m == null || !(m[0] > 0)) {
                    continue;
                }
                double mag = -2.5 * Math.log10(m[0]);
                double magErr = 2.5 / Math.log(10) * m[1] / m[0];
                out.printf(Locale.ROOT, "%.3f %.3f %.4f %.4f %.4f %.4f %.4f%n", star.getX() + 1, star.getY() + 1, m[0], m[1], mag, magErr, m[2]);
                written++;
            }
            LOG.log(Level.INFO, "Measured {0} stars in {1}, FWHM {2} pixels", new Object[]{written, stack, fwhm});
        } catch (IOException x) {
            throw new DelegateFailureException("Cannot write photometry for " + stack, x);
        }
        return output;
    }

    /**
     * @return {flux, flux error, sky per pixel}, or null if the aperture
     * leaves the image or the annulus is empty
     */
    static double[] measureStar(float[][] data, double cx, double cy, double radius, double inner, double outer) {
        int height = data.length;
        int width = height == 0 ? 0 : data[0].length;
        if (cx - radius < 0 || cy - radius < 0 || cx + radius >= width || cy + radius >= height) {
            return null;
        }
        double[] annulus = new double[(int) Math.ceil((2 * outer + 1) * (2 * outer + 1))];
        int nSky = 0;
        double sum = 0;
        int nAperture = 0;
        for (int y = (int) Math.floor(cy - outer); y <= (int) Math.ceil(cy + outer); y++) {
            for (int x = (int) Math.floor(cx - outer); x <= (int) Math.ceil(cx + outer); x++) {
                if (y < 0 || x < 0 || y >= height || x >= width || Float.isNaN(data[y][x])) {
                    continue;
                }
                double r = Math.hypot(x - cx, y - cy);
                if (r <= radius) {
                    sum += data[y][x];
                    nAperture++;
                } else if (r >= inner && r <= outer && nSky < annulus.length) {
                    annulus[nSky++] = data[y][x];
                }
            }
        }
        if (nSky == 0 || nAperture == 0) {
            return null;
        }
        nSky = Statistics.sigmaClip(annulus, nSky, 3.0, 5);
        double skyStd = Statistics.std(annulus, nSky);
        double sky = Statistics.median(annulus, nSky);
        double flux = sum - sky * nAperture;
        double error = Math.sqrt(Math.max(flux, 0) + nAperture * skyStd * skyStd);
        return new double[]{flux, error, sky};
    }
}
