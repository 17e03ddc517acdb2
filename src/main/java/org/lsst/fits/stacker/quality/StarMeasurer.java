package org.lsst.fits.stacker.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.lsst.fits.stacker.stats.Segmentation;
import org.lsst.fits.stacker.stats.Source;
import org.lsst.fits.stacker.stats.Statistics;

/**
 * Measures image quality directly from the pixels: stars are detected by
 * segmentation and their half maximum isophotes give FWHM and elongation.
 * Blends, cosmic rays and sources on the edge or on masked pixels are left
 * out.
 */
public class StarMeasurer {

    private static final double MIN_FWHM = 0.8;
    private static final double MAX_FWHM = 20.0;
    private static final double MAX_ELONGATION = 2.5;

    private final Segmentation segmentation;
    private final int maxStars;

    public StarMeasurer() {
        this(new Segmentation(5.0, 5), 200);
    }

    public StarMeasurer(Segmentation segmentation, int maxStars) {
        this.segmentation = segmentation;
        this.maxStars = maxStars;
    }

    /**
     * @param data The image
     * @param staticMask Pixels to ignore, or null
     * @param pixelScale Arcseconds per pixel
     * @return The median FWHM in arcseconds and the median elongation, or
     * empty if no usable star was found
     */
    public Optional<QualityMetric> measure(float[][] data, boolean[][] staticMask, double pixelScale) {
        List<Double> fwhm = new ArrayList<>();
        List<Double> elongation = new ArrayList<>();
        for (Source source : segmentation.detect(data)) {
            if (fwhm.size() == maxStars) {
                break;
            }
            if (source.touchesEdge() || isMasked(staticMask, source)) {
                continue;
            }
            double width = source.getFwhm();
            double ratio = source.getElongation();
            if (!(width > MIN_FWHM && width < MAX_FWHM) || !(ratio < MAX_ELONGATION)) {
                continue;
            }
            fwhm.add(width * pixelScale);
            elongation.add(ratio);
        }
        if (fwhm.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new QualityMetric(Statistics.median(fwhm), Statistics.median(elongation)));
    }

    private static boolean isMasked(boolean[][] mask, Source source) {
        if (mask == null) {
            return false;
        }
        int x = (int) Math.round(source.getX());
        int y = (int) Math.round(source.getY());
        return y >= 0 && y < mask.length && x >= 0 && x < mask[y].length && mask[y][x];
    }
}
