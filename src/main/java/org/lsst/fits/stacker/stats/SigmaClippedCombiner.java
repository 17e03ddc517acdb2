package org.lsst.fits.stacker.stats;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-pixel median combination of a stack of equally sized images. At each
 * pixel the unmasked values are sigma clipped around their median before the
 * median of the survivors is taken. A pixel masked in every input falls back
 * to the median of all its values.
 */
public class SigmaClippedCombiner {

    private static final Logger LOG = Logger.getLogger(SigmaClippedCombiner.class.getName());

    private final double sigma;
    private final int maxIterations;

    public SigmaClippedCombiner() {
        this(Double.parseDouble(System.getProperty("org.lsst.fits.stacker.clipSigma", "3.0")),
                Integer.getInteger("org.lsst.fits.stacker.clipIterations", 5));
    }

    public SigmaClippedCombiner(double sigma, int maxIterations) {
        this.sigma = sigma;
        this.maxIterations = maxIterations;
    }

    public float[][] combine(List<float[][]> images) {
        return combine(images, null);
    }

    /**
     * @param images The images to combine, all of the same shape
     * @param masks Masks parallel to images, or null. Individual entries may be
     * null for unmasked images.
     * @return The combined image
     */
    public float[][] combine(List<float[][]> images, List<boolean[][]> masks) {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine");
        }
        if (masks != null && masks.size() != images.size()) {
            throw new IllegalArgumentException("Got " + masks.size() + " masks for " + images.size() + " images");
        }
        int height = images.get(0).length;
        int width = height == 0 ? 0 : images.get(0)[0].length;
        for (float[][] image : images) {
            if (image.length != height || (height > 0 && image[0].length != width)) {
                throw new IllegalArgumentException("Images to combine differ in shape");
            }
        }
        int depth = images.size();
        float[][] result = new float[height][width];
        double[] values = new double[depth];
        double[] all = new double[depth];
        int fallbacks = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int n = 0;
                int m = 0;
                for (int i = 0; i < depth; i++) {
                    float v = images.get(i)[y][x];
                    if (Float.isNaN(v)) {
                        continue;
                    }
                    all[m++] = v;
                    boolean[][] mask = masks == null ? null : masks.get(i);
                    if (mask == null || !mask[y][x]) {
                        values[n++] = v;
                    }
                }
                if (n == 0) {
                    fallbacks++;
                    result[y][x] = (float) Statistics.median(all, m);
                } else {
                    n = Statistics.sigmaClip(values, n, sigma, maxIterations);
                    result[y][x] = (float) Statistics.median(values, n);
                }
            }
        }
        if (fallbacks > 0) {
            LOG.log(Level.FINE, "{0} pixels were masked in all {1} inputs", new Object[]{fallbacks, depth});
        }
        return result;
    }
}
