package org.lsst.fits.stacker.stats;

import java.util.Arrays;
import java.util.List;

/**
 * Basic robust statistics over small samples. Standard deviations are
 * population deviations (divided by n), medians of even samples average the
 * two central values.
 */
public class Statistics {

    private Statistics() {
    }

    public static double median(double[] values) {
        return median(values, values.length);
    }

    /**
     * Median of the first {@code n} values. The array is sorted in place over
     * that range.
     */
    public static double median(double[] values, int n) {
        if (n == 0) {
            return Double.NaN;
        }
        Arrays.sort(values, 0, n);
        int mid = n / 2;
        if (n % 2 == 0) {
            return (values[mid - 1] + values[mid]) / 2.0;
        } else {
            return values[mid];
        }
    }

    public static double median(List<Double> values) {
        return median(toArray(values));
    }

    public static double mean(double[] values, int n) {
        if (n == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
        }
        return sum / n;
    }

    public static double std(double[] values) {
        return std(values, values.length);
    }

    public static double std(double[] values, int n) {
        if (n == 0) {
            return Double.NaN;
        }
        double mean = mean(values, n);
        double sumsq = 0;
        for (int i = 0; i < n; i++) {
            double d = values[i] - mean;
            sumsq += d * d;
        }
        return Math.sqrt(sumsq / n);
    }

    public static double std(List<Double> values) {
        return std(toArray(values));
    }

    /**
     * Iteratively reject values further than {@code sigma} standard deviations
     * from the median. Surviving values are compacted to the front of the
     * array.
     *
     * @param values The sample, reordered in place
     * @param n Number of valid values at the front of the array
     * @param sigma Rejection threshold in standard deviations
     * @param maxIterations Upper bound on clipping passes
     * @return The number of surviving values
     */
    public static int sigmaClip(double[] values, int n, double sigma, int maxIterations) {
        double[] scratch = new double[n];
        for (int iteration = 0; iteration < maxIterations && n > 2; iteration++) {
            System.arraycopy(values, 0, scratch, 0, n);
            double center = median(scratch, n);
            double deviation = std(values, n);
            if (deviation == 0 || Double.isNaN(deviation)) {
                break;
            }
            double limit = sigma * deviation;
            int kept = 0;
            for (int i = 0; i < n; i++) {
                if (Math.abs(values[i] - center) <= limit) {
                    values[kept++] = values[i];
                }
            }
            if (kept == n) {
                break;
            }
            n = kept;
        }
        return n;
    }

    /**
     * Sigma-clipped mean, median and standard deviation of the unmasked
     * pixels of an image.
     *
     * @return {mean, median, std}
     */
    public static double[] clippedStats(float[][] data, boolean[][] mask, double sigma, int maxIterations) {
        int height = data.length;
        int width = height == 0 ? 0 : data[0].length;
        double[] values = new double[width * height];
        int n = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float v = data[y][x];
                if ((mask == null || !mask[y][x]) && !Float.isNaN(v)) {
                    values[n++] = v;
                }
            }
        }
        n = sigmaClip(values, n, sigma, maxIterations);
        double mean = mean(values, n);
        double std = std(values, n);
        double median = median(values, n);
        return new double[]{mean, median, std};
    }

    private static double[] toArray(List<Double> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
