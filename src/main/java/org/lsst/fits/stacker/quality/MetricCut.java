package org.lsst.fits.stacker.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.lsst.fits.stacker.stats.Statistics;

/**
 * The rejection threshold for one quality metric. The threshold starts at
 * median plus three standard deviations. When more values than the cap lie
 * above it, and the cap is at least one, it is raised to the cap-th largest
 * of those values so that no more than cap frames are rejected on this
 * metric.
 */
public class MetricCut {

    static final double SIGMA = 3.0;

    private final String name;
    private final double median;
    private final double std;
    private final double threshold;
    private final int outliers;
    private final boolean relaxed;

    private MetricCut(String name, double median, double std, double threshold, int outliers, boolean relaxed) {
        this.name = name;
        this.median = median;
        this.std = std;
        this.threshold = threshold;
        this.outliers = outliers;
        this.relaxed = relaxed;
    }

    /**
     * @param name The metric name, for logging
     * @param values The metric of every frame
     * @param cap The most frames that may be rejected on this metric once
     * the threshold is relaxed
     * @return The cut
     */
    public static MetricCut compute(String name, List<Double> values, int cap) {
        double median = Statistics.median(values);
        double std = Statistics.std(values);
        double threshold = median + SIGMA * std;
        List<Double> above = new ArrayList<>();
        for (double value : values) {
            if (value > threshold) {
                above.add(value);
            }
        }
        if (above.size() > cap && cap > 0) {
            above.sort(Collections.reverseOrder());
            return new MetricCut(name, median, std, above.get(cap - 1), above.size(), true);
        }
        return new MetricCut(name, median, std, threshold, above.size(), false);
    }

    public boolean rejects(double value) {
        return value > threshold;
    }

    public String getName() {
        return name;
    }

    public double getMedian() {
        return median;
    }

    public double getStd() {
        return std;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return The number of values above the initial three sigma threshold
     */
    public int getOutliers() {
        return outliers;
    }

    public boolean isRelaxed() {
        return relaxed;
    }

    /**
     * @return The threshold in standard deviations above the median
     */
    public double getThresholdSigma() {
        return std == 0 ? SIGMA : (threshold - median) / std;
    }

    @Override
    public String toString() {
        return String.format("%s median %.3f +/- %.3f, cut %.3f (%.2f sigma%s), %d above 3 sigma",
                name, median, std, threshold, getThresholdSigma(), relaxed ? ", relaxed" : "", outliers);
    }
}
