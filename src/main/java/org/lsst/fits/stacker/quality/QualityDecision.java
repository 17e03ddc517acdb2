package org.lsst.fits.stacker.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which frames passed the quality gate, by index into the gate's input.
 */
public class QualityDecision {

    private final List<Integer> passed;
    private final List<Integer> rejected;
    private final MetricCut fwhmCut;
    private final MetricCut elongationCut;

    QualityDecision(List<Integer> passed, List<Integer> rejected, MetricCut fwhmCut, MetricCut elongationCut) {
        this.passed = Collections.unmodifiableList(passed);
        this.rejected = Collections.unmodifiableList(rejected);
        this.fwhmCut = fwhmCut;
        this.elongationCut = elongationCut;
    }

    public List<Integer> getPassed() {
        return passed;
    }

    public List<Integer> getRejected() {
        return rejected;
    }

    /**
     * @return The FWHM cut, null if there were no frames
     */
    public MetricCut getFwhmCut() {
        return fwhmCut;
    }

    public MetricCut getElongationCut() {
        return elongationCut;
    }

    /**
     * Select the passing items from a list parallel to the gate's input.
     */
    public <T> List<T> select(List<T> items) {
        List<T> result = new ArrayList<>(passed.size());
        for (int index : passed) {
            result.add(items.get(index));
        }
        return result;
    }
}
