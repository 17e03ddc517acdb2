package org.lsst.fits.stacker.quality;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class QualityGateTest {

    private final QualityGate gate = new QualityGate();

    @Test
    public void identicalMetricsRejectNothing() {
        List<QualityMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            metrics.add(new QualityMetric(1.2, 1.1));
        }
        QualityDecision decision = gate.evaluate(metrics);
        assertTrue(decision.getRejected().isEmpty());
        assertEquals(25, decision.getPassed().size());
    }

    @Test
    public void singleOutlierIsRejected() {
        List<QualityMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 19; i++) {
            metrics.add(new QualityMetric(1.0, 1.1));
        }
        metrics.add(7, new QualityMetric(10.0, 1.1));
        QualityDecision decision = gate.evaluate(metrics);
        assertEquals(Collections.singletonList(7), decision.getRejected());
        assertFalse(decision.getFwhmCut().isRelaxed());
        assertEquals(1, decision.getFwhmCut().getOutliers());
    }

    @Test
    public void relaxedCutNeverExceedsCap() {
        // 53 good frames and 7 clear FWHM outliers, more than the cap of 6
        List<QualityMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 53; i++) {
            metrics.add(new QualityMetric(1.0, 1.1));
        }
        for (int i = 0; i < 7; i++) {
            metrics.add(new QualityMetric(101.0 + i, 1.1));
        }
        assertEquals(6, QualityGate.cap(metrics.size()));
        QualityDecision decision = gate.evaluate(metrics);
        MetricCut cut = decision.getFwhmCut();
        assertEquals(7, cut.getOutliers());
        assertTrue(cut.isRelaxed());
        assertEquals(102.0, cut.getThreshold(), 1e-9);
        assertTrue(decision.getRejected().size() <= QualityGate.cap(metrics.size()));
        assertEquals(Arrays.asList(55, 56, 57, 58, 59), decision.getRejected());
    }

    @Test
    public void smallBatchKeepsThreeSigmaCut() {
        // fewer than ten frames: cap is zero and the cut is never relaxed
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            values.add(1.0);
        }
        values.add(50.0);
        MetricCut cut = MetricCut.compute("FWHM", values, QualityGate.cap(values.size()));
        assertEquals(0, QualityGate.cap(values.size()));
        assertFalse(cut.isRelaxed());
        assertEquals(cut.getMedian() + 3 * cut.getStd(), cut.getThreshold(), 1e-9);
        assertTrue(cut.rejects(50.0));
        assertFalse(cut.rejects(1.0));
    }

    @Test
    public void rejectionOnEitherMetric() {
        List<QualityMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            metrics.add(new QualityMetric(1.0, 1.1));
        }
        metrics.set(3, new QualityMetric(1.0, 9.0));
        metrics.set(11, new QualityMetric(12.0, 1.1));
        QualityDecision decision = gate.evaluate(metrics);
        assertEquals(Arrays.asList(3, 11), decision.getRejected());
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            names.add("f" + i);
        }
        List<String> selected = decision.select(names);
        assertEquals(18, selected.size());
        assertEquals("f0", selected.get(0));
        assertFalse(selected.contains("f3"));
        assertFalse(selected.contains("f11"));
    }

    @Test
    public void noFramesGivesEmptyDecision() {
        QualityDecision decision = gate.evaluate(Collections.<QualityMetric>emptyList());
        assertTrue(decision.getPassed().isEmpty());
        assertNull(decision.getFwhmCut());
    }
}
