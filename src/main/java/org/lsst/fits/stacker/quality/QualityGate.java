package org.lsst.fits.stacker.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rejects frames with poor seeing or tracking before they are stacked. A
 * frame is rejected when its FWHM or its elongation is above the cut for
 * that metric (see {@link MetricCut}). The cap is ten percent of the frames,
 * rounded down; below ten frames it is zero and the three sigma cuts are
 * used as they are.
 */
public class QualityGate {

    private static final Logger LOG = Logger.getLogger(QualityGate.class.getName());

    public static int cap(int frames) {
        return frames / 10;
    }

    public QualityDecision evaluate(List<QualityMetric> metrics) {
        List<Integer> passed = new ArrayList<>();
        List<Integer> rejected = new ArrayList<>();
        if (metrics.isEmpty()) {
            return new QualityDecision(passed, rejected, null, null);
        }
        List<Double> fwhm = new ArrayList<>();
        List<Double> elongation = new ArrayList<>();
        for (QualityMetric metric : metrics) {
            fwhm.add(metric.getFwhm());
            elongation.add(metric.getElongation());
        }
        int cap = cap(metrics.size());
        MetricCut fwhmCut = MetricCut.compute("FWHM", fwhm, cap);
        MetricCut elongationCut = MetricCut.compute("Elongation", elongation, cap);
        LOG.log(Level.INFO, "{0}", fwhmCut);
        LOG.log(Level.INFO, "{0}", elongationCut);
        if (fwhmCut.isRelaxed() || elongationCut.isRelaxed()) {
            LOG.log(Level.INFO, "More than {0} of {1} frames are poor, restricting cuts to ten percent", new Object[]{cap, metrics.size()});
        }
        for (int i = 0; i < metrics.size(); i++) {
            QualityMetric metric = metrics.get(i);
            if (fwhmCut.rejects(metric.getFwhm()) || elongationCut.rejects(metric.getElongation())) {
                rejected.add(i);
            } else {
                passed.add(i);
            }
        }
        return new QualityDecision(passed, rejected, fwhmCut, elongationCut);
    }
}
