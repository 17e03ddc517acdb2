package org.lsst.fits.stacker.calib;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.stacker.model.CalibrationKey;

/**
 * What happened to each calibration group during a run.
 */
public class CalibrationReport {

    private static final Logger LOG = Logger.getLogger(CalibrationReport.class.getName());

    public enum Outcome {
        BUILT, REUSED, SKIPPED, FAILED
    }

    private final Map<CalibrationKey, Outcome> outcomes = new LinkedHashMap<>();
    private final Map<CalibrationKey, String> reasons = new LinkedHashMap<>();

    void record(CalibrationKey key, Outcome outcome, String reason) {
        outcomes.put(key, outcome);
        if (reason != null) {
            reasons.put(key, reason);
        }
    }

    public Outcome getOutcome(CalibrationKey key) {
        return outcomes.get(key);
    }

    public String getReason(CalibrationKey key) {
        return reasons.get(key);
    }

    public Map<CalibrationKey, Outcome> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public int count(Outcome outcome) {
        return (int) outcomes.values().stream().filter(o -> o == outcome).count();
    }

    public void log() {
        LOG.log(Level.INFO, "Calibration masters: {0} built, {1} reused, {2} skipped, {3} failed",
                new Object[]{count(Outcome.BUILT), count(Outcome.REUSED), count(Outcome.SKIPPED), count(Outcome.FAILED)});
        reasons.forEach((key, reason) -> LOG.log(Level.INFO, "{0} {1}: {2}", new Object[]{key, outcomes.get(key), reason}));
    }
}
