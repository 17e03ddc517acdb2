package org.lsst.fits.stacker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of sorting raw frames: calibration groups, science groups and,
 * for near-infrared instruments, sky groups (all science frames of one
 * configuration, whatever the target).
 * <p>
 * Groups are only ever built through {@link Builder#add(RawFrame)}, both when
 * classifying raw files and when reloading a manifest, so the two paths
 * produce the same groups for the same frames.
 */
public class FrameGroups {

    private final Map<CalibrationKey, List<RawFrame>> calibration;
    private final Map<ScienceKey, ScienceGroup> science;
    private final Map<Configuration, List<RawFrame>> sky;
    private final int specCount;
    private final int badCount;

    private FrameGroups(Builder builder) {
        this.calibration = builder.calibration;
        this.science = builder.science;
        this.sky = builder.sky;
        this.specCount = builder.specCount;
        this.badCount = builder.badCount;
    }

    public static Builder builder(boolean nearInfrared) {
        return new Builder(nearInfrared);
    }

    public Map<CalibrationKey, List<RawFrame>> getCalibrationGroups() {
        return Collections.unmodifiableMap(calibration);
    }

    public Map<CalibrationKey, List<RawFrame>> getCalibrationGroups(FrameType type) {
        Map<CalibrationKey, List<RawFrame>> result = new LinkedHashMap<>();
        calibration.forEach((key, frames) -> {
            if (key.getType() == type) {
                result.put(key, frames);
            }
        });
        return result;
    }

    public Map<ScienceKey, ScienceGroup> getScienceGroups() {
        return Collections.unmodifiableMap(science);
    }

    public Map<Configuration, List<RawFrame>> getSkyGroups() {
        return Collections.unmodifiableMap(sky);
    }

    /**
     * @return The number of bias frames over all bias groups, zero if there
     * are none
     */
    public int getBiasFrameCount() {
        return countFrames(FrameType.BIAS);
    }

    public int countFrames(FrameType type) {
        return getCalibrationGroups(type).values().stream().mapToInt(List::size).sum();
    }

    public int getScienceFrameCount() {
        return science.values().stream().mapToInt(ScienceGroup::size).sum();
    }

    public int getSpecCount() {
        return specCount;
    }

    public int getBadCount() {
        return badCount;
    }

    public boolean hasScience() {
        return !science.isEmpty();
    }

    @Override
    public String toString() {
        return "FrameGroups{" + "calibration=" + calibration.keySet() + ", science=" + science.keySet() + ", sky=" + sky.keySet() + '}';
    }

    public static class Builder {

        private final boolean nearInfrared;
        private final Map<CalibrationKey, List<RawFrame>> calibration = new LinkedHashMap<>();
        private final Map<ScienceKey, ScienceGroup> science = new LinkedHashMap<>();
        private final Map<Configuration, List<RawFrame>> sky = new LinkedHashMap<>();
        private int specCount;
        private int badCount;

        private Builder(boolean nearInfrared) {
            this.nearInfrared = nearInfrared;
        }

        public Builder add(RawFrame frame) {
            switch (frame.getType()) {
                case BIAS:
                case DARK:
                case FLAT:
                    calibration.computeIfAbsent(CalibrationKey.of(frame), k -> new ArrayList<>()).add(frame);
                    break;
                case SCIENCE:
                    ScienceKey key = new ScienceKey(frame.getTarget(), frame.getConfiguration());
                    science.computeIfAbsent(key, ScienceGroup::new).add(frame);
                    if (nearInfrared) {
                        sky.computeIfAbsent(frame.getConfiguration(), k -> new ArrayList<>()).add(frame);
                    }
                    break;
                case SPEC:
                    specCount++;
                    break;
                default:
                    badCount++;
            }
            return this;
        }

        public FrameGroups build() {
            return new FrameGroups(this);
        }
    }
}
