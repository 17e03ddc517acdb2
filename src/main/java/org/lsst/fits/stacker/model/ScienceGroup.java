package org.lsst.fits.stacker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The science frames of one target and configuration, with their observation
 * times. Frames and times are kept in two parallel lists that can only grow
 * together.
 */
public class ScienceGroup {

    private final ScienceKey key;
    private final List<RawFrame> frames = new ArrayList<>();
    private final List<Double> times = new ArrayList<>();

    public ScienceGroup(ScienceKey key) {
        this.key = key;
    }

    void add(RawFrame frame) {
        if (frame.getType() != FrameType.SCIENCE || frame.getTime() == null) {
            throw new IllegalArgumentException("Not a timed science frame: " + frame);
        }
        frames.add(frame);
        times.add(frame.getTime());
    }

    public ScienceKey getKey() {
        return key;
    }

    public List<RawFrame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public List<Double> getTimes() {
        return Collections.unmodifiableList(times);
    }

    public int size() {
        return frames.size();
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 41 * hash + Objects.hashCode(this.key);
        hash = 41 * hash + Objects.hashCode(this.frames);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ScienceGroup other = (ScienceGroup) obj;
        return Objects.equals(this.key, other.key)
                && Objects.equals(this.frames, other.frames)
                && Objects.equals(this.times, other.times);
    }

    @Override
    public String toString() {
        return "ScienceGroup{" + "key=" + key + ", frames=" + frames.size() + '}';
    }
}
