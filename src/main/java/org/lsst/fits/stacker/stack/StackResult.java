package org.lsst.fits.stacker.stack;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * A median stack and the values derived from the frames that went into it.
 */
public class StackResult {

    private final float[][] data;
    private final double midTime;
    private final double totalExposure;
    private final double readNoise;
    private final List<Path> frames;

    StackResult(float[][] data, double midTime, double totalExposure, double readNoise, List<Path> frames) {
        this.data = data;
        this.midTime = midTime;
        this.totalExposure = totalExposure;
        this.readNoise = readNoise;
        this.frames = Collections.unmodifiableList(frames);
    }

    public float[][] getData() {
        return data;
    }

    /**
     * @return Midpoint between the first and last observation time, MJD
     */
    public double getMidTime() {
        return midTime;
    }

    /**
     * @return Sum of the exposure times, seconds
     */
    public double getTotalExposure() {
        return totalExposure;
    }

    public double getReadNoise() {
        return readNoise;
    }

    public int getFrameCount() {
        return frames.size();
    }

    public List<Path> getFrames() {
        return frames;
    }

    @Override
    public String toString() {
        return "StackResult{" + "midTime=" + midTime + ", totalExposure=" + totalExposure + ", readNoise=" + readNoise + ", frames=" + frames.size() + '}';
    }
}
