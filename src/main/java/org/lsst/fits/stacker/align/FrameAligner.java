package org.lsst.fits.stacker.align;

import java.util.List;
import org.lsst.fits.stacker.model.ImageFrame;

/**
 * Registers a list of calibrated frames onto a common pixel grid.
 */
public interface FrameAligner {

    /**
     * @param frames The frames to align, the first one is the reference
     * @param staticMask Pixels to ignore when detecting stars, or null
     * @return The aligned frames, in input order. Frames that could not be
     * registered are left out.
     */
    List<ImageFrame> align(List<ImageFrame> frames, boolean[][] staticMask);
}
