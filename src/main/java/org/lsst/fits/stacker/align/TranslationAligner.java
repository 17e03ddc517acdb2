package org.lsst.fits.stacker.align;

import java.awt.Point;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.stats.Segmentation;
import org.lsst.fits.stacker.stats.Source;

/**
 * Aligns frames by a whole pixel translation. The offset of each frame to the
 * reference is found by letting every pair of bright sources vote for the
 * shift that would bring them together; the shift with most votes wins.
 * Pixels shifted in from outside the frame are NaN.
 */
public class TranslationAligner implements FrameAligner {

    private static final Logger LOG = Logger.getLogger(TranslationAligner.class.getName());

    private final Segmentation segmentation;
    private final int maxSources;
    private final int minVotes;

    public TranslationAligner() {
        this(new Segmentation(5.0, 5), 50, 3);
    }

    public TranslationAligner(Segmentation segmentation, int maxSources, int minVotes) {
        this.segmentation = segmentation;
        this.maxSources = maxSources;
        this.minVotes = minVotes;
    }

    @Override
    public List<ImageFrame> align(List<ImageFrame> frames, boolean[][] staticMask) {
        List<ImageFrame> result = new ArrayList<>();
        if (frames.isEmpty()) {
            return result;
        }
        ImageFrame reference = frames.get(0);
        List<Source> referenceSources = brightest(reference, staticMask);
        result.add(reference);
        for (ImageFrame frame : frames.subList(1, frames.size())) {
            if (frame.getWidth() != reference.getWidth() || frame.getHeight() != reference.getHeight()) {
                LOG.log(Level.WARNING, "Dropping {0}: size differs from reference {1}", new Object[]{frame.getPath(), reference.getPath()});
                continue;
            }
            Point shift = findShift(referenceSources, brightest(frame, staticMask));
            if (shift == null) {
                LOG.log(Level.WARNING, "Dropping {0}: no common stars with reference {1}", new Object[]{frame.getPath(), reference.getPath()});
                continue;
            }
            LOG.log(Level.FINE, "Shifting {0} by ({1},{2})", new Object[]{frame.getPath(), shift.x, shift.y});
            result.add(shift(frame, shift));
        }
        return result;
    }

    private List<Source> brightest(ImageFrame frame, boolean[][] staticMask) {
        List<Source> result = new ArrayList<>();
        for (Source source : segmentation.detect(frame.getData())) {
            if (source.touchesEdge()) {
                continue;
            }
            if (staticMask != null && isMasked(staticMask, source)) {
                continue;
            }
            result.add(source);
            if (result.size() == maxSources) {
                break;
            }
        }
        return result;
    }

    private static boolean isMasked(boolean[][] staticMask, Source source) {
        int x = (int) Math.round(source.getX());
        int y = (int) Math.round(source.getY());
        return y >= 0 && y < staticMask.length && x >= 0 && x < staticMask[y].length && staticMask[y][x];
    }

    /**
     * @return The shift to add to frame coordinates to reach reference
     * coordinates, or null if too few sources agree on one
     */
    Point findShift(List<Source> reference, List<Source> frame) {
        Map<Point, Integer> votes = new HashMap<>();
        Point best = null;
        int bestVotes = 0;
        for (Source r : reference) {
            for (Source s : frame) {
                Point shift = new Point((int) Math.round(r.getX() - s.getX()), (int) Math.round(r.getY() - s.getY()));
                int count = votes.merge(shift, 1, Integer::sum);
                if (count > bestVotes) {
                    bestVotes = count;
                    best = shift;
                }
            }
        }
        return bestVotes >= minVotes ? best : null;
    }

    static ImageFrame shift(ImageFrame frame, Point shift) {
        int height = frame.getHeight();
        int width = frame.getWidth();
        float[][] in = frame.getData();
        boolean[][] inMask = frame.getMask();
        float[][] out = new float[height][width];
        boolean[][] outMask = inMask == null ? null : new boolean[height][width];
        for (int y = 0; y < height; y++) {
            int sy = y - shift.y;
            for (int x = 0; x < width; x++) {
                int sx = x - shift.x;
                if (sy < 0 || sy >= height || sx < 0 || sx >= width) {
                    out[y][x] = Float.NaN;
                    if (outMask != null) {
                        outMask[y][x] = true;
                    }
                } else {
                    out[y][x] = in[sy][sx];
                    if (outMask != null) {
                        outMask[y][x] = inMask[sy][sx];
                    }
                }
            }
        }
        return new ImageFrame(frame.getPath(), out, outMask, frame.getHeader(), frame.getTime(), frame.getExposure());
    }
}
