package org.lsst.fits.stacker.sky;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.stats.BoxBackground;
import org.lsst.fits.stacker.stats.SigmaClippedCombiner;

/**
 * Near-infrared sky subtraction. The sky of each frame is the sigma clipped
 * median of the frames closest to it in time, the frame itself included,
 * with their sources filled in by a background estimate. Every sky is built
 * from the frames as they were before any subtraction.
 */
public class SkyEstimator {

    private static final Logger LOG = Logger.getLogger(SkyEstimator.class.getName());

    private final int skyFrames;
    private final BoxBackground background;
    private final SigmaClippedCombiner combiner;

    public SkyEstimator() {
        this(Integer.getInteger("org.lsst.fits.stacker.skyFrames", 5), new BoxBackground(), new SigmaClippedCombiner());
    }

    public SkyEstimator(int skyFrames, BoxBackground background, SigmaClippedCombiner combiner) {
        if (skyFrames < 1) {
            throw new IllegalArgumentException("Need at least one sky frame");
        }
        this.skyFrames = skyFrames;
        this.background = background;
        this.combiner = combiner;
    }

    /**
     * Indices of the frames nearest in time to one frame, nearest first.
     * Ties go to the lower index. The frame itself has distance zero and is
     * always selected first.
     *
     * @param times Observation times of all frames
     * @param index The frame to select for
     * @param count How many to select, capped at the number of frames
     * @return The selected indices
     */
    public static int[] selectNearest(List<Double> times, int index, int count) {
        double t = times.get(index);
        Integer[] order = new Integer[times.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(k -> Math.abs(times.get(k) - t)).thenComparingInt(k -> k));
        int n = Math.min(count, order.length);
        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = order[i];
        }
        return result;
    }

    /**
     * Subtract a sky from every frame and write each sky to
     * {@code <name>_sky.fits}.
     *
     * @param sources The raw frames, giving names and observation times
     * @param frames The calibrated frames, parallel to sources, with source
     * masks
     * @param redPath Where the skies are written
     * @return New sky subtracted frames, in input order
     */
    public List<ImageFrame> subtract(List<RawFrame> sources, List<ImageFrame> frames, Path redPath) throws IOException, FitsException {
        if (sources.size() != frames.size()) {
            throw new IllegalArgumentException("Got " + frames.size() + " frames for " + sources.size() + " sources");
        }
        List<Double> times = new ArrayList<>();
        List<float[][]> filled = new ArrayList<>();
        List<boolean[][]> masks = new ArrayList<>();
        for (int k = 0; k < frames.size(); k++) {
            times.add(sources.get(k).getTime());
            ImageFrame frame = frames.get(k);
            filled.add(background.fillMasked(frame.getData(), frame.getMask()));
            masks.add(frame.getMask());
        }
        List<ImageFrame> result = new ArrayList<>();
        for (int i = 0; i < frames.size(); i++) {
            int[] selected = selectNearest(times, i, skyFrames);
            List<float[][]> images = new ArrayList<>();
            List<boolean[][]> selectedMasks = new ArrayList<>();
            Header header = new Header();
            header.addValue("FILE", sources.get(i).getFileName(), "NIR sky for file");
            for (int j = 0; j < selected.length; j++) {
                images.add(filled.get(selected[j]));
                selectedMasks.add(masks.get(selected[j]));
                header.addValue("FILE" + (j + 1), sources.get(selected[j]).getFileName(), "File used in creation of sky");
            }
            float[][] sky = combiner.combine(images, selectedMasks);
            FitsImages.writeImage(redPath.resolve(FitsImages.baseName(sources.get(i).getPath()) + "_sky.fits"), sky, header);
            result.add(frames.get(i).withData(minus(frames.get(i).getData(), sky)));
            LOG.log(Level.FINE, "Sky for {0} from {1} frames", new Object[]{sources.get(i).getFileName(), selected.length});
        }
        return result;
    }

    static float[][] minus(float[][] data, float[][] sky) {
        float[][] result = new float[data.length][];
        for (int y = 0; y < data.length; y++) {
            result[y] = new float[data[y].length];
            for (int x = 0; x < data[y].length; x++) {
                result[y][x] = data[y][x] - sky[y][x];
            }
        }
        return result;
    }
}
