package org.lsst.fits.stacker.stack;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.stats.SigmaClippedCombiner;

/**
 * Combines the frames that passed the quality gate into a sigma clipped
 * median stack. The stack is in counts per second, so it is written with
 * EXPTIME and GAIN of one and the total exposure in EXPTOT.
 */
public class StackBuilder {

    private static final Logger LOG = Logger.getLogger(StackBuilder.class.getName());

    private final SigmaClippedCombiner combiner;

    public StackBuilder() {
        this(new SigmaClippedCombiner());
    }

    public StackBuilder(SigmaClippedCombiner combiner) {
        this.combiner = combiner;
    }

    /**
     * @return min + (max - min) / 2
     */
    public static double midTime(Collection<Double> times) {
        if (times.isEmpty()) {
            throw new IllegalArgumentException("No observation times");
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double t : times) {
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        return min + (max - min) / 2;
    }

    public static double effectiveReadNoise(double baseReadNoise, int frameCount) {
        if (frameCount < 1) {
            throw new IllegalArgumentException("No frames");
        }
        return baseReadNoise / Math.sqrt(frameCount);
    }

    public static double totalExposure(Collection<Double> exposures) {
        double total = 0;
        for (double exposure : exposures) {
            total += exposure;
        }
        return total;
    }

    /**
     * @param frames The passing frames, aligned
     * @param baseReadNoise Read noise of a single frame
     * @return The stack
     * @throws IllegalArgumentException If there are no frames
     */
    public StackResult build(List<ImageFrame> frames, double baseReadNoise) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("No frames to stack");
        }
        List<float[][]> images = new ArrayList<>();
        List<Double> times = new ArrayList<>();
        List<Double> exposures = new ArrayList<>();
        List<Path> paths = new ArrayList<>();
        for (ImageFrame frame : frames) {
            images.add(frame.getData());
            times.add(frame.getTime());
            exposures.add(frame.getExposure());
            paths.add(frame.getPath());
        }
        float[][] data = combiner.combine(images);
        return new StackResult(data, midTime(times), totalExposure(exposures), effectiveReadNoise(baseReadNoise, frames.size()), paths);
    }

    /**
     * Write a stack with its derived header cards.
     *
     * @param result The stack
     * @param output The file to write
     * @param template Header whose descriptive cards are carried over, or
     * null
     */
    public void write(StackResult result, Path output, Header template) throws IOException, FitsException {
        Header header = new Header();
        header.addValue("MJD-OBS", result.getMidTime(), "Mid-MJD of the observation sequence");
        header.addValue("EXPTIME", 1, "Effective exposure time of the stack in seconds");
        header.addValue("EXPTOT", result.getTotalExposure(), "Total exposure time of the stack in seconds");
        header.addValue("GAIN", 1, "Effective gain of the stack");
        header.addValue("RDNOISE", result.getReadNoise(), "Read noise of the stack");
        header.addValue("NFILES", result.getFrameCount(), "Number of images in the stack");
        List<Path> frames = result.getFrames();
        for (int i = 0; i < frames.size(); i++) {
            header.addValue(String.format("IMCMB%03d", i + 1), frames.get(i).getFileName().toString(), "Image in the stack");
        }
        if (template != null) {
            FitsImages.copyCards(template, header);
        }
        FitsImages.writeImage(output, result.getData(), header);
        LOG.log(Level.INFO, "Median stack of {0} frames written to {1}", new Object[]{result.getFrameCount(), output});
    }
}
