package org.lsst.fits.stacker.sky;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.stats.BoxBackground;
import org.lsst.fits.stacker.stats.SigmaClippedCombiner;

/**
 * Optical fringe correction. All frames of a group, with their sources
 * filled in by a background estimate, are median combined into one fringe
 * map which is subtracted from each of them.
 */
public class FringeCorrector {

    private static final Logger LOG = Logger.getLogger(FringeCorrector.class.getName());

    private final BoxBackground background;
    private final SigmaClippedCombiner combiner;

    public FringeCorrector() {
        this(new BoxBackground(), new SigmaClippedCombiner());
    }

    public FringeCorrector(BoxBackground background, SigmaClippedCombiner combiner) {
        this.background = background;
        this.combiner = combiner;
    }

    public static Path getFringeMapPath(Path redPath, Configuration configuration) {
        return redPath.resolve("fringe_map_" + configuration.key() + ".fits");
    }

    /**
     * @return New frames with the fringe map subtracted, in input order
     */
    public List<ImageFrame> correct(List<ImageFrame> frames, Configuration configuration, Path redPath) throws IOException, FitsException {
        List<float[][]> filled = new ArrayList<>();
        List<boolean[][]> masks = new ArrayList<>();
        for (ImageFrame frame : frames) {
            filled.add(background.fillMasked(frame.getData(), frame.getMask()));
            masks.add(frame.getMask());
        }
        float[][] fringe = combiner.combine(filled, masks);
        Header header = new Header();
        header.addValue("NCOMBINE", frames.size(), "Number of frames in fringe map");
        Path output = getFringeMapPath(redPath, configuration);
        FitsImages.writeImage(output, fringe, header);
        LOG.log(Level.INFO, "Wrote fringe map {0} from {1} frames", new Object[]{output, frames.size()});
        List<ImageFrame> result = new ArrayList<>();
        for (ImageFrame frame : frames) {
            result.add(frame.withData(SkyEstimator.minus(frame.getData(), fringe)));
        }
        return result;
    }
}
