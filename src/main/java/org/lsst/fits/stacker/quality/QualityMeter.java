package org.lsst.fits.stacker.quality;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.io.SourceCatalog;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.stats.Statistics;

/**
 * Gives the quality metric of an aligned frame. If a SExtractor catalog
 * ({@code <name>.cat}) exists next to the reduced frame, the medians of its
 * clean point sources are used: FLAGS == 0 and |SPREAD_MODEL| &lt; 0.01.
 * Otherwise the stars are measured from the pixels.
 */
public class QualityMeter {

    private static final Logger LOG = Logger.getLogger(QualityMeter.class.getName());
    private static final double MAX_SPREAD = 0.01;

    private final double pixelScale;
    private final StarMeasurer measurer;

    public QualityMeter(double pixelScale) {
        this(pixelScale, new StarMeasurer());
    }

    public QualityMeter(double pixelScale, StarMeasurer measurer) {
        this.pixelScale = pixelScale;
        this.measurer = measurer;
    }

    /**
     * @param frame The aligned frame
     * @param staticMask Pixels to ignore, or null
     * @return The metric, or empty if the frame has no usable stars
     * @throws IOException If a catalog exists but cannot be read
     */
    public Optional<QualityMetric> measure(ImageFrame frame, boolean[][] staticMask) throws IOException {
        Path catalog = frame.getPath().resolveSibling(FitsImages.baseName(frame.getPath()) + ".cat");
        Optional<QualityMetric> result;
        if (Files.exists(catalog)) {
            result = fromCatalog(SourceCatalog.read(catalog));
        } else {
            result = measurer.measure(frame.getData(), staticMask, pixelScale);
        }
        if (result.isPresent()) {
            LOG.log(Level.INFO, "{0}: FWHM {1}\" elongation {2}", new Object[]{frame.getPath().getFileName(), result.get().getFwhm(), result.get().getElongation()});
        }
        return result;
    }

    Optional<QualityMetric> fromCatalog(SourceCatalog catalog) throws IOException {
        if (!catalog.hasColumn("FWHM_IMAGE") || !catalog.hasColumn("ELONGATION")) {
            throw new IOException("Catalog " + catalog.getFile() + " lacks FWHM_IMAGE or ELONGATION");
        }
        boolean flags = catalog.hasColumn("FLAGS");
        boolean spread = catalog.hasColumn("SPREAD_MODEL");
        List<Double> fwhm = new ArrayList<>();
        List<Double> elongation = new ArrayList<>();
        for (int row = 0; row < catalog.size(); row++) {
            if (flags && catalog.get(row, "FLAGS") != 0) {
                continue;
            }
            if (spread && !(Math.abs(catalog.get(row, "SPREAD_MODEL")) < MAX_SPREAD)) {
                continue;
            }
            fwhm.add(catalog.get(row, "FWHM_IMAGE"));
            elongation.add(catalog.get(row, "ELONGATION"));
        }
        if (fwhm.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new QualityMetric(Statistics.median(fwhm) * pixelScale, Statistics.median(elongation)));
    }
}
