package org.lsst.fits.stacker.quality;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import nom.tam.fits.Header;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.stacker.model.ImageFrame;

public class QualityMeterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ImageFrame frameWithCatalog(String... rows) throws IOException {
        Path frame = folder.getRoot().toPath().resolve("s1_red.fits");
        Path catalog = folder.getRoot().toPath().resolve("s1_red.cat");
        String[] header = {
            "#   1 X_IMAGE                Object position along x",
            "#   2 FWHM_IMAGE             FWHM assuming a gaussian core",
            "#   3 ELONGATION             A_IMAGE/B_IMAGE",
            "#   4 FLAGS                  Extraction flags",
            "#   5 SPREAD_MODEL           Spread parameter from model-fitting"};
        List<String> lines = new ArrayList<>(Arrays.asList(header));
        lines.addAll(Arrays.asList(rows));
        Files.write(catalog, lines, StandardCharsets.US_ASCII);
        return new ImageFrame(frame, new float[8][8], null, new Header(), 59000.0, 30.0);
    }

    @Test
    public void catalogMediansOfCleanPointSources() throws Exception {
        ImageFrame frame = frameWithCatalog(
                "10.0 4.0 1.1 0 0.001",
                "20.0 5.0 1.2 0 -0.002",
                "30.0 6.0 1.3 0 0.003",
                "40.0 30.0 3.0 2 0.001",
                "50.0 40.0 1.0 0 0.5");
        Optional<QualityMetric> metric = new QualityMeter(0.5).measure(frame, null);
        assertTrue(metric.isPresent());
        assertEquals(2.5, metric.get().getFwhm(), 1e-9);
        assertEquals(1.2, metric.get().getElongation(), 1e-9);
    }

    @Test
    public void catalogWithoutCleanSources() throws Exception {
        ImageFrame frame = frameWithCatalog("40.0 30.0 3.0 2 0.001");
        assertFalse(new QualityMeter(0.5).measure(frame, null).isPresent());
    }
}
