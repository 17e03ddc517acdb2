package org.lsst.fits.stacker.sky;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.FrameType;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.stats.BoxBackground;
import org.lsst.fits.stacker.stats.SigmaClippedCombiner;

public class SkyEstimatorTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final List<Double> times = Arrays.asList(0.0, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0);

    @Test
    public void nearestIncludesFrameItself() {
        int[] selected = SkyEstimator.selectNearest(times, 4, 5);
        assertEquals(4, selected[0]);
        assertArrayEquals(new int[]{4, 3, 5, 2, 6}, selected);
    }

    @Test
    public void nearestAtStartOfSequence() {
        assertArrayEquals(new int[]{0, 1, 2, 3, 4}, SkyEstimator.selectNearest(times, 0, 5));
    }

    @Test
    public void tiesGoToLowerIndex() {
        List<Double> uneven = Arrays.asList(0.0, 2.0, 4.0, 4.0, 6.0);
        assertArrayEquals(new int[]{1, 0, 2, 3}, SkyEstimator.selectNearest(uneven, 1, 4));
    }

    @Test
    public void fewerFramesThanRequested() {
        assertArrayEquals(new int[]{1, 0, 2}, SkyEstimator.selectNearest(Arrays.asList(0.0, 1.0, 2.0), 1, 5));
    }

    @Test
    public void skyIsMedianOfNearestFrames() throws Exception {
        Path red = folder.getRoot().toPath();
        Configuration j = new Configuration("J", "1", "1x1");
        List<RawFrame> sources = new ArrayList<>();
        List<ImageFrame> frames = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            Path raw = red.resolve("sci" + i + ".fits");
            sources.add(new RawFrame(raw, "M31", j, "30.0", FrameType.SCIENCE, 59000.0 + i / 1440.0));
            float[][] data = new float[8][8];
            for (float[] row : data) {
                Arrays.fill(row, 10 * (i + 1));
            }
            frames.add(new ImageFrame(red.resolve("sci" + i + "_red.fits"), data, null, new Header(), 59000.0 + i / 1440.0, 30.0));
        }
        SkyEstimator estimator = new SkyEstimator(5, new BoxBackground(4, 1, 3.0, 0.8), new SigmaClippedCombiner(3.0, 5));
        List<ImageFrame> subtracted = estimator.subtract(sources, frames, red);

        assertEquals(7, subtracted.size());
        // frames 0..4 give a sky of 30
        assertEquals(-20.0f, subtracted.get(0).getData()[3][3], 1e-4f);
        // frames 3, 2, 4, 1, 5 give a sky of 40
        assertEquals(0.0f, subtracted.get(3).getData()[0][0], 1e-4f);
        assertEquals(red.resolve("sci3_red.fits"), subtracted.get(3).getPath());

        try (Fits fits = new Fits(red.resolve("sci0_sky.fits").toFile())) {
            Header header = fits.getHDU(0).getHeader();
            assertEquals("sci0.fits", header.getStringValue("FILE"));
            assertEquals("sci0.fits", header.getStringValue("FILE1"));
            assertEquals("sci4.fits", header.getStringValue("FILE5"));
        }
    }
}
