package org.lsst.fits.stacker.stack;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import static org.junit.Assert.assertEquals;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.stacker.model.ImageFrame;

public class StackBuilderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void midTimeIsMidpointOfRange() {
        assertEquals(10.6, StackBuilder.midTime(Arrays.asList(10.5, 11.2, 10.0)), 1e-12);
        assertEquals(3.0, StackBuilder.midTime(Arrays.asList(3.0)), 0);
    }

    @Test
    public void readNoiseScalesWithFrameCount() {
        assertEquals(2.5, StackBuilder.effectiveReadNoise(5.0, 4), 1e-12);
        assertEquals(5.0, StackBuilder.effectiveReadNoise(5.0, 1), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void readNoiseNeedsFrames() {
        StackBuilder.effectiveReadNoise(5.0, 0);
    }

    @Test
    public void buildAndWrite() throws Exception {
        List<ImageFrame> frames = new ArrayList<>();
        double[] times = {10.0, 10.5, 11.2};
        for (int i = 0; i < times.length; i++) {
            float[][] data = new float[4][5];
            for (float[] row : data) {
                Arrays.fill(row, i + 1);
            }
            Path path = folder.getRoot().toPath().resolve("f" + i + "_red.fits");
            frames.add(new ImageFrame(path, data, null, new Header(), times[i], 30.0));
        }
        StackBuilder builder = new StackBuilder();
        StackResult result = builder.build(frames, 6.0);
        assertEquals(3, result.getFrameCount());
        assertEquals(10.6, result.getMidTime(), 1e-12);
        assertEquals(90.0, result.getTotalExposure(), 1e-12);
        assertEquals(6.0 / Math.sqrt(3), result.getReadNoise(), 1e-12);
        assertEquals(2.0f, result.getData()[2][3], 0);

        Header template = new Header();
        template.addValue("OBJECT", "M31", "Target");
        Path output = folder.getRoot().toPath().resolve("M31_V.fits");
        builder.write(result, output, template);

        try (Fits fits = new Fits(output.toFile())) {
            Header header = fits.getHDU(0).getHeader();
            assertEquals(10.6, header.getDoubleValue("MJD-OBS"), 1e-9);
            assertEquals(90.0, header.getDoubleValue("EXPTOT"), 1e-9);
            assertEquals(1, header.getIntValue("EXPTIME"));
            assertEquals(3, header.getIntValue("NFILES"));
            assertEquals("f0_red.fits", header.getStringValue("IMCMB001"));
            assertEquals("M31", header.getStringValue("OBJECT"));
        }
    }
}
