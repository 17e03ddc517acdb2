package org.lsst.fits.stacker.phot;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.stacker.FrameFixtures;

public class AperturePhotometerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static float[][] field() {
        float[][] data = new float[41][41];
        for (float[] row : data) {
            Arrays.fill(row, 10);
        }
        data[20][20] += 100;
        return data;
    }

    @Test
    public void fluxAboveSky() {
        double[] result = AperturePhotometer.measureStar(field(), 20, 20, 3, 6, 9);
        assertEquals(100.0, result[0], 1e-6);
        assertEquals(10.0, result[1], 1e-6);
        assertEquals(10.0, result[2], 1e-6);
    }

    @Test
    public void apertureOffImage() {
        assertNull(AperturePhotometer.measureStar(field(), 1, 20, 3, 6, 9));
    }

    @Test
    public void tableListsEveryStar() throws Exception {
        Path stack = FrameFixtures.write(folder.getRoot().toPath().resolve("M31_V_A_1x1.fits"), FrameFixtures.starField(64, 0, 0, 100));
        Path table = new AperturePhotometer().measure(stack, Arrays.asList("SDSS", "PS1"));
        assertEquals(stack.resolveSibling("M31_V_A_1x1.pcmp"), table);
        List<String> lines = Files.readAllLines(table, StandardCharsets.US_ASCII);
        assertTrue(lines.contains("# REFCAT = SDSS,PS1"));
        int rows = 0;
        for (String line : lines) {
            if (!line.startsWith("#")) {
                rows++;
            }
        }
        assertEquals(6, rows);
        // brightest star first, 1 based coordinates
        assertTrue(lines.get(5).startsWith("21.000 19.000 "));
    }
}
