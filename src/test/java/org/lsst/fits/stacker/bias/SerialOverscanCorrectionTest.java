package org.lsst.fits.stacker.bias;

import java.awt.Rectangle;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class SerialOverscanCorrectionTest {

    @Test
    public void rowLevelIsSubtractedAndFrameTrimmed() {
        float[][] data = new float[3][8];
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 8; x++) {
                data[y][x] = x < 4 ? 10 + y : 50 + y;
            }
        }
        float[][] result = new SerialOverscanCorrection(0, 4, 1).apply(data, new Rectangle(4, 0, 4, 3));
        assertEquals(3, result.length);
        assertEquals(4, result[0].length);
        for (float[] row : result) {
            for (float v : row) {
                assertEquals(40.0f, v, 1e-6f);
            }
        }
    }

    @Test
    public void nullCorrectionOnlyTrims() {
        float[][] data = {{1, 2, 3}, {4, 5, 6}};
        float[][] result = new NullOverscanCorrection().apply(data, new Rectangle(1, 1, 2, 1));
        assertEquals(1, result.length);
        assertEquals(5.0f, result[0][0], 0);
        assertEquals(6.0f, result[0][1], 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyOverscanRegion() {
        new SerialOverscanCorrection(4, 4, 1);
    }
}
