package org.lsst.fits.stacker.stats;

import java.util.Arrays;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class StatisticsTest {

    @Test
    public void medianOfOddAndEven() {
        assertEquals(2.0, Statistics.median(new double[]{3, 1, 2}), 0);
        assertEquals(2.5, Statistics.median(new double[]{4, 1, 3, 2}), 0);
        assertTrue(Double.isNaN(Statistics.median(new double[0])));
    }

    @Test
    public void populationStd() {
        assertEquals(2.0, Statistics.std(Arrays.asList(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0)), 1e-12);
    }

    @Test
    public void sigmaClipDropsOutlier() {
        double[] values = new double[21];
        for (int i = 0; i < 20; i++) {
            values[i] = 10 + (i % 3);
        }
        values[20] = 1000;
        int n = Statistics.sigmaClip(values, values.length, 3.0, 5);
        assertEquals(20, n);
        for (int i = 0; i < n; i++) {
            assertTrue(values[i] < 100);
        }
    }

    @Test
    public void clippedStatsHonourMask() {
        float[][] data = {{1, 1, 1}, {1, 1, 500}};
        boolean[][] mask = {{false, false, false}, {false, false, true}};
        double[] stats = Statistics.clippedStats(data, mask, 3.0, 5);
        assertEquals(1.0, stats[0], 0);
        assertEquals(1.0, stats[1], 0);
        assertEquals(0.0, stats[2], 0);
    }
}
