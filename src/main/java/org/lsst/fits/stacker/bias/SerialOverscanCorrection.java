package org.lsst.fits.stacker.bias;

import java.awt.Rectangle;
import java.util.Arrays;
import org.lsst.fits.stacker.stats.Statistics;

/**
 * Row by row overscan correction. For every row the clipped mean of a fixed
 * band of overscan columns is subtracted from the pixels of that row. The
 * per-row levels are smoothed with a running median to suppress read noise.
 */
public class SerialOverscanCorrection implements OverscanCorrection {

    private final int firstColumn;
    private final int lastColumn;
    private final int smoothing;

    /**
     * @param firstColumn First overscan column (0 based, inclusive)
     * @param lastColumn Last overscan column (exclusive)
     * @param smoothing Width of the running median over rows, 1 for none
     */
    public SerialOverscanCorrection(int firstColumn, int lastColumn, int smoothing) {
        if (lastColumn <= firstColumn) {
            throw new IllegalArgumentException("Empty overscan region");
        }
        this.firstColumn = firstColumn;
        this.lastColumn = lastColumn;
        this.smoothing = Math.max(1, smoothing);
    }

    @Override
    public CorrectionFactors compute(float[][] data, Rectangle datasec) {
        int nRows = data.length;
        double[] rowLevel = new double[nRows];
        double[] values = new double[lastColumn - firstColumn];
        for (int y = 0; y < nRows; y++) {
            int n = 0;
            for (int x = firstColumn; x < Math.min(lastColumn, data[y].length); x++) {
                values[n++] = data[y][x];
            }
            n = Statistics.sigmaClip(values, n, 3.0, 3);
            rowLevel[y] = Statistics.mean(values, n);
        }
        float[] smoothed = new float[nRows];
        int half = smoothing / 2;
        double[] window = new double[smoothing];
        for (int y = 0; y < nRows; y++) {
            int n = 0;
            for (int j = Math.max(0, y - half); j <= Math.min(nRows - 1, y + half); j++) {
                window[n++] = rowLevel[j];
            }
            smoothed[y] = (float) Statistics.median(window, n);
        }
        return new RowCorrectionFactors(smoothed);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SerialOverscanCorrection other = (SerialOverscanCorrection) obj;
        return firstColumn == other.firstColumn && lastColumn == other.lastColumn && smoothing == other.smoothing;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + firstColumn;
        hash = 19 * hash + lastColumn;
        hash = 19 * hash + smoothing;
        return hash;
    }

    public static class RowCorrectionFactors implements CorrectionFactors {

        private final float[] rowLevel;

        private RowCorrectionFactors(float[] rowLevel) {
            this.rowLevel = rowLevel;
        }

        @Override
        public float correctionFactor(int x, int y) {
            return rowLevel[y];
        }

        @Override
        public String toString() {
            return "RowCorrectionFactors{" + "rowLevel=" + Arrays.toString(rowLevel) + '}';
        }
    }
}
