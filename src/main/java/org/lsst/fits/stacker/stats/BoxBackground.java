package org.lsst.fits.stacker.stats;

import java.util.Arrays;

/**
 * Two dimensional background estimate. The image is divided into square
 * boxes; each box gets the sigma-clipped mean of its unmasked pixels. Boxes
 * with too many masked pixels are replaced by the median of the good boxes,
 * then the grid of box values is median filtered. Each pixel takes the value
 * of the box it falls in.
 */
public class BoxBackground {

    private final int boxSize;
    private final int filterSize;
    private final double sigma;
    private final double excludeFraction;

    public BoxBackground() {
        this(Integer.getInteger("org.lsst.fits.stacker.backgroundBox", 20), 3, 3.0, 0.8);
    }

    /**
     * @param boxSize Box side in pixels
     * @param filterSize Side of the median filter applied to the box grid
     * @param sigma Clipping threshold for the per-box mean
     * @param excludeFraction Boxes with more than this fraction of masked
     * pixels are rejected
     */
    public BoxBackground(int boxSize, int filterSize, double sigma, double excludeFraction) {
        if (boxSize < 1 || filterSize < 1) {
            throw new IllegalArgumentException("Box and filter size must be positive");
        }
        this.boxSize = boxSize;
        this.filterSize = filterSize;
        this.sigma = sigma;
        this.excludeFraction = excludeFraction;
    }

    public float[][] estimate(float[][] data, boolean[][] mask) {
        int height = data.length;
        int width = height == 0 ? 0 : data[0].length;
        int ny = (height + boxSize - 1) / boxSize;
        int nx = (width + boxSize - 1) / boxSize;
        double[][] grid = new double[ny][nx];
        double[] values = new double[boxSize * boxSize];
        double[] good = new double[nx * ny];
        int nGood = 0;
        for (int by = 0; by < ny; by++) {
            for (int bx = 0; bx < nx; bx++) {
                int total = 0;
                int n = 0;
                for (int y = by * boxSize; y < Math.min(height, (by + 1) * boxSize); y++) {
                    for (int x = bx * boxSize; x < Math.min(width, (bx + 1) * boxSize); x++) {
                        total++;
                        float v = data[y][x];
                        if ((mask == null || !mask[y][x]) && !Float.isNaN(v)) {
                            values[n++] = v;
                        }
                    }
                }
                if (n == 0 || (total - n) > excludeFraction * total) {
                    grid[by][bx] = Double.NaN;
                } else {
                    n = Statistics.sigmaClip(values, n, sigma, 10);
                    grid[by][bx] = Statistics.mean(values, n);
                    good[nGood++] = grid[by][bx];
                }
            }
        }
        double fill = nGood == 0 ? 0 : Statistics.median(Arrays.copyOf(good, nGood));
        for (double[] row : grid) {
            for (int i = 0; i < row.length; i++) {
                if (Double.isNaN(row[i])) {
                    row[i] = fill;
                }
            }
        }
        double[][] filtered = medianFilter(grid);
        float[][] result = new float[height][width];
        for (int y = 0; y < height; y++) {
            double[] row = filtered[y / boxSize];
            for (int x = 0; x < width; x++) {
                result[y][x] = (float) row[x / boxSize];
            }
        }
        return result;
    }

    private double[][] medianFilter(double[][] grid) {
        if (filterSize == 1) {
            return grid;
        }
        int ny = grid.length;
        int nx = ny == 0 ? 0 : grid[0].length;
        int half = filterSize / 2;
        double[][] result = new double[ny][nx];
        double[] window = new double[filterSize * filterSize];
        for (int y = 0; y < ny; y++) {
            for (int x = 0; x < nx; x++) {
                int n = 0;
                for (int j = Math.max(0, y - half); j <= Math.min(ny - 1, y + half); j++) {
                    for (int i = Math.max(0, x - half); i <= Math.min(nx - 1, x + half); i++) {
                        window[n++] = grid[j][i];
                    }
                }
                result[y][x] = Statistics.median(window, n);
            }
        }
        return result;
    }

    /**
     * Replace the masked pixels of an image with the background estimate.
     *
     * @return A new array; the input is not modified
     */
    public float[][] fillMasked(float[][] data, boolean[][] mask) {
        int height = data.length;
        float[][] result = new float[height][];
        if (mask == null) {
            for (int y = 0; y < height; y++) {
                result[y] = data[y].clone();
            }
            return result;
        }
        float[][] background = estimate(data, mask);
        for (int y = 0; y < height; y++) {
            result[y] = data[y].clone();
            for (int x = 0; x < result[y].length; x++) {
                if (mask[y][x]) {
                    result[y][x] = background[y][x];
                }
            }
        }
        return result;
    }
}
