package org.lsst.fits.stacker.bias;

import java.awt.Rectangle;

/**
 * Removes the electronic offset measured in the overscan region of a raw
 * frame.
 */
public interface OverscanCorrection {

    CorrectionFactors compute(float[][] data, Rectangle datasec);

    /**
     * Apply the correction and trim the frame to its data section.
     *
     * @param data The raw pixels
     * @param datasec The data section, or null to keep the full frame
     * @return The corrected and trimmed pixels
     */
    default float[][] apply(float[][] data, Rectangle datasec) {
        Rectangle region = datasec != null ? datasec : new Rectangle(0, 0, data.length == 0 ? 0 : data[0].length, data.length);
        CorrectionFactors factors = compute(data, region);
        float[][] result = new float[region.height][region.width];
        for (int y = 0; y < region.height; y++) {
            for (int x = 0; x < region.width; x++) {
                int sx = x + region.x;
                int sy = y + region.y;
                result[y][x] = data[sy][sx] - factors.correctionFactor(sx, sy);
            }
        }
        return result;
    }

    public interface CorrectionFactors {

        public float correctionFactor(int x, int y);

    }
}
