package org.lsst.fits.stacker.model;

import java.nio.file.Path;
import nom.tam.fits.Header;

/**
 * Pixel data of one frame together with its FITS header. The optional mask
 * flags pixels covered by sources; masked pixels are left out of background
 * estimates and combinations.
 */
public class ImageFrame {

    private final Path path;
    private final float[][] data;
    private final boolean[][] mask;
    private final Header header;
    private final double time;
    private final double exposure;

    public ImageFrame(Path path, float[][] data, boolean[][] mask, Header header, double time, double exposure) {
        if (mask != null && (mask.length != data.length || (data.length > 0 && mask[0].length != data[0].length))) {
            throw new IllegalArgumentException("Mask shape does not match data for " + path);
        }
        this.path = path;
        this.data = data;
        this.mask = mask;
        this.header = header == null ? new Header() : header;
        this.time = time;
        this.exposure = exposure;
    }

    public ImageFrame(Path path, float[][] data, Header header) {
        this(path, data, null, header, Double.NaN, 0);
    }

    /**
     * @return A frame with the same metadata and new pixel data
     */
    public ImageFrame withData(float[][] newData) {
        return new ImageFrame(path, newData, mask, header, time, exposure);
    }

    public ImageFrame withPath(Path newPath) {
        return new ImageFrame(newPath, data, mask, header, time, exposure);
    }

    public Path getPath() {
        return path;
    }

    public float[][] getData() {
        return data;
    }

    public boolean[][] getMask() {
        return mask;
    }

    public Header getHeader() {
        return header;
    }

    /**
     * @return The observation time (MJD), NaN for master frames
     */
    public double getTime() {
        return time;
    }

    public double getExposure() {
        return exposure;
    }

    public int getWidth() {
        return data.length == 0 ? 0 : data[0].length;
    }

    public int getHeight() {
        return data.length;
    }

    @Override
    public String toString() {
        return "ImageFrame{" + "path=" + path + ", size=" + getWidth() + "x" + getHeight() + '}';
    }
}
