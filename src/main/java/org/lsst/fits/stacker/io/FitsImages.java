package org.lsst.fits.stacker.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import org.lsst.fits.stacker.QuarantineException;
import org.lsst.fits.stacker.model.ImageFrame;

/**
 * Reading and writing of single images and headers with nom.tam.fits.
 * Integer pixel data is scaled with BSCALE/BZERO on read; images are always
 * written as 32 bit floats in the primary HDU.
 */
public class FitsImages {

    private static final Set<String> STRUCTURAL_KEYS = new HashSet<>(Arrays.asList(
            "SIMPLE", "XTENSION", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS3", "EXTEND",
            "PCOUNT", "GCOUNT", "BZERO", "BSCALE", "BLANK", "END", "COMMENT", "HISTORY", ""));

    static {
        FitsFactory.setUseHierarch(true);
    }

    private FitsImages() {
    }

    /**
     * Read the header of one HDU of a raw frame.
     *
     * @param file The file to read
     * @param extension The HDU index holding the instrument header
     * @return The header
     * @throws IOException If the file cannot be opened as FITS at all
     * @throws QuarantineException If the file opens but the requested HDU is
     * missing or unreadable
     */
    public static Header readHeader(Path file, int extension) throws IOException, QuarantineException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> primary;
            try {
                primary = fits.getHDU(0);
            } catch (FitsException x) {
                throw new IOException("Not a readable FITS file: " + file, x);
            }
            if (primary == null) {
                throw new IOException("Empty FITS file: " + file);
            }
            if (extension == 0) {
                return primary.getHeader();
            }
            try {
                BasicHDU<?> hdu = fits.getHDU(extension);
                if (hdu == null) {
                    throw new QuarantineException(file, "Missing header extension " + extension + " in " + file);
                }
                return hdu.getHeader();
            } catch (FitsException | IOException x) {
                throw new QuarantineException(file, "Unreadable header extension " + extension + " in " + file, x);
            }
        } catch (FitsException x) {
            throw new IOException("Cannot open " + file, x);
        }
    }

    /**
     * Read the image of one HDU as floats.
     */
    public static ImageFrame readImage(Path file, int extension) throws IOException, FitsException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(extension);
            if (hdu == null) {
                throw new FitsException("Missing HDU " + extension + " in " + file);
            }
            Header header = hdu.getHeader();
            float[][] data = toFloat(hdu.getKernel(), header.getDoubleValue("BSCALE", 1.0), header.getDoubleValue("BZERO", 0.0), file);
            return new ImageFrame(file, data, header);
        }
    }

    public static void writeImage(Path file, float[][] data, Header template) throws IOException, FitsException {
        write(file, data, template);
    }

    /**
     * Write a source mask as a byte image, 1 where masked.
     */
    public static void writeMask(Path file, boolean[][] mask) throws IOException, FitsException {
        byte[][] data = new byte[mask.length][];
        for (int y = 0; y < mask.length; y++) {
            data[y] = new byte[mask[y].length];
            for (int x = 0; x < mask[y].length; x++) {
                data[y][x] = mask[y][x] ? (byte) 1 : (byte) 0;
            }
        }
        write(file, data, null);
    }

    public static void writeImage(ImageFrame frame) throws IOException, FitsException {
        write(frame.getPath(), frame.getData(), frame.getHeader());
    }

    private static void write(Path file, Object data, Header template) throws IOException, FitsException {
        BasicHDU<?> hdu = Fits.makeHDU(data);
        if (template != null) {
            copyCards(template, hdu.getHeader());
        }
        Files.deleteIfExists(file);
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file.toFile(), "rw")) {
            fits.addHDU(hdu);
            fits.write(out);
        }
    }

    /**
     * @return The file name without its {@code .fits}, {@code .fits.gz} or
     * {@code .fits.bz2} suffix
     */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(".gz")) {
            name = name.substring(0, name.length() - 3);
        } else if (name.endsWith(".bz2")) {
            name = name.substring(0, name.length() - 4);
        }
        if (name.endsWith(".fits")) {
            name = name.substring(0, name.length() - 5);
        } else if (name.endsWith(".fit")) {
            name = name.substring(0, name.length() - 4);
        }
        return name;
    }

    /**
     * Copy the descriptive cards of one header into another, leaving out
     * structural keywords and keys the destination already has.
     */
    public static void copyCards(Header from, Header to) {
        Cursor<String, HeaderCard> cursor = from.iterator();
        while (cursor.hasNext()) {
            HeaderCard card = cursor.next();
            String key = card.getKey();
            if (key == null || STRUCTURAL_KEYS.contains(key) || to.containsKey(key)) {
                continue;
            }
            to.addLine(card);
        }
    }

    static float[][] toFloat(Object kernel, double scale, double zero, Path file) throws FitsException {
        if (kernel instanceof float[][]) {
            float[][] f = (float[][]) kernel;
            if (scale == 1.0 && zero == 0.0) {
                return f;
            }
            float[][] result = new float[f.length][];
            for (int y = 0; y < f.length; y++) {
                result[y] = new float[f[y].length];
                for (int x = 0; x < f[y].length; x++) {
                    result[y][x] = (float) (f[y][x] * scale + zero);
                }
            }
            return result;
        } else if (kernel instanceof double[][]) {
            double[][] d = (double[][]) kernel;
            float[][] result = new float[d.length][];
            for (int y = 0; y < d.length; y++) {
                result[y] = new float[d[y].length];
                for (int x = 0; x < d[y].length; x++) {
                    result[y][x] = (float) (d[y][x] * scale + zero);
                }
            }
            return result;
        } else if (kernel instanceof int[][]) {
            int[][] d = (int[][]) kernel;
            float[][] result = new float[d.length][];
            for (int y = 0; y < d.length; y++) {
                result[y] = new float[d[y].length];
                for (int x = 0; x < d[y].length; x++) {
                    result[y][x] = (float) (d[y][x] * scale + zero);
                }
            }
            return result;
        } else if (kernel instanceof short[][]) {
            short[][] d = (short[][]) kernel;
            float[][] result = new float[d.length][];
            for (int y = 0; y < d.length; y++) {
                result[y] = new float[d[y].length];
                for (int x = 0; x < d[y].length; x++) {
                    result[y][x] = (float) (d[y][x] * scale + zero);
                }
            }
            return result;
        } else if (kernel instanceof byte[][]) {
            byte[][] d = (byte[][]) kernel;
            float[][] result = new float[d.length][];
            for (int y = 0; y < d.length; y++) {
                result[y] = new float[d[y].length];
                for (int x = 0; x < d[y].length; x++) {
                    result[y][x] = (float) ((d[y][x] & 0xff) * scale + zero);
                }
            }
            return result;
        }
        throw new FitsException("Unsupported image data " + (kernel == null ? "null" : kernel.getClass().getSimpleName()) + " in " + file);
    }
}
