package org.lsst.fits.stacker.profile;

import java.awt.Rectangle;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import org.lsst.fits.stacker.DelegateFailureException;
import org.lsst.fits.stacker.align.FrameAligner;
import org.lsst.fits.stacker.align.TranslationAligner;
import org.lsst.fits.stacker.bias.DataSection;
import org.lsst.fits.stacker.bias.OverscanCorrection;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.io.FitsTime;
import org.lsst.fits.stacker.model.CalibrationKey;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.model.Masters;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.model.ScienceKey;
import org.lsst.fits.stacker.phot.AperturePhotometer;
import org.lsst.fits.stacker.stats.BoxBackground;
import org.lsst.fits.stacker.stats.Segmentation;
import org.lsst.fits.stacker.stats.SigmaClippedCombiner;
import org.lsst.fits.stacker.stats.Statistics;
import org.lsst.fits.stacker.wcs.AstapWcsSolver;

/**
 * Base class for instruments whose raw frames are plain FITS images. It
 * implements the calibration and science delegates with the pixel operations
 * in the stats and bias packages; subclasses supply the header conventions
 * and instrument constants.
 * <p>
 * Each raw frame is calibrated in the same order: overscan correction, trim
 * to DATASEC, gain, bias, dark, flat.
 */
public abstract class AbstractFitsProfile implements TelescopeProfile {

    private static final Logger LOG = Logger.getLogger(AbstractFitsProfile.class.getName());

    private final SigmaClippedCombiner combiner = new SigmaClippedCombiner();
    private final Segmentation sourceMask = new Segmentation(3.0, 5);
    private final FrameAligner aligner = new TranslationAligner();
    private final AstapWcsSolver wcsSolver = new AstapWcsSolver();
    private final AperturePhotometer photometer = new AperturePhotometer();

    /**
     * @param processed True for pre-processed data products
     * @return The overscan correction to apply to raw frames
     */
    protected abstract OverscanCorrection getOverscanCorrection(boolean processed);

    /**
     * @return The background estimator used on calibrated science frames
     */
    protected BoxBackground getScienceBackground() {
        return new BoxBackground();
    }

    protected double getGain(Header header) {
        return header.getDoubleValue("GAIN", 1.0);
    }

    /**
     * @return The trimmed value of a string keyword with all whitespace
     * removed, or the default if the keyword is missing or blank
     */
    protected static String getString(Header header, String keyword, String defaultValue) {
        String value = valueOf(header, keyword);
        if (value == null) {
            return defaultValue;
        }
        value = value.replaceAll("\\s+", "");
        return value.isEmpty() ? defaultValue : value;
    }

    /**
     * @return The binning from a {@code CCDSUM = '2 2'} style keyword, as
     * {@code 2x2}
     */
    protected static String getBinning(Header header, String keyword) {
        String value = valueOf(header, keyword);
        if (value == null || value.trim().isEmpty()) {
            return "1x1";
        }
        return String.join("x", value.trim().split("\\s+"));
    }

    /**
     * The value text of a card of any type, so that numeric values such as
     * {@code NAMPS = 4} read the same as strings.
     */
    private static String valueOf(Header header, String keyword) {
        HeaderCard card = header.findCard(keyword);
        return card == null ? null : card.getValue();
    }

    @Override
    public String getRawFilePattern(boolean processed) {
        return "*.fits";
    }

    @Override
    public String getExposure(Header header) {
        return String.valueOf(header.getDoubleValue("EXPTIME", 0));
    }

    @Override
    public double getObservationTime(Header header) {
        return FitsTime.toMjd(header.getStringValue("DATE-OBS"));
    }

    @Override
    public Optional<Path> getDefaultCalibrationPath() {
        return Optional.empty();
    }

    @Override
    public boolean needsFringeCorrection(String filter) {
        return false;
    }

    @Override
    public double getReadNoise(Header header) {
        return header.getDoubleValue("RDNOISE", 0);
    }

    @Override
    public Path getMasterPath(Path directory, CalibrationKey key) {
        String suffix = key.getAmplifier() + "_" + key.getBinning() + ".fits";
        switch (key.getType()) {
            case BIAS:
                return directory.resolve("mbias_" + suffix);
            case DARK:
                return directory.resolve("mdark_" + key.getExposure() + "_" + suffix);
            case FLAT:
                return directory.resolve("mflat_" + key.getFilter() + "_" + suffix);
            default:
                throw new IllegalArgumentException("No master for " + key);
        }
    }

    @Override
    public Path getStackPath(Path redPath, ScienceKey key) {
        return redPath.resolve(key.name() + ".fits");
    }

    @Override
    public ImageFrame loadMaster(Path file) throws IOException, FitsException {
        return FitsImages.readImage(file, 0);
    }

    @Override
    public Optional<boolean[][]> getStaticMask(boolean processed) throws IOException, FitsException {
        return Optional.empty();
    }

    @Override
    public void createBias(List<RawFrame> frames, CalibrationKey key, Path output) throws IOException, FitsException {
        List<float[][]> images = new ArrayList<>();
        Header header = null;
        for (RawFrame frame : frames) {
            ImageFrame calibrated = calibrate(frame, Masters.none(), false);
            header = header == null ? calibrated.getHeader() : header;
            images.add(calibrated.getData());
        }
        writeMaster(output, combine(images, key), header, frames, "electron");
    }

    @Override
    public void createDark(List<RawFrame> frames, CalibrationKey key, Masters masters, Path output) throws IOException, FitsException {
        List<float[][]> images = new ArrayList<>();
        Header header = null;
        for (RawFrame frame : frames) {
            ImageFrame calibrated = calibrate(frame, masters, false);
            header = header == null ? calibrated.getHeader() : header;
            images.add(calibrated.getData());
        }
        writeMaster(output, combine(images, key), header, frames, "electron");
    }

    /**
     * Each frame is bias and dark corrected then scaled to unit median before
     * the combination. The master is normalised to unit median again.
     */
    @Override
    public void createFlat(List<RawFrame> frames, CalibrationKey key, Masters masters, Path output) throws IOException, FitsException {
        List<float[][]> images = new ArrayList<>();
        Header header = null;
        Masters noFlat = masters.withFlat(null);
        for (RawFrame frame : frames) {
            ImageFrame calibrated = calibrate(frame, noFlat, false);
            header = header == null ? calibrated.getHeader() : header;
            images.add(normalise(calibrated.getData(), frame.getPath()));
        }
        float[][] flat = normalise(combine(images, key), output);
        writeMaster(output, flat, header, frames, "");
    }

    @Override
    public List<ImageFrame> processScience(List<RawFrame> frames, ScienceKey key, Masters masters, Path redPath, boolean processed) throws IOException, FitsException {
        BoxBackground background = getScienceBackground();
        List<ImageFrame> result = new ArrayList<>();
        for (RawFrame frame : frames) {
            ImageFrame calibrated = calibrate(frame, masters, processed);
            float[][] data = calibrated.getData();
            String base = FitsImages.baseName(frame.getPath());
            boolean[][] mask = sourceMask.mask(data);
            FitsImages.writeMask(redPath.resolve(base + "_mask.fits"), mask);
            float[][] sky = background.estimate(data, mask);
            FitsImages.writeImage(redPath.resolve(base + "_bkg.fits"), sky, null);
            double exposure = calibrated.getHeader().getDoubleValue("EXPTIME", frame.getExposureSeconds());
            if (!(exposure > 0)) {
                throw new FitsException("No exposure time for " + frame.getPath());
            }
            for (int y = 0; y < data.length; y++) {
                for (int x = 0; x < data[y].length; x++) {
                    data[y][x] = (float) ((data[y][x] - sky[y][x]) / exposure);
                }
            }
            Header header = calibrated.getHeader();
            header.deleteKey("BUNIT");
            header.addValue("BUNIT", "electron/s", "Background subtracted count rate");
            double time = frame.getTime() != null ? frame.getTime() : getObservationTime(header);
            result.add(new ImageFrame(redPath.resolve(base + "_red.fits"), data, mask, header, time, exposure));
            LOG.log(Level.FINE, "Processed {0} for {1}", new Object[]{frame.getFileName(), key});
        }
        return result;
    }

    @Override
    public List<ImageFrame> align(List<ImageFrame> frames, boolean[][] staticMask) {
        return aligner.align(frames, staticMask);
    }

    @Override
    public Path solveWcs(Path stack) throws DelegateFailureException {
        return wcsSolver.solve(stack);
    }

    @Override
    public Path runPhotometry(Path stack) throws DelegateFailureException {
        return photometer.measure(stack, getPhotometricCatalogs());
    }

    /**
     * Read one raw frame and apply overscan, trim, gain and whichever masters
     * are present.
     */
    ImageFrame calibrate(RawFrame frame, Masters masters, boolean processed) throws IOException, FitsException {
        ImageFrame raw = FitsImages.readImage(frame.getPath(), getRawHeaderExtension());
        Header header = raw.getHeader();
        Rectangle datasec;
        try {
            datasec = DataSection.parse(header.getStringValue("DATASEC"));
        } catch (IllegalArgumentException x) {
            throw new FitsException("Invalid DATASEC in " + frame.getPath(), x);
        }
        if (datasec != null && !new Rectangle(0, 0, raw.getWidth(), raw.getHeight()).contains(datasec)) {
            throw new FitsException("DATASEC " + header.getStringValue("DATASEC") + " exceeds the " + raw.getWidth() + "x" + raw.getHeight() + " image " + frame.getPath());
        }
        float[][] data = getOverscanCorrection(processed).apply(raw.getData(), datasec);
        double gain = getGain(header);
        if (gain != 1.0) {
            for (float[] row : data) {
                for (int x = 0; x < row.length; x++) {
                    row[x] *= gain;
                }
            }
        }
        Optional<ImageFrame> bias = masters.getBias();
        if (bias.isPresent()) {
            subtract(data, bias.get(), frame);
        }
        Optional<ImageFrame> dark = masters.getDark(frame.getExposure());
        if (dark.isPresent()) {
            subtract(data, dark.get(), frame);
        }
        Optional<ImageFrame> flat = masters.getFlat();
        if (flat.isPresent()) {
            checkShape(data, flat.get(), frame);
            float[][] f = flat.get().getData();
            for (int y = 0; y < data.length; y++) {
                for (int x = 0; x < data[y].length; x++) {
                    data[y][x] = f[y][x] > 0 ? data[y][x] / f[y][x] : Float.NaN;
                }
            }
        }
        return new ImageFrame(frame.getPath(), data, null, header, Double.NaN, frame.getExposureSeconds());
    }

    private static void subtract(float[][] data, ImageFrame master, RawFrame frame) throws FitsException {
        checkShape(data, master, frame);
        float[][] m = master.getData();
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[y].length; x++) {
                data[y][x] -= m[y][x];
            }
        }
    }

    private static void checkShape(float[][] data, ImageFrame master, RawFrame frame) throws FitsException {
        int width = data.length == 0 ? 0 : data[0].length;
        if (master.getHeight() != data.length || master.getWidth() != width) {
            throw new FitsException("Master " + master.getPath() + " is " + master.getWidth() + "x" + master.getHeight()
                    + " but " + frame.getPath() + " is " + width + "x" + data.length);
        }
    }

    private float[][] combine(List<float[][]> images, CalibrationKey key) throws FitsException {
        try {
            return combiner.combine(images);
        } catch (IllegalArgumentException x) {
            throw new FitsException("Cannot combine frames for " + key, x);
        }
    }

    private static float[][] normalise(float[][] data, Path file) throws FitsException {
        double[] stats = Statistics.clippedStats(data, null, 3.0, 5);
        double median = stats[1];
        if (!(median > 0)) {
            throw new FitsException("Non positive median level " + median + " in " + file);
        }
        float[][] result = new float[data.length][];
        for (int y = 0; y < data.length; y++) {
            result[y] = new float[data[y].length];
            for (int x = 0; x < data[y].length; x++) {
                result[y][x] = (float) (data[y][x] / median);
            }
        }
        return result;
    }

    private static void writeMaster(Path output, float[][] data, Header template, List<RawFrame> frames, String unit) throws IOException, FitsException {
        Header header = new Header();
        if (template != null) {
            FitsImages.copyCards(template, header);
        }
        header.deleteKey("NCOMBINE");
        header.addValue("NCOMBINE", frames.size(), "Number of frames combined");
        for (int i = 0; i < frames.size(); i++) {
            String key = String.format("IMCMB%03d", i + 1);
            header.deleteKey(key);
            header.addValue(key, frames.get(i).getFileName(), "Frame used in master");
        }
        if (!unit.isEmpty()) {
            header.deleteKey("BUNIT");
            header.addValue("BUNIT", unit, null);
        }
        FitsImages.writeImage(output, data, header);
        LOG.log(Level.INFO, "Wrote master {0} from {1} frames", new Object[]{output, frames.size()});
    }
}
