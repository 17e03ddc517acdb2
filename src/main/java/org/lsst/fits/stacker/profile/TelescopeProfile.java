package org.lsst.fits.stacker.profile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.lsst.fits.stacker.DelegateFailureException;
import org.lsst.fits.stacker.classify.KeywordPredicate;
import org.lsst.fits.stacker.model.CalibrationKey;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.model.Masters;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.model.ScienceKey;

/**
 * Everything the pipeline needs to know about one telescope/instrument: how
 * to recognise its frames from their headers, which calibrations apply, and
 * the pixel level operations used to build masters, calibrate science frames
 * and enrich the final stacks.
 * <p>
 * Implementations are looked up by name in {@link TelescopeRegistry}.
 */
public interface TelescopeProfile {

    String getName();

    // Classification
    KeywordPredicate getSciencePredicate();

    KeywordPredicate getFlatPredicate();

    KeywordPredicate getBiasPredicate();

    KeywordPredicate getDarkPredicate();

    KeywordPredicate getSpecPredicate();

    String getTargetKeyword();

    /**
     * @param processed True when reducing pre-processed data products
     * @return Glob matching the raw files in the data directory
     */
    String getRawFilePattern(boolean processed);

    /**
     * @return Index of the HDU holding the instrument header
     */
    int getRawHeaderExtension();

    Configuration getConfiguration(Header header);

    /**
     * @return The exposure time as it is recorded in the manifest
     */
    String getExposure(Header header);

    /**
     * @return The observation time as MJD
     */
    double getObservationTime(Header header);

    // Instrument facts
    Wavelength getWavelength();

    /**
     * @return Arcseconds per pixel
     */
    double getPixelScale();

    boolean usesBias();

    boolean usesDark();

    boolean usesFlat();

    boolean needsFringeCorrection(String filter);

    /**
     * @return Directory holding a library of master flats, if the instrument
     * has one
     */
    Optional<Path> getDefaultCalibrationPath();

    boolean runWcs();

    boolean runPhotometry();

    /**
     * @return Names of the reference catalogs usable for zero points, most
     * preferred first
     */
    List<String> getPhotometricCatalogs();

    // Calibration delegates
    void createBias(List<RawFrame> frames, CalibrationKey key, Path output) throws IOException, FitsException;

    void createDark(List<RawFrame> frames, CalibrationKey key, Masters masters, Path output) throws IOException, FitsException;

    void createFlat(List<RawFrame> frames, CalibrationKey key, Masters masters, Path output) throws IOException, FitsException;

    ImageFrame loadMaster(Path file) throws IOException, FitsException;

    /**
     * @param directory Where the master lives
     * @param key The calibration key
     * @return Deterministic file name of the master for that key
     */
    Path getMasterPath(Path directory, CalibrationKey key);

    // Science delegates
    /**
     * Calibrate the raw science frames of one group. Each returned frame has
     * a source mask and is background subtracted and normalised to counts per
     * second.
     */
    List<ImageFrame> processScience(List<RawFrame> frames, ScienceKey key, Masters masters, Path redPath, boolean processed) throws IOException, FitsException;

    /**
     * @return Base read noise of a single frame, in electrons
     */
    double getReadNoise(Header header);

    Path getStackPath(Path redPath, ScienceKey key);

    /**
     * @return Pixels to ignore when measuring stars, if the instrument has a
     * static bad pixel mask
     */
    Optional<boolean[][]> getStaticMask(boolean processed) throws IOException, FitsException;

    List<ImageFrame> align(List<ImageFrame> frames, boolean[][] staticMask);

    /**
     * Solve the astrometry of a stack.
     *
     * @return The solved stack written next to the input
     */
    Path solveWcs(Path stack) throws DelegateFailureException;

    /**
     * Measure the sources of a stack.
     *
     * @return The photometry catalog written next to the input
     */
    Path runPhotometry(Path stack) throws DelegateFailureException;
}
