package org.lsst.fits.stacker.profile;

import java.util.Arrays;
import java.util.List;
import nom.tam.fits.Header;
import org.lsst.fits.stacker.bias.NullOverscanCorrection;
import org.lsst.fits.stacker.bias.OverscanCorrection;
import org.lsst.fits.stacker.bias.SerialOverscanCorrection;
import org.lsst.fits.stacker.classify.KeywordPredicate;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.stats.BoxBackground;

/**
 * MMIRS, the near-infrared imager and spectrograph on the MMT. Frames have
 * the instrument header in extension 1. There is no bias; darks are matched
 * by exposure and flats are by default made from the science frames.
 */
public class MmirsProfile extends AbstractFitsProfile {

    private static final KeywordPredicate SCIENCE = KeywordPredicate.equalTo("OBSMODE", "imaging", "APTYPE", "open");
    private static final KeywordPredicate DARK = KeywordPredicate.equalTo("OBJECT", "Dark");
    private static final KeywordPredicate SPEC = KeywordPredicate.equalTo("OBSMODE", "spectral");
    private static final OverscanCorrection OVERSCAN = new SerialOverscanCorrection(0, 4, 15);
    private static final OverscanCorrection NO_OVERSCAN = new NullOverscanCorrection();

    @Override
    public String getName() {
        return "MMIRS";
    }

    @Override
    public KeywordPredicate getSciencePredicate() {
        return SCIENCE;
    }

    @Override
    public KeywordPredicate getFlatPredicate() {
        return KeywordPredicate.none();
    }

    @Override
    public KeywordPredicate getBiasPredicate() {
        return KeywordPredicate.none();
    }

    @Override
    public KeywordPredicate getDarkPredicate() {
        return DARK;
    }

    @Override
    public KeywordPredicate getSpecPredicate() {
        return SPEC;
    }

    @Override
    public String getTargetKeyword() {
        return "OBJECT";
    }

    @Override
    public int getRawHeaderExtension() {
        return 1;
    }

    @Override
    public Configuration getConfiguration(Header header) {
        return new Configuration(getString(header, "FILTER", "NONE"), getString(header, "NAMPS", "1"), getBinning(header, "CCDSUM"));
    }

    @Override
    public Wavelength getWavelength() {
        return Wavelength.NEAR_INFRARED;
    }

    @Override
    public double getPixelScale() {
        return 0.202;
    }

    @Override
    public boolean usesBias() {
        return false;
    }

    @Override
    public boolean usesDark() {
        return true;
    }

    @Override
    public boolean usesFlat() {
        return true;
    }

    @Override
    public boolean runWcs() {
        return true;
    }

    @Override
    public boolean runPhotometry() {
        return false;
    }

    @Override
    public List<String> getPhotometricCatalogs() {
        return Arrays.asList("2MASS");
    }

    /**
     * The first four columns are a reference region. The observatory's
     * pre-processed products are already corrected.
     */
    @Override
    protected OverscanCorrection getOverscanCorrection(boolean processed) {
        return processed ? NO_OVERSCAN : OVERSCAN;
    }

    @Override
    protected BoxBackground getScienceBackground() {
        return new BoxBackground(510, 9, 3.0, 0.8);
    }
}
