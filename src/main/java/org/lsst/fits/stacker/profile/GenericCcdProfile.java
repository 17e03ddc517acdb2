package org.lsst.fits.stacker.profile;

import java.util.Arrays;
import java.util.List;
import nom.tam.fits.Header;
import org.lsst.fits.stacker.bias.NullOverscanCorrection;
import org.lsst.fits.stacker.bias.OverscanCorrection;
import org.lsst.fits.stacker.classify.KeywordPredicate;
import org.lsst.fits.stacker.model.Configuration;

/**
 * An optical CCD camera following the common IRAF header conventions:
 * frame types in IMAGETYP, the filter in FILTER, binning in CCDSUM and the
 * data region in DATASEC. Uses bias, dark and dome flats, and fringe
 * correction in the red filters.
 */
public class GenericCcdProfile extends AbstractFitsProfile {

    private static final KeywordPredicate SCIENCE = KeywordPredicate.equalTo("IMAGETYP", "object");
    private static final KeywordPredicate FLAT = KeywordPredicate.containing("IMAGETYP", "flat");
    private static final KeywordPredicate BIAS = KeywordPredicate.equalTo("IMAGETYP", "bias");
    private static final KeywordPredicate DARK = KeywordPredicate.equalTo("IMAGETYP", "dark");
    private static final KeywordPredicate SPEC = KeywordPredicate.equalTo("IMAGETYP", "spectrum");
    private static final List<String> FRINGE_FILTERS = Arrays.asList("i", "z");

    private final OverscanCorrection overscan = new NullOverscanCorrection();

    @Override
    public String getName() {
        return "GENERIC";
    }

    @Override
    public KeywordPredicate getSciencePredicate() {
        return SCIENCE;
    }

    @Override
    public KeywordPredicate getFlatPredicate() {
        return FLAT;
    }

    @Override
    public KeywordPredicate getBiasPredicate() {
        return BIAS;
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
        return 0;
    }

    @Override
    public Configuration getConfiguration(Header header) {
        return new Configuration(getString(header, "FILTER", "NONE"), getString(header, "AMPLIFIE", "A"), getBinning(header, "CCDSUM"));
    }

    @Override
    public Wavelength getWavelength() {
        return Wavelength.OPTICAL;
    }

    @Override
    public double getPixelScale() {
        return Double.parseDouble(System.getProperty("org.lsst.fits.stacker.pixelScale", "1.0"));
    }

    @Override
    public boolean usesBias() {
        return true;
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
    public boolean needsFringeCorrection(String filter) {
        return FRINGE_FILTERS.contains(filter);
    }

    @Override
    public boolean runWcs() {
        return false;
    }

    @Override
    public boolean runPhotometry() {
        return false;
    }

    @Override
    public List<String> getPhotometricCatalogs() {
        return Arrays.asList("SDSS", "PS1");
    }

    /**
     * Overscan regions, where present, are removed by the DATASEC trim.
     */
    @Override
    protected OverscanCorrection getOverscanCorrection(boolean processed) {
        return overscan;
    }
}
