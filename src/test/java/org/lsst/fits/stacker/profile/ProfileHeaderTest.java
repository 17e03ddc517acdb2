package org.lsst.fits.stacker.profile;

import java.nio.file.Paths;
import nom.tam.fits.Header;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.lsst.fits.stacker.model.CalibrationKey;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.ScienceKey;

public class ProfileHeaderTest {

    @Test
    public void mmirsConfiguration() throws Exception {
        Header header = new Header();
        header.addValue("FILTER", "J ", "");
        header.addValue("NAMPS", 4, "");
        header.addValue("CCDSUM", "2 2", "");
        header.addValue("EXPTIME", 60.0, "");
        header.addValue("DATE-OBS", "2021-03-04T12:00:00", "");
        header.addValue("OBSMODE", "imaging", "");
        header.addValue("APTYPE", "open", "");
        MmirsProfile profile = new MmirsProfile();
        assertEquals(new Configuration("J", "4", "2x2"), profile.getConfiguration(header));
        assertEquals("60.0", profile.getExposure(header));
        assertEquals(59277.5, profile.getObservationTime(header), 1e-9);
        assertTrue(profile.getSciencePredicate().matches(header));
        assertFalse(profile.getDarkPredicate().matches(header));
        assertTrue(profile.getBiasPredicate().isEmpty());
        assertEquals(Wavelength.NEAR_INFRARED, profile.getWavelength());
    }

    @Test
    public void genericDefaults() throws Exception {
        Header header = new Header();
        header.addValue("FILTER", "V", "");
        GenericCcdProfile profile = new GenericCcdProfile();
        assertEquals(new Configuration("V", "A", "1x1"), profile.getConfiguration(header));
        assertTrue(profile.needsFringeCorrection("i"));
        assertFalse(profile.needsFringeCorrection("V"));
        assertEquals(0.0, profile.getReadNoise(header), 0);
    }

    @Test
    public void masterAndStackNames() {
        GenericCcdProfile profile = new GenericCcdProfile();
        Configuration v = new Configuration("V", "A", "1x1");
        assertEquals(Paths.get("red", "mbias_A_1x1.fits"), profile.getMasterPath(Paths.get("red"), CalibrationKey.bias(v)));
        assertEquals(Paths.get("red", "mdark_30.0_A_1x1.fits"), profile.getMasterPath(Paths.get("red"), CalibrationKey.dark("30.0", v)));
        assertEquals(Paths.get("cal", "mflat_V_A_1x1.fits"), profile.getMasterPath(Paths.get("cal"), CalibrationKey.flat(v)));
        assertEquals(Paths.get("red", "M31_V_A_1x1.fits"), profile.getStackPath(Paths.get("red"), new ScienceKey("M31", v)));
    }
}
