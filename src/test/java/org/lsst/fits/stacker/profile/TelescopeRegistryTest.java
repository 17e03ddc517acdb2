package org.lsst.fits.stacker.profile;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.lsst.fits.stacker.FatalConfigurationException;

public class TelescopeRegistryTest {

    @Test
    public void lookupIgnoresCase() throws Exception {
        TelescopeRegistry registry = TelescopeRegistry.defaultRegistry();
        assertTrue(registry.lookup("mmirs") instanceof MmirsProfile);
        assertTrue(registry.lookup("Generic") instanceof GenericCcdProfile);
        assertNotSame(registry.lookup("MMIRS"), registry.lookup("MMIRS"));
        assertEquals(2, registry.getProfiles().size());
    }

    @Test(expected = FatalConfigurationException.class)
    public void unknownTelescopeIsFatal() throws Exception {
        TelescopeRegistry.defaultRegistry().lookup("HUBBLE");
    }

    @Test(expected = FatalConfigurationException.class)
    public void missingNameIsFatal() throws Exception {
        TelescopeRegistry.defaultRegistry().lookup(null);
    }

    @Test
    public void registeredProfileIsFound() throws Exception {
        TelescopeRegistry registry = new TelescopeRegistry();
        registry.register("Test", GenericCcdProfile::new);
        assertEquals("GENERIC", registry.lookup("TEST").getName());
    }
}
