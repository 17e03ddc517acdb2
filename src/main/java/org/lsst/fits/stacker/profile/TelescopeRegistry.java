package org.lsst.fits.stacker.profile;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.lsst.fits.stacker.FatalConfigurationException;

/**
 * Maps instrument names, as given on the command line, to their profiles.
 * Lookup ignores case.
 */
public class TelescopeRegistry {

    private final Map<String, Supplier<TelescopeProfile>> profiles = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * @return A registry holding the built-in instruments
     */
    public static TelescopeRegistry defaultRegistry() {
        TelescopeRegistry registry = new TelescopeRegistry();
        registry.register("MMIRS", MmirsProfile::new);
        registry.register("GENERIC", GenericCcdProfile::new);
        return registry;
    }

    public void register(String name, Supplier<TelescopeProfile> supplier) {
        profiles.put(name, supplier);
    }

    public Map<String, Supplier<TelescopeProfile>> getProfiles() {
        return Collections.unmodifiableMap(profiles);
    }

    /**
     * @param name The instrument name
     * @return A new profile instance
     * @throws FatalConfigurationException If no instrument has that name
     */
    public TelescopeProfile lookup(String name) throws FatalConfigurationException {
        Supplier<TelescopeProfile> supplier = name == null ? null : profiles.get(name);
        if (supplier == null) {
            throw new FatalConfigurationException("No such telescope: " + name + ", available: " + profiles.keySet());
        }
        return supplier.get();
    }
}
