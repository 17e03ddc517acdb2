package org.lsst.fits.stacker.model;

import java.util.Objects;

/**
 * The instrument configuration a frame was taken with: filter, amplifier
 * readout and binning. Frames are only ever combined with frames of the same
 * configuration.
 * <p>
 * The key form {@code filter_amplifier_binning} is what the manifest stores
 * in its Filter column. It is parsed from the right, so filter names may
 * themselves contain underscores.
 */
public class Configuration {

    private static final String SEPARATOR = "_";

    private final String filter;
    private final String amplifier;
    private final String binning;

    public Configuration(String filter, String amplifier, String binning) {
        this.filter = Objects.requireNonNull(filter, "filter");
        this.amplifier = Objects.requireNonNull(amplifier, "amplifier");
        this.binning = Objects.requireNonNull(binning, "binning");
    }

    /**
     * Parse a key previously produced by {@link #key()}.
     *
     * @param key The key, for example {@code V_A_1x1}
     * @return The configuration
     * @throws IllegalArgumentException If the key has fewer than three parts
     */
    public static Configuration parse(String key) {
        int last = key.lastIndexOf(SEPARATOR);
        int middle = last > 0 ? key.lastIndexOf(SEPARATOR, last - 1) : -1;
        if (middle <= 0) {
            throw new IllegalArgumentException("Invalid configuration key: " + key);
        }
        return new Configuration(key.substring(0, middle), key.substring(middle + 1, last), key.substring(last + 1));
    }

    public String getFilter() {
        return filter;
    }

    public String getAmplifier() {
        return amplifier;
    }

    public String getBinning() {
        return binning;
    }

    public String key() {
        return filter + SEPARATOR + amplifier + SEPARATOR + binning;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + Objects.hashCode(this.filter);
        hash = 19 * hash + Objects.hashCode(this.amplifier);
        hash = 19 * hash + Objects.hashCode(this.binning);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Configuration other = (Configuration) obj;
        return Objects.equals(this.filter, other.filter)
                && Objects.equals(this.amplifier, other.amplifier)
                && Objects.equals(this.binning, other.binning);
    }

    @Override
    public String toString() {
        return key();
    }
}
