package org.lsst.fits.stacker.model;

import java.util.Objects;

/**
 * Identifies one science group: all frames of one target taken with one
 * configuration. One stack is produced per key.
 */
public class ScienceKey {

    private final String target;
    private final Configuration configuration;

    public ScienceKey(String target, Configuration configuration) {
        this.target = Objects.requireNonNull(target, "target");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public String getTarget() {
        return target;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public String getFilter() {
        return configuration.getFilter();
    }

    /**
     * @return The key in the form {@code target_filter_amplifier_binning}
     */
    public String name() {
        return target + "_" + configuration.key();
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + Objects.hashCode(this.target);
        hash = 19 * hash + Objects.hashCode(this.configuration);
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
        final ScienceKey other = (ScienceKey) obj;
        return Objects.equals(this.target, other.target) && Objects.equals(this.configuration, other.configuration);
    }

    @Override
    public String toString() {
        return name();
    }
}
