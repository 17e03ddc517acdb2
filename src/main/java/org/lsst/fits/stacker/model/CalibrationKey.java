package org.lsst.fits.stacker.model;

import java.util.Objects;

/**
 * Identifies one calibration group and the master frame built from it. Which
 * parts of the configuration matter depends on the type: bias frames are
 * keyed by amplifier and binning, darks additionally by exposure, flats
 * additionally by filter.
 */
public class CalibrationKey {

    private final FrameType type;
    private final String qualifier;
    private final String amplifier;
    private final String binning;

    private CalibrationKey(FrameType type, String qualifier, String amplifier, String binning) {
        if (!type.isCalibration()) {
            throw new IllegalArgumentException("Not a calibration type: " + type);
        }
        this.type = type;
        this.qualifier = qualifier;
        this.amplifier = amplifier;
        this.binning = binning;
    }

    public static CalibrationKey bias(Configuration configuration) {
        return new CalibrationKey(FrameType.BIAS, null, configuration.getAmplifier(), configuration.getBinning());
    }

    public static CalibrationKey dark(String exposure, Configuration configuration) {
        return new CalibrationKey(FrameType.DARK, exposure, configuration.getAmplifier(), configuration.getBinning());
    }

    public static CalibrationKey flat(Configuration configuration) {
        return new CalibrationKey(FrameType.FLAT, configuration.getFilter(), configuration.getAmplifier(), configuration.getBinning());
    }

    /**
     * The key of the group a calibration frame belongs to.
     *
     * @param frame A BIAS, DARK or FLAT frame
     * @return The key
     */
    public static CalibrationKey of(RawFrame frame) {
        switch (frame.getType()) {
            case BIAS:
                return bias(frame.getConfiguration());
            case DARK:
                return dark(frame.getExposure(), frame.getConfiguration());
            case FLAT:
                return flat(frame.getConfiguration());
            default:
                throw new IllegalArgumentException("Not a calibration frame: " + frame);
        }
    }

    public FrameType getType() {
        return type;
    }

    /**
     * @return The exposure of a dark key
     */
    public String getExposure() {
        return type == FrameType.DARK ? qualifier : null;
    }

    /**
     * @return The filter of a flat key
     */
    public String getFilter() {
        return type == FrameType.FLAT ? qualifier : null;
    }

    public String getAmplifier() {
        return amplifier;
    }

    public String getBinning() {
        return binning;
    }

    /**
     * @return The key in the form {@code BIAS_A_1x1}, {@code DARK_30.0_A_1x1}
     * or {@code FLAT_V_A_1x1}
     */
    public String name() {
        StringBuilder builder = new StringBuilder(type.name());
        if (qualifier != null) {
            builder.append('_').append(qualifier);
        }
        return builder.append('_').append(amplifier).append('_').append(binning).toString();
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + Objects.hashCode(this.type);
        hash = 19 * hash + Objects.hashCode(this.qualifier);
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
        final CalibrationKey other = (CalibrationKey) obj;
        return this.type == other.type
                && Objects.equals(this.qualifier, other.qualifier)
                && Objects.equals(this.amplifier, other.amplifier)
                && Objects.equals(this.binning, other.binning);
    }

    @Override
    public String toString() {
        return name();
    }
}
