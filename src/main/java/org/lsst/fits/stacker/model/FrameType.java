package org.lsst.fits.stacker.model;

/**
 * The type a raw frame is classified as. The names are what the manifest
 * stores in its Type column.
 */
public enum FrameType {
    BIAS, DARK, FLAT, SCIENCE, SPEC, BAD;

    public boolean isCalibration() {
        return this == BIAS || this == DARK || this == FLAT;
    }
}
