package org.lsst.fits.stacker.profile;

/**
 * Wavelength regime of an instrument. Near-infrared data gets a per-frame sky
 * subtraction, optical data an optional fringe correction.
 */
public enum Wavelength {
    OPTICAL, NEAR_INFRARED
}
