package org.lsst.fits.stacker;

import java.util.Locale;

/**
 * Which sorted files a reset moves back to the data root before the run.
 */
public enum ResetMode {
    /**
     * Only the classified frames in {@code raw/}
     */
    RAW,
    /**
     * Everything in {@code raw/}, {@code bad/}, {@code spec/} and
     * {@code error/}
     */
    ALL;

    public static ResetMode parse(String value) {
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException x) {
            throw new IllegalArgumentException("Invalid reset mode " + value + ", expected raw or all", x);
        }
    }
}
