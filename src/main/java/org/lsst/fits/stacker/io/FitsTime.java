package org.lsst.fits.stacker.io;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Conversion of FITS DATE-OBS values to Modified Julian Date.
 */
public class FitsTime {

    /**
     * MJD of the Unix epoch, 1970-01-01T00:00.
     */
    private static final double MJD_EPOCH = 40587.0;

    private FitsTime() {
    }

    /**
     * @param dateObs An ISO date, with or without a time part
     * @return The MJD
     * @throws IllegalArgumentException If the value cannot be parsed
     */
    public static double toMjd(String dateObs) {
        if (dateObs == null) {
            throw new IllegalArgumentException("Missing observation date");
        }
        String value = dateObs.trim();
        try {
            if (value.length() <= 10) {
                return LocalDate.parse(value).toEpochDay() + MJD_EPOCH;
            }
            LocalDateTime time = LocalDateTime.parse(value.replace(' ', 'T'));
            double day = time.toLocalDate().toEpochDay() + MJD_EPOCH;
            double seconds = time.toLocalTime().toNanoOfDay() / 1e9;
            return day + seconds / 86400.0;
        } catch (DateTimeParseException x) {
            throw new IllegalArgumentException("Invalid observation date: " + dateObs, x);
        }
    }
}
