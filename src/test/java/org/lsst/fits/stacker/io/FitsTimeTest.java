package org.lsst.fits.stacker.io;

import java.nio.file.Paths;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class FitsTimeTest {

    @Test
    public void dateOnly() {
        assertEquals(59277.0, FitsTime.toMjd("2021-03-04"), 0);
        assertEquals(51544.0, FitsTime.toMjd("2000-01-01"), 0);
    }

    @Test
    public void dateAndTime() {
        assertEquals(51544.5, FitsTime.toMjd("2000-01-01T12:00:00"), 1e-9);
        assertEquals(51544.75, FitsTime.toMjd("2000-01-01T18:00:00.000"), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidDate() {
        FitsTime.toMjd("2000-13-45T00:00:00");
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingDate() {
        FitsTime.toMjd(null);
    }

    @Test
    public void baseNameStripsFitsSuffixes() {
        assertEquals("s1", FitsImages.baseName(Paths.get("raw", "s1.fits")));
        assertEquals("s1", FitsImages.baseName(Paths.get("s1.fits.gz")));
        assertEquals("s1", FitsImages.baseName(Paths.get("s1.fit")));
        assertEquals("s1.txt", FitsImages.baseName(Paths.get("s1.txt")));
    }
}
