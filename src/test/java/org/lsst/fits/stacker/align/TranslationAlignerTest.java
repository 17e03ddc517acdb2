package org.lsst.fits.stacker.align;

import java.awt.Point;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import nom.tam.fits.Header;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.lsst.fits.stacker.FrameFixtures;
import org.lsst.fits.stacker.model.ImageFrame;

public class TranslationAlignerTest {

    private static ImageFrame frame(String name, float[][] data) {
        return new ImageFrame(Paths.get(name), data, null, new Header(), 59000.0, 30.0);
    }

    @Test
    public void displacedFrameIsShiftedOntoReference() {
        float[][] reference = FrameFixtures.starField(64, 0, 0, 100);
        float[][] displaced = FrameFixtures.starField(64, 3, -2, 100);
        List<ImageFrame> aligned = new TranslationAligner().align(Arrays.asList(frame("a", reference), frame("b", displaced)), null);

        assertEquals(2, aligned.size());
        float[][] shifted = aligned.get(1).getData();
        for (int y = 5; y < 59; y++) {
            for (int x = 5; x < 58; x++) {
                assertEquals(reference[y][x], shifted[y][x], 0);
            }
        }
        assertTrue(Float.isNaN(shifted[0][0]));
        assertTrue(Float.isNaN(shifted[63][62]));
    }

    @Test
    public void frameWithoutStarsIsDropped() {
        float[][] reference = FrameFixtures.starField(64, 0, 0, 100);
        float[][] empty = new float[64][64];
        List<ImageFrame> aligned = new TranslationAligner().align(Arrays.asList(frame("a", reference), frame("b", empty)), null);
        assertEquals(1, aligned.size());
        assertEquals(Paths.get("a"), aligned.get(0).getPath());
    }

    @Test
    public void frameOfOtherSizeIsDropped() {
        List<ImageFrame> aligned = new TranslationAligner().align(Arrays.asList(
                frame("a", FrameFixtures.starField(64, 0, 0, 100)), frame("b", FrameFixtures.starField(48, 0, 0, 100))), null);
        assertEquals(1, aligned.size());
    }

    @Test
    public void shiftMovesMaskWithData() {
        float[][] data = {{1, 2, 3}, {4, 5, 6}};
        boolean[][] mask = {{false, true, false}, {false, false, false}};
        ImageFrame frame = new ImageFrame(Paths.get("m"), data, mask, new Header(), 1.0, 1.0);
        ImageFrame shifted = TranslationAligner.shift(frame, new Point(1, 0));
        assertTrue(Float.isNaN(shifted.getData()[0][0]));
        assertEquals(1.0f, shifted.getData()[0][1], 0);
        assertEquals(5.0f, shifted.getData()[1][2], 0);
        assertTrue(shifted.getMask()[0][0]);
        assertTrue(shifted.getMask()[0][2]);
        assertEquals(1.0, shifted.getTime(), 0);
    }
}
