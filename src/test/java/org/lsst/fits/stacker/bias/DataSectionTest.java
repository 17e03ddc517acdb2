package org.lsst.fits.stacker.bias;

import java.awt.Rectangle;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import org.junit.Test;

public class DataSectionTest {

    @Test
    public void oneBasedInclusiveToRectangle() {
        assertEquals(new Rectangle(4, 0, 2048, 2048), DataSection.parse("[5:2052,1:2048]"));
        assertEquals(new Rectangle(0, 9, 10, 1), DataSection.parse(" [1:10, 10:10] "));
    }

    @Test
    public void missingSection() {
        assertNull(DataSection.parse(null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidSection() {
        DataSection.parse("5:2052,1:2048");
    }
}
