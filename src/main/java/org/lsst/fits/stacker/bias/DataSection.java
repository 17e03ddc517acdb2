package org.lsst.fits.stacker.bias;

import java.awt.Rectangle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses IRAF style section keywords such as DATASEC = '[5:2052,1:2048]'
 * into zero based rectangles.
 */
public class DataSection {

    private static final Pattern SECTION_PATTERN = Pattern.compile("\\[\\s*(\\d+):(\\d+)\\s*,\\s*(\\d+):(\\d+)\\s*\\]");

    private DataSection() {
    }

    /**
     * @param section The keyword value
     * @return The rectangle, or null if the value is null
     * @throws IllegalArgumentException If the value is not a valid section
     */
    public static Rectangle parse(String section) {
        if (section == null) {
            return null;
        }
        Matcher matcher = SECTION_PATTERN.matcher(section.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid section: " + section);
        }
        int x1 = Integer.parseInt(matcher.group(1)) - 1;
        int x2 = Integer.parseInt(matcher.group(2));
        int y1 = Integer.parseInt(matcher.group(3)) - 1;
        int y2 = Integer.parseInt(matcher.group(4));
        return new Rectangle(x1, y1, x2 - x1, y2 - y1);
    }
}
