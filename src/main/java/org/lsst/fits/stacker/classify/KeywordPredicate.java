package org.lsst.fits.stacker.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;

/**
 * A set of (keyword, expected value) pairs that identifies one frame type.
 * All pairs must match. Values are compared ignoring case. An empty predicate means the instrument does not
 * support that frame type and never matches.
 */
public class KeywordPredicate {

    private static final KeywordPredicate NONE = new KeywordPredicate(Collections.emptyList(), Match.EQUALS);

    public enum Match {
        /**
         * The trimmed header value equals the expected value
         */
        EQUALS,
        /**
         * The header value contains the expected value
         */
        CONTAINS
    }

    private final List<String[]> pairs;
    private final Match match;

    private KeywordPredicate(List<String[]> pairs, Match match) {
        this.pairs = pairs;
        this.match = match;
    }

    public static KeywordPredicate none() {
        return NONE;
    }

    /**
     * @param keywordsAndValues Alternating keywords and expected values
     */
    public static KeywordPredicate equalTo(String... keywordsAndValues) {
        return of(Match.EQUALS, keywordsAndValues);
    }

    /**
     * @param keywordsAndValues Alternating keywords and expected substrings
     */
    public static KeywordPredicate containing(String... keywordsAndValues) {
        return of(Match.CONTAINS, keywordsAndValues);
    }

    private static KeywordPredicate of(Match match, String... keywordsAndValues) {
        if (keywordsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Keywords and values must come in pairs");
        }
        List<String[]> pairs = new ArrayList<>();
        for (int i = 0; i < keywordsAndValues.length; i += 2) {
            pairs.add(new String[]{Objects.requireNonNull(keywordsAndValues[i]), Objects.requireNonNull(keywordsAndValues[i + 1])});
        }
        return new KeywordPredicate(Collections.unmodifiableList(pairs), match);
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    public boolean matches(Header header) {
        if (pairs.isEmpty()) {
            return false;
        }
        for (String[] pair : pairs) {
            HeaderCard card = header.findCard(pair[0]);
            String value = card == null ? null : card.getValue();
            if (value == null) {
                return false;
            }
            value = value.trim();
            boolean ok = match == Match.EQUALS ? value.equalsIgnoreCase(pair[1])
                    : value.toLowerCase(Locale.ROOT).contains(pair[1].toLowerCase(Locale.ROOT));
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("KeywordPredicate{");
        for (String[] pair : pairs) {
            builder.append(pair[0]).append(match == Match.EQUALS ? "=" : "~").append(pair[1]).append(' ');
        }
        return builder.append('}').toString();
    }
}
