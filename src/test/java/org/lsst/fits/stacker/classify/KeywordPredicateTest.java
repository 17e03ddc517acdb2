package org.lsst.fits.stacker.classify;

import nom.tam.fits.Header;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class KeywordPredicateTest {

    private static Header header(String... cards) throws Exception {
        Header header = new Header();
        for (int i = 0; i < cards.length; i += 2) {
            header.addValue(cards[i], cards[i + 1], "");
        }
        return header;
    }

    @Test
    public void allPairsMustMatch() throws Exception {
        KeywordPredicate science = KeywordPredicate.equalTo("OBSMODE", "imaging", "APTYPE", "open");
        assertTrue(science.matches(header("OBSMODE", "imaging", "APTYPE", "open")));
        assertFalse(science.matches(header("OBSMODE", "imaging", "APTYPE", "mos")));
        assertFalse(science.matches(header("OBSMODE", "imaging")));
    }

    @Test
    public void valuesAreTrimmed() throws Exception {
        assertTrue(KeywordPredicate.equalTo("IMAGETYP", "bias").matches(header("IMAGETYP", "bias   ")));
    }

    @Test
    public void containingMatchesSubstring() throws Exception {
        KeywordPredicate flat = KeywordPredicate.containing("IMAGETYP", "flat");
        assertTrue(flat.matches(header("IMAGETYP", "domeflat")));
        assertFalse(flat.matches(header("IMAGETYP", "object")));
    }

    @Test
    public void caseIsIgnored() throws Exception {
        assertTrue(KeywordPredicate.equalTo("OBJECT", "Dark").matches(header("OBJECT", "DARK")));
        assertTrue(KeywordPredicate.containing("IMAGETYP", "flat").matches(header("IMAGETYP", "DomeFlat")));
        assertFalse(KeywordPredicate.equalTo("OBJECT", "Dark").matches(header("OBJECT", "Darkness")));
    }

    @Test
    public void emptyPredicateNeverMatches() throws Exception {
        assertTrue(KeywordPredicate.none().isEmpty());
        assertFalse(KeywordPredicate.none().matches(header("IMAGETYP", "bias")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void pairsRequired() {
        KeywordPredicate.equalTo("IMAGETYP");
    }
}
