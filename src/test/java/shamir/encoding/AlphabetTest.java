package shamir.encoding;

import org.junit.Test;
import shamir.Constants;
import shamir.facade.SecretSharingException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AlphabetTest {

    @Test
    public void defaultAlphabetExcludesPadSymbol() {
        Alphabet alphabet = Alphabet.defaultAlphabet();
        assertTrue(alphabet.getSymbols().indexOf(alphabet.getPadSymbol()) < 0);
        assertEquals(45, alphabet.getBase());
        assertEquals('0', alphabet.getZeroSymbol());
    }

    @Test
    public void acceptsCustomAlphabet() throws SecretSharingException {
        Alphabet alphabet = Alphabet.of("01", '-');
        assertEquals(2, alphabet.getBase());
        assertEquals('-', alphabet.getPadSymbol());
    }

    @Test(expected = SecretSharingException.class)
    public void rejectsPadSymbolInsideAlphabet() throws SecretSharingException {
        Alphabet.of(Constants.SHARE_ALPHABET, '#');
    }

    @Test(expected = SecretSharingException.class)
    public void rejectsRepeatedSymbols() throws SecretSharingException {
        Alphabet.of("0123456789a1", '=');
    }

    @Test(expected = SecretSharingException.class)
    public void rejectsSingleSymbol() throws SecretSharingException {
        Alphabet.of("0", '=');
    }
}
