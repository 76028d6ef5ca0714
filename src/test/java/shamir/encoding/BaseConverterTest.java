package shamir.encoding;

import org.junit.Test;
import shamir.Constants;

import java.math.BigInteger;

import static org.junit.Assert.assertEquals;

public class BaseConverterTest {
    private static final String HEX = "0123456789abcdef";

    @Test
    public void convertsDecimalToShareAlphabet() {
        assertEquals("5u", BaseConverter.fromDecimal("255", Constants.SHARE_ALPHABET));
        assertEquals("wgg", BaseConverter.fromDecimal("65536", Constants.SHARE_ALPHABET));
        assertEquals("0", BaseConverter.fromDecimal("0", Constants.SHARE_ALPHABET));
        assertEquals("%", BaseConverter.fromDecimal("44", Constants.SHARE_ALPHABET));
    }

    @Test
    public void convertsShareAlphabetToDecimal() {
        assertEquals("255", BaseConverter.toDecimal("5u", Constants.SHARE_ALPHABET));
        assertEquals("255", BaseConverter.toDecimal("005u", Constants.SHARE_ALPHABET));
    }

    @Test
    public void convertsNumbersWiderThanLong() {
        String decimal = "123456789012345678901234567890123456789";
        assertEquals(new BigInteger(decimal).toString(16),
                BaseConverter.convert(decimal, Constants.DECIMAL_ALPHABET, HEX));
        String encoded = BaseConverter.fromDecimal(decimal, Constants.SHARE_ALPHABET);
        assertEquals(decimal, BaseConverter.toDecimal(encoded, Constants.SHARE_ALPHABET));
    }

    @Test
    public void convertsBetweenNonDecimalAlphabets() {
        assertEquals("5u", BaseConverter.convert("ff", HEX, Constants.SHARE_ALPHABET));
    }

    @Test
    public void sameAlphabetIsReturnedUnchanged() {
        assertEquals("007", BaseConverter.convert("007", HEX, HEX));
    }

    @Test(expected = NumberFormatException.class)
    public void rejectsUnknownSymbol() {
        BaseConverter.toDecimal("5U", Constants.SHARE_ALPHABET);
    }

    @Test(expected = NumberFormatException.class)
    public void rejectsEmptyNumber() {
        BaseConverter.decode("", Constants.SHARE_ALPHABET);
    }

    @Test
    public void maxEncodedLengthPerByteWidth() {
        int[] expected = {2, 3, 5, 6, 8, 9, 11};
        for (int byteWidth = 1; byteWidth <= expected.length; byteWidth++) {
            assertEquals("byte width " + byteWidth, expected[byteWidth - 1],
                    BaseConverter.maxEncodedLength(byteWidth, Constants.SHARE_ALPHABET));
        }
        assertEquals(3, BaseConverter.maxEncodedLength(1, Constants.DECIMAL_ALPHABET));
    }

    @Test
    public void leftPadsWithZeroSymbol() {
        assertEquals("005u", BaseConverter.leftPad("5u", 4, '0'));
        assertEquals("5u", BaseConverter.leftPad("5u", 2, '0'));
    }
}
