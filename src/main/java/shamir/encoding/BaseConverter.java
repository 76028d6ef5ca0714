package shamir.encoding;

import shamir.Constants;

import java.math.BigInteger;

/**
 * Arbitrary precision conversion of numbers written with one symbol alphabet into another.
 */
public final class BaseConverter {

    private BaseConverter() {}

    /**
     * Converts digits written in fromAlphabet into the same number written in toAlphabet.
     * @param digits Number to convert
     * @param fromAlphabet Symbols of the source base
     * @param toAlphabet Symbols of the target base
     * @return Converted number without leading zero symbols
     * @throws NumberFormatException If digits is empty or contains a symbol outside fromAlphabet
     */
    public static String convert(String digits, String fromAlphabet, String toAlphabet) {
        if (fromAlphabet.equals(toAlphabet))
            return digits;
        return encode(decode(digits, fromAlphabet), toAlphabet);
    }

    /**
     * Accumulates the digits as sum of digit * base^position.
     */
    public static BigInteger decode(String digits, String alphabet) {
        if (digits == null || digits.isEmpty())
            throw new NumberFormatException("Zero length number");
        BigInteger base = BigInteger.valueOf(alphabet.length());
        BigInteger result = BigInteger.ZERO;
        for (int i = 0; i < digits.length(); i++) {
            int digit = alphabet.indexOf(digits.charAt(i));
            if (digit < 0)
                throw new NumberFormatException("Symbol '" + digits.charAt(i) + "' is not part of the alphabet");
            result = result.multiply(base).add(BigInteger.valueOf(digit));
        }
        return result;
    }

    public static String encode(BigInteger number, String alphabet) {
        if (number.signum() < 0)
            throw new IllegalArgumentException("Negative numbers cannot be encoded");
        if (number.signum() == 0)
            return String.valueOf(alphabet.charAt(0));
        BigInteger base = BigInteger.valueOf(alphabet.length());
        StringBuilder sb = new StringBuilder();
        BigInteger remaining = number;
        while (remaining.signum() != 0) {
            BigInteger[] qr = remaining.divideAndRemainder(base);
            sb.append(alphabet.charAt(qr[1].intValue()));
            remaining = qr[0];
        }
        return sb.reverse().toString();
    }

    public static String toDecimal(String digits, String alphabet) {
        return convert(digits, alphabet, Constants.DECIMAL_ALPHABET);
    }

    public static String fromDecimal(String digits, String alphabet) {
        return convert(digits, Constants.DECIMAL_ALPHABET, alphabet);
    }

    /**
     * Number of symbols needed to write 2^(byteWidth*8) - 1, the largest chunk value.
     * @param byteWidth Chunk width in bytes
     * @param alphabet Target alphabet
     * @return Fixed field width used for every encoded value of that byte width
     */
    public static int maxEncodedLength(int byteWidth, String alphabet) {
        BigInteger max = BigInteger.ONE.shiftLeft(byteWidth * 8).subtract(BigInteger.ONE);
        return encode(max, alphabet).length();
    }

    /**
     * Left pads encoded with the zero symbol of alphabet up to width.
     */
    public static String leftPad(String encoded, int width, char zeroSymbol) {
        if (encoded.length() >= width)
            return encoded;
        StringBuilder sb = new StringBuilder(width);
        for (int i = encoded.length(); i < width; i++)
            sb.append(zeroSymbol);
        return sb.append(encoded).toString();
    }
}
