package shamir.secretsharing;

import shamir.encoding.Alphabet;
import shamir.encoding.BaseConverter;
import shamir.facade.MalformedShareException;
import shamir.facade.ParameterRangeException;
import shamir.field.PrimeField;

import java.math.BigInteger;

/**
 * Converts shares to and from their printable form:
 * <pre>
 * [byte width: 1 hex digit][threshold: L symbols][shareholder: L symbols][value: L symbols]*[pad symbol]*
 * </pre>
 * where L is the number of alphabet symbols needed to write the largest chunk value or the largest
 * field element, whichever is longer. Numbers are
 * left padded with the zero symbol of the alphabet. The pad symbols count the bytes missing from
 * the last chunk of the secret.
 */
public class ShareCodec {
    private static final int BYTE_WIDTH_LENGTH = 1;
    private static final String HEX_DIGITS = "0123456789abcdef";

    private final Alphabet alphabet;

    public ShareCodec(Alphabet alphabet) {
        this.alphabet = alphabet;
    }

    public Alphabet getAlphabet() {
        return alphabet;
    }

    /**
     * Width of every threshold, shareholder and value field for the given byte width. Values are
     * field elements up to p - 1, which is at least 256^byteWidth.
     */
    public int fieldWidth(int byteWidth) {
        int maxElementLength = BaseConverter.encode(PrimeField.primeOf(byteWidth).subtract(BigInteger.ONE),
                alphabet.getSymbols()).length();
        return Math.max(BaseConverter.maxEncodedLength(byteWidth, alphabet.getSymbols()), maxElementLength);
    }

    public String encode(Share share) {
        int width = fieldWidth(share.getByteWidth());
        StringBuilder sb = new StringBuilder(BYTE_WIDTH_LENGTH + width * (2 + share.getNumberOfChunks())
                + share.getPadding());
        sb.append(Integer.toHexString(share.getByteWidth()));
        appendField(sb, BigInteger.valueOf(share.getThreshold()), width);
        appendField(sb, share.getShareholder(), width);
        for (int i = 0; i < share.getNumberOfChunks(); i++) {
            appendField(sb, share.getShare(i), width);
        }
        for (int i = 0; i < share.getPadding(); i++) {
            sb.append(alphabet.getPadSymbol());
        }
        return sb.toString();
    }

    private void appendField(StringBuilder sb, BigInteger value, int width) {
        String encoded = BaseConverter.encode(value, alphabet.getSymbols());
        if (encoded.length() > width)
            throw new IllegalArgumentException("Value " + value + " does not fit in " + width + " symbols");
        sb.append(BaseConverter.leftPad(encoded, width, alphabet.getZeroSymbol()));
    }

    /**
     * Parses a share string.
     * @param encoded Share string
     * @return Decoded share
     * @throws MalformedShareException If the header or the body cannot be parsed, or a number is
     *  outside the field selected by the byte width
     */
    public Share decode(String encoded) throws MalformedShareException {
        if (encoded == null || encoded.isEmpty())
            throw new MalformedShareException("Share is empty");

        int byteWidth = HEX_DIGITS.indexOf(encoded.charAt(0));
        PrimeField field;
        try {
            field = PrimeField.forByteWidth(byteWidth);
        } catch (ParameterRangeException e) {
            throw new MalformedShareException("Share has invalid byte width '" + encoded.charAt(0) + "'", e);
        }
        int width = fieldWidth(byteWidth);

        int end = encoded.length();
        while (end > 0 && encoded.charAt(end - 1) == alphabet.getPadSymbol())
            end--;
        int padding = encoded.length() - end;
        String content = encoded.substring(0, end);
        if (content.indexOf(alphabet.getPadSymbol()) >= 0)
            throw new MalformedShareException("Pad symbol found before the end of the share");

        int headerLength = BYTE_WIDTH_LENGTH + 2 * width;
        if (content.length() < headerLength)
            throw new MalformedShareException("Share is shorter than its header");
        int bodyLength = content.length() - headerLength;
        if (bodyLength % width != 0)
            throw new MalformedShareException("Share body length " + bodyLength + " is not a multiple of "
                    + width);
        int chunks = bodyLength / width;
        if (padding >= byteWidth || (padding > 0 && chunks == 0))
            throw new MalformedShareException("Share declares " + padding + " padding bytes for " + chunks
                    + " chunks of " + byteWidth + " bytes");

        try {
            BigInteger threshold = readField(content, BYTE_WIDTH_LENGTH, width);
            BigInteger shareholder = readField(content, BYTE_WIDTH_LENGTH + width, width);
            if (threshold.compareTo(BigInteger.valueOf(2)) < 0 || threshold.bitLength() > 31)
                throw new MalformedShareException("Share has invalid threshold " + threshold);
            if (shareholder.signum() <= 0 || shareholder.compareTo(field.getPrime()) >= 0)
                throw new MalformedShareException("Share has invalid index " + shareholder);

            BigInteger[] shares = new BigInteger[chunks];
            for (int i = 0; i < chunks; i++) {
                shares[i] = readField(content, headerLength + i * width, width);
                if (shares[i].compareTo(field.getPrime()) >= 0)
                    throw new MalformedShareException("Share value " + i + " is outside the field");
            }
            return new Share(byteWidth, threshold.intValue(), shareholder, shares, padding);
        } catch (NumberFormatException e) {
            throw new MalformedShareException("Share contains symbols outside the alphabet", e);
        }
    }

    private BigInteger readField(String content, int offset, int width) {
        return BaseConverter.decode(content.substring(offset, offset + width), alphabet.getSymbols());
    }
}
