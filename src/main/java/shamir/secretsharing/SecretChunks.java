package shamir.secretsharing;

import java.math.BigInteger;

/**
 * Splits a secret into little-endian integers of a fixed number of bytes and joins them back.
 */
public final class SecretChunks {

    private SecretChunks() {}

    public static int numberOfChunks(int secretLength, int byteWidth) {
        return (secretLength + byteWidth - 1) / byteWidth;
    }

    /**
     * Number of zero bytes the last chunk is extended with.
     */
    public static int padding(int secretLength, int byteWidth) {
        return (byteWidth - secretLength % byteWidth) % byteWidth;
    }

    public static BigInteger[] toChunks(byte[] secret, int byteWidth) {
        BigInteger[] chunks = new BigInteger[numberOfChunks(secret.length, byteWidth)];
        for (int c = 0; c < chunks.length; c++) {
            long value = 0;
            int offset = c * byteWidth;
            for (int b = Math.min(byteWidth, secret.length - offset) - 1; b >= 0; b--) {
                value = (value << 8) | (secret[offset + b] & 0xFF);
            }
            chunks[c] = BigInteger.valueOf(value);
        }
        return chunks;
    }

    /**
     * Writes every chunk as byteWidth little-endian bytes and drops the last padding bytes.
     * @param chunks Values in [0, 256^byteWidth[
     * @param byteWidth Bytes per chunk
     * @param padding Number of trailing bytes to drop
     * @return Secret bytes
     */
    public static byte[] toBytes(BigInteger[] chunks, int byteWidth, int padding) {
        int length = chunks.length * byteWidth - padding;
        if (length < 0)
            throw new IllegalArgumentException("Padding " + padding + " is larger than the secret");
        byte[] secret = new byte[length];
        for (int c = 0; c < chunks.length; c++) {
            if (!fits(chunks[c], byteWidth))
                throw new IllegalArgumentException("Chunk " + c + " does not fit in " + byteWidth + " bytes");
            long value = chunks[c].longValue();
            for (int b = 0; b < byteWidth; b++) {
                int index = c * byteWidth + b;
                if (index < length)
                    secret[index] = (byte) value;
                value >>>= 8;
            }
        }
        return secret;
    }

    public static boolean fits(BigInteger chunk, int byteWidth) {
        return chunk.signum() >= 0 && chunk.bitLength() <= byteWidth * 8;
    }
}
