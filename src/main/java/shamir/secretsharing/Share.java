package shamir.secretsharing;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Decoded form of one share string: the public header (byte width, threshold, shareholder)
 * and the polynomial evaluations at the shareholder, one per secret chunk.
 */
public final class Share {
    private final int byteWidth;
    private final int threshold;
    private final BigInteger shareholder;
    private final BigInteger[] shares;
    private final int padding;

    /**
     * @param byteWidth Number of secret bytes carried by each value
     * @param threshold Number of shares needed to recover the secret
     * @param shareholder Index of this share, the x coordinate of every point
     * @param shares Y coordinates, one per chunk
     * @param padding Number of bytes the last chunk is missing
     */
    public Share(int byteWidth, int threshold, BigInteger shareholder, BigInteger[] shares, int padding) {
        this.byteWidth = byteWidth;
        this.threshold = threshold;
        this.shareholder = shareholder;
        this.shares = Arrays.copyOf(shares, shares.length);
        this.padding = padding;
    }

    public int getByteWidth() {
        return byteWidth;
    }

    public int getThreshold() {
        return threshold;
    }

    public BigInteger getShareholder() {
        return shareholder;
    }

    public BigInteger[] getShares() {
        return Arrays.copyOf(shares, shares.length);
    }

    public BigInteger getShare(int chunk) {
        return shares[chunk];
    }

    public int getNumberOfChunks() {
        return shares.length;
    }

    public int getPadding() {
        return padding;
    }

    /**
     * Shares produced by the same split agree on everything except the shareholder and values.
     */
    public boolean isCompatibleWith(Share other) {
        return byteWidth == other.byteWidth && threshold == other.threshold
                && shares.length == other.shares.length && padding == other.padding;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Share share = (Share) o;
        return byteWidth == share.byteWidth && threshold == share.threshold && padding == share.padding
                && Objects.equals(shareholder, share.shareholder) && Arrays.equals(shares, share.shares);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(byteWidth, threshold, shareholder, padding);
        result = 31 * result + Arrays.hashCode(shares);
        return result;
    }

    @Override
    public String toString() {
        return "Share{byteWidth=" + byteWidth + ", threshold=" + threshold + ", shareholder=" + shareholder
                + ", chunks=" + shares.length + ", padding=" + padding + "}";
    }
}
