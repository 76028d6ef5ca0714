package shamir.field;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.facade.ParameterRangeException;

import java.math.BigInteger;

/**
 * Finite field Z_p used by the scheme. The prime is chosen from the number of bytes needed
 * to represent the share count, so that every chunk of that many bytes is a field element.
 */
public final class PrimeField {
    private static final Logger logger = LoggerFactory.getLogger("shamir");

    /**
     * Largest supported chunk width in bytes. 2^56 is also the largest share count.
     */
    public static final int MAX_BYTE_WIDTH = 7;
    public static final long MAX_SHARE_COUNT = 1L << (MAX_BYTE_WIDTH * 8);

    // smallest prime above 256^byteWidth, indexed by byteWidth
    private static final long[] PRIMES = {
            0L,
            257L,
            65537L,
            16777259L,
            4294967311L,
            1099511627791L,
            281474976710677L,
            72057594037928017L
    };

    private static final BigInteger GENERATOR = BigInteger.valueOf(3);

    private final int byteWidth;
    private final BigInteger prime;
    private final InverseTable inverseTable;

    private PrimeField(int byteWidth) {
        this.byteWidth = byteWidth;
        this.prime = BigInteger.valueOf(PRIMES[byteWidth]);
        this.inverseTable = InverseTable.supports(prime) ? new InverseTable(prime, GENERATOR) : null;
    }

    /**
     * Selects the field able to carry shareCount shares.
     * @param shareCount Number of shares that will be produced
     * @return Field whose prime is greater than 256^byteWidth and than shareCount
     * @throws ParameterRangeException If shareCount is not positive or above {@link #MAX_SHARE_COUNT}
     */
    public static PrimeField forShareCount(long shareCount) throws ParameterRangeException {
        if (shareCount < 1)
            throw new ParameterRangeException("Number of shares has to be at least 1");
        if (shareCount > MAX_SHARE_COUNT)
            throw new ParameterRangeException("Number of shares has to be below " + MAX_SHARE_COUNT);
        PrimeField field = forByteWidth(byteWidthOf(shareCount));
        logger.debug("Selected prime {} ({} bytes) for {} shares", field.prime, field.byteWidth, shareCount);
        return field;
    }

    /**
     * Returns the field used for chunks of byteWidth bytes.
     * @param byteWidth Chunk width in bytes
     * @return Field for that width
     * @throws ParameterRangeException If byteWidth is not between 1 and {@link #MAX_BYTE_WIDTH}
     */
    public static PrimeField forByteWidth(int byteWidth) throws ParameterRangeException {
        if (byteWidth < 1 || byteWidth > MAX_BYTE_WIDTH)
            throw new ParameterRangeException("Prime with " + byteWidth + " bytes is not supported");
        return new PrimeField(byteWidth);
    }

    /**
     * Prime used for chunks of byteWidth bytes.
     * @throws IllegalArgumentException If byteWidth is not between 1 and {@link #MAX_BYTE_WIDTH}
     */
    public static BigInteger primeOf(int byteWidth) {
        if (byteWidth < 1 || byteWidth > MAX_BYTE_WIDTH)
            throw new IllegalArgumentException("Prime with " + byteWidth + " bytes is not supported");
        return BigInteger.valueOf(PRIMES[byteWidth]);
    }

    /**
     * Minimum number of bytes needed to represent shareCount, at least one.
     */
    static int byteWidthOf(long shareCount) {
        int bits = Long.SIZE - Long.numberOfLeadingZeros(shareCount - 1);
        return Math.max(1, (bits + 7) / 8);
    }

    public int getByteWidth() {
        return byteWidth;
    }

    public BigInteger getPrime() {
        return prime;
    }

    /**
     * Euclidean remainder, always in [0, p[.
     */
    public BigInteger modulo(BigInteger number) {
        return number.mod(prime);
    }

    /**
     * Computes the multiplicative inverse of i modulo p. Negative values are reduced first.
     * The inverse of 0 is 0 by convention, so a product containing it collapses to zero.
     * @param i Value to invert
     * @return i^-1 mod p
     */
    public BigInteger inverse(BigInteger i) {
        BigInteger reduced = modulo(i);
        if (reduced.signum() == 0)
            return BigInteger.ZERO;
        if (inverseTable != null)
            return inverseTable.lookup(reduced);
        return reduced.modInverse(prime);
    }

    boolean hasInverseTable() {
        return inverseTable != null;
    }

    @Override
    public String toString() {
        return "PrimeField{p=" + prime + ", byteWidth=" + byteWidth + "}";
    }
}
