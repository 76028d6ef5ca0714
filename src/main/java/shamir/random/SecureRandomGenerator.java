package shamir.random;

import shamir.Constants;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Draws uniformly distributed integers of a fixed bit length from {@link SecureRandom}.
 */
public class SecureRandomGenerator implements RandomGenerator {
    private final SecureRandom rndGenerator;
    private final int numBits;

    public SecureRandomGenerator() {
        this(new SecureRandom(), Constants.DEFAULT_RANDOM_BITS);
    }

    public SecureRandomGenerator(SecureRandom rndGenerator, int numBits) {
        if (rndGenerator == null)
            throw new IllegalArgumentException("Random generator cannot be null!");
        if (numBits < Constants.MIN_RANDOM_BITS)
            throw new IllegalArgumentException("Random integers need at least " + Constants.MIN_RANDOM_BITS + " bits");
        this.rndGenerator = rndGenerator;
        this.numBits = numBits;
    }

    @Override
    public BigInteger getRandomInteger() {
        return new BigInteger(numBits, rndGenerator);
    }

    public int getNumBits() {
        return numBits;
    }
}
