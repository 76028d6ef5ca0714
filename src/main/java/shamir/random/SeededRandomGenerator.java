package shamir.random;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.prng.DigestRandomGenerator;
import shamir.Constants;

import java.math.BigInteger;

/**
 * SHA-256 based deterministic generator. Two instances created with the same seed produce
 * the same sequence, which makes benchmark and test runs reproducible. Without a seed it is
 * seeded from the clock and should not be used to protect real secrets.
 */
public class SeededRandomGenerator implements RandomGenerator {
    private final DigestRandomGenerator generator;
    private final int numBytes;

    public SeededRandomGenerator(byte[] seed) {
        this(seed, Constants.DEFAULT_RANDOM_BITS);
    }

    public SeededRandomGenerator(byte[] seed, int numBits) {
        if (numBits < Constants.MIN_RANDOM_BITS)
            throw new IllegalArgumentException("Random integers need at least " + Constants.MIN_RANDOM_BITS + " bits");
        this.generator = new DigestRandomGenerator(new SHA256Digest());
        if (seed != null && seed.length > 0) {
            generator.addSeedMaterial(seed);
        } else {
            generator.addSeedMaterial(System.nanoTime());
            generator.addSeedMaterial(System.currentTimeMillis());
        }
        this.numBytes = (numBits + 7) / 8;
    }

    @Override
    public synchronized BigInteger getRandomInteger() {
        byte[] bytes = new byte[numBytes];
        generator.nextBytes(bytes);
        return new BigInteger(1, bytes);
    }
}
