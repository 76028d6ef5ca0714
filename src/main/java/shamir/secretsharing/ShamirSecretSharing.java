package shamir.secretsharing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.Constants;
import shamir.encoding.Alphabet;
import shamir.facade.DuplicateShareException;
import shamir.facade.IncompatibleSharesException;
import shamir.facade.InsufficientSharesException;
import shamir.facade.NoSharesException;
import shamir.facade.ParameterRangeException;
import shamir.facade.SecretSharingException;
import shamir.field.PrimeField;
import shamir.interpolation.InterpolationStrategy;
import shamir.interpolation.LagrangeInterpolation;
import shamir.polynomial.Polynomial;
import shamir.random.RandomGenerator;
import shamir.random.SecureRandomGenerator;
import shamir.random.SeededRandomGenerator;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implements Shamir's Secret Sharing scheme over a prime field sized to the number of shares.
 * The secret is cut into chunks of the field's byte width and every chunk is shared with its
 * own random polynomial.
 * <p>
 * Fields, and the inverse tables they hold, are created once per byte width and kept for the
 * lifetime of this object. They are read-only after construction, so one instance can serve
 * concurrent calls.
 */
public class ShamirSecretSharing {
    private final Logger logger = LoggerFactory.getLogger("shamir");

    private final ShareCodec codec;
    private final Map<Integer, PrimeField> fields;
    private volatile RandomGenerator rndGenerator;

    public ShamirSecretSharing() {
        this(new SecureRandomGenerator(), Alphabet.defaultAlphabet());
    }

    public ShamirSecretSharing(RandomGenerator rndGenerator, Alphabet alphabet) {
        if (alphabet == null)
            throw new IllegalArgumentException("Alphabet cannot be null!");
        this.rndGenerator = rndGenerator;
        this.codec = new ShareCodec(alphabet);
        this.fields = new ConcurrentHashMap<>(PrimeField.MAX_BYTE_WIDTH);
    }

    /**
     * Creates object of this class
     * @param properties Properties containing values for tags of the {@link Constants} class. Missing tags
     *                   fall back to the default generator and alphabet
     * @throws SecretSharingException When the alphabet or the random generator settings are invalid
     */
    public ShamirSecretSharing(Properties properties) throws SecretSharingException {
        this(createRandomGenerator(properties), createAlphabet(properties));
    }

    private static Alphabet createAlphabet(Properties properties) throws SecretSharingException {
        if (properties == null)
            throw new IllegalArgumentException("Properties cannot be null!");
        String symbols = properties.getProperty(Constants.TAG_ALPHABET, Constants.SHARE_ALPHABET);
        String padSymbol = properties.getProperty(Constants.TAG_PAD_SYMBOL, String.valueOf(Constants.PAD_SYMBOL));
        if (padSymbol.length() != 1)
            throw new SecretSharingException("Pad symbol must be a single character: " + padSymbol);
        return Alphabet.of(symbols, padSymbol.charAt(0));
    }

    private static RandomGenerator createRandomGenerator(Properties properties) throws SecretSharingException {
        if (properties == null)
            throw new IllegalArgumentException("Properties cannot be null!");
        String name = properties.getProperty(Constants.TAG_RANDOM_GENERATOR, Constants.VALUE_SECURE_GENERATOR);
        String bits = properties.getProperty(Constants.TAG_RANDOM_BITS, String.valueOf(Constants.DEFAULT_RANDOM_BITS));
        String seed = properties.getProperty(Constants.TAG_RANDOM_SEED);
        try {
            int numBits = Integer.parseInt(bits.trim());
            switch (name) {
                case Constants.VALUE_SECURE_GENERATOR:
                    return new SecureRandomGenerator(new SecureRandom(), numBits);
                case Constants.VALUE_DIGEST_GENERATOR:
                    return new SeededRandomGenerator(seed == null ? null : new BigInteger(seed.trim(), 16).toByteArray(),
                            numBits);
                default:
                    throw new SecretSharingException("Unknown random generator: " + name);
            }
        } catch (NumberFormatException e) {
            throw new SecretSharingException("Invalid random generator number: bits=" + bits + ", seed=" + seed, e);
        } catch (IllegalArgumentException e) {
            throw new SecretSharingException("Invalid random generator settings: " + e.getMessage(), e);
        }
    }

    public RandomGenerator getRandomGenerator() {
        RandomGenerator generator = rndGenerator;
        if (generator == null) {
            generator = new SecureRandomGenerator();
            rndGenerator = generator;
        }
        return generator;
    }

    public void setRandomGenerator(RandomGenerator rndGenerator) {
        this.rndGenerator = rndGenerator;
    }

    public ShareCodec getCodec() {
        return codec;
    }

    /**
     * Returns the field for the given byte width, creating it on first use.
     */
    PrimeField getField(int byteWidth) throws ParameterRangeException {
        PrimeField field = fields.get(byteWidth);
        if (field == null) {
            PrimeField created = PrimeField.forByteWidth(byteWidth);
            field = fields.putIfAbsent(byteWidth, created);
            if (field == null)
                field = created;
        }
        return field;
    }

    /**
     * Computes shares of a secret
     * @param secret Secret data
     * @param shareCount Number of shares to create
     * @param threshold Number of shares needed to recover the secret
     * @return shareCount share strings, the i-th one having index i + 1
     * @throws ParameterRangeException If threshold is below 2 or above shareCount, or shareCount is not
     *  supported
     */
    public List<String> split(byte[] secret, int shareCount, int threshold) throws ParameterRangeException {
        if (secret == null)
            throw new IllegalArgumentException("Secret cannot be null!");
        if (threshold < 2)
            throw new ParameterRangeException("Threshold has to be at least 2");
        PrimeField selected = PrimeField.forShareCount(shareCount);
        PrimeField field = getField(selected.getByteWidth());
        if (BigInteger.valueOf(shareCount).compareTo(field.getPrime()) >= 0)
            throw new ParameterRangeException("Number of shares has to be between 1 and " + field.getPrime());
        if (threshold > shareCount)
            throw new ParameterRangeException("Threshold has to be between 2 and " + shareCount);

        int byteWidth = field.getByteWidth();
        logger.debug("Sharing {} bytes into {} shares with threshold {} and prime {}", secret.length, shareCount,
                threshold, field.getPrime());

        RandomGenerator generator = getRandomGenerator();
        BigInteger[] chunks = SecretChunks.toChunks(secret, byteWidth);
        BigInteger[][] values = new BigInteger[shareCount][chunks.length];
        for (int c = 0; c < chunks.length; c++) {
            Polynomial polynomial = new Polynomial(field, threshold - 1, chunks[c], generator);
            for (int x = 1; x <= shareCount; x++) {
                values[x - 1][c] = polynomial.evaluateAt(BigInteger.valueOf(x));
            }
        }

        int padding = SecretChunks.padding(secret.length, byteWidth);
        List<String> shares = new ArrayList<>(shareCount);
        for (int x = 1; x <= shareCount; x++) {
            shares.add(codec.encode(new Share(byteWidth, threshold, BigInteger.valueOf(x), values[x - 1], padding)));
        }
        return shares;
    }

    /**
     * Parses a share string without recovering anything.
     * @param share Share string
     * @return Header and values of the share
     * @throws SecretSharingException If the share is malformed
     */
    public Share decodeShare(String share) throws SecretSharingException {
        return codec.decode(share);
    }

    /**
     * Combines shares to reconstruct the secret. Only the first threshold shares take part in the
     * interpolation; the others are still checked for compatibility.
     * @param encodedShares Share strings produced by one call to {@link #split(byte[], int, int)}
     * @return Reconstructed secret
     * @throws SecretSharingException If no share is given, a share is malformed, the shares come from
     *  different splits, fewer shares than the threshold are given or two shares have the same index
     */
    public byte[] recover(List<String> encodedShares) throws SecretSharingException {
        if (encodedShares == null || encodedShares.isEmpty())
            throw new NoSharesException("No keys given.");

        List<Share> shares = new ArrayList<>(encodedShares.size());
        Set<BigInteger> shareholders = new HashSet<>(encodedShares.size() * 2);
        for (String encoded : encodedShares) {
            Share share = codec.decode(encoded);
            if (!shares.isEmpty() && !shares.get(0).isCompatibleWith(share)) {
                logger.warn("Share {} is incompatible with share {}", share, shares.get(0));
                throw new IncompatibleSharesException("Given keys are incompatible.");
            }
            if (!shareholders.add(share.getShareholder()))
                throw new DuplicateShareException("Repeated share detected for index " + share.getShareholder());
            shares.add(share);
        }

        Share reference = shares.get(0);
        int threshold = reference.getThreshold();
        if (shares.size() < threshold)
            throw new InsufficientSharesException("Not enough keys to disclose secret: " + threshold
                    + " needed but " + shares.size() + " given.");

        int byteWidth = reference.getByteWidth();
        PrimeField field = getField(byteWidth);
        InterpolationStrategy interpolationStrategy = new LagrangeInterpolation(field);
        logger.debug("Recovering {} chunks of {} bytes from {} shares", reference.getNumberOfChunks(), byteWidth,
                threshold);

        BigInteger[] xs = new BigInteger[threshold];
        for (int i = 0; i < threshold; i++) {
            xs[i] = shares.get(i).getShareholder();
        }
        BigInteger[] coefficients = interpolationStrategy.reverseCoefficients(xs);

        BigInteger[] chunks = new BigInteger[reference.getNumberOfChunks()];
        BigInteger[] points = new BigInteger[threshold];
        for (int c = 0; c < chunks.length; c++) {
            for (int i = 0; i < threshold; i++) {
                points[i] = shares.get(i).getShare(c);
            }
            chunks[c] = interpolationStrategy.interpolateAtZero(points, coefficients);
            if (!SecretChunks.fits(chunks[c], byteWidth))
                throw new IncompatibleSharesException("Recovered chunk " + c + " does not fit in " + byteWidth
                        + " bytes. Shares do not belong to the same secret.");
        }
        return SecretChunks.toBytes(chunks, byteWidth, reference.getPadding());
    }
}
