package shamir.facade;

import shamir.Configuration;
import shamir.Constants;
import shamir.encoding.Alphabet;
import shamir.random.RandomGenerator;
import shamir.secretsharing.ShamirSecretSharing;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

/**
 * This class exposes methods to split a secret into share strings and recover it back.
 */
public final class ShamirFacade extends ShamirSecretSharing {

    public ShamirFacade() {
        super();
    }

    public ShamirFacade(RandomGenerator rndGenerator) {
        super(rndGenerator, Alphabet.defaultAlphabet());
    }

    /**
     * Creates object of this class
     * @param properties Properties containing values for tags containing in the {@link Constants} class
     * @throws SecretSharingException  When fails to create object
     */
    public ShamirFacade(Properties properties) throws SecretSharingException {
        super(properties);
    }

    /**
     * Creates a facade from the settings of {@link Configuration#getInstance()}.
     * @throws SecretSharingException When the configured alphabet or generator settings are invalid
     */
    public static ShamirFacade fromConfiguration() throws SecretSharingException {
        return new ShamirFacade(Configuration.getInstance().toProperties());
    }

    /**
     * Splits the UTF-8 encoding of secret.
     */
    public List<String> split(String secret, int shareCount, int threshold) throws ParameterRangeException {
        if (secret == null)
            throw new IllegalArgumentException("Secret cannot be null!");
        return split(secret.getBytes(StandardCharsets.UTF_8), shareCount, threshold);
    }

    public String recoverString(List<String> shares) throws SecretSharingException {
        return new String(recover(shares), StandardCharsets.UTF_8);
    }
}
