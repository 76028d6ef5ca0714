package shamir;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Properties;

public final class Configuration {
	private static final Logger logger = LoggerFactory.getLogger("shamir");

	private static String configurationFilePath =
			"config" + File.separator + "shamir.config";
	private String randomGenerator = Constants.VALUE_SECURE_GENERATOR;
	private int randomBits = Constants.DEFAULT_RANDOM_BITS;
	private String randomSeed;
	private String alphabet = Constants.SHARE_ALPHABET;
	private char padSymbol = Constants.PAD_SYMBOL;

	private static Configuration INSTANT;

	public static synchronized void setConfigurationFilePath(String configurationFilePath) {
		Configuration.configurationFilePath = configurationFilePath;
		INSTANT = null;
	}

	/**
	 * Loads the configuration file on first call. Defaults are used when the file does not exist.
	 */
	public static synchronized Configuration getInstance() {
		if (INSTANT == null) {
			try {
				INSTANT = new Configuration(configurationFilePath);
			} catch (IOException e) {
				throw new UncheckedIOException("Failed to read " + configurationFilePath, e);
			}
		}
		return INSTANT;
	}

	Configuration(String configurationFilePath) throws IOException {
		File file = new File(configurationFilePath);
		if (!file.exists()) {
			logger.info("Configuration file {} not found. Using defaults", configurationFilePath);
			return;
		}
		logger.info("Loading configuration from {}", configurationFilePath);
		try (BufferedReader in = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = in.readLine()) != null) {
				if (line.startsWith("#")) {
					continue;
				}
				String[] tokens = line.split("=", 2);
				if (tokens.length != 2)
					continue;
				String propertyName = tokens[0].trim();
				String value = tokens[1].trim();
				switch (propertyName) {
					case "shamir.random.generator":
						if (value.equals(Constants.VALUE_SECURE_GENERATOR) || value.equals(Constants.VALUE_DIGEST_GENERATOR))
							randomGenerator = value;
						else
							throw new IllegalArgumentException("Property shamir.random.generator " +
									"has invalid value");
						break;
					case "shamir.random.bits":
						randomBits = Integer.parseInt(value);
						if (randomBits < Constants.MIN_RANDOM_BITS)
							throw new IllegalArgumentException("Property shamir.random.bits has to be at least "
									+ Constants.MIN_RANDOM_BITS);
						break;
					case "shamir.random.seed":
						randomSeed = value;
						break;
					case "shamir.encoding.alphabet":
						alphabet = value;
						break;
					case "shamir.encoding.pad_symbol":
						if (value.length() != 1)
							throw new IllegalArgumentException("Property shamir.encoding.pad_symbol " +
									"has to be a single character");
						padSymbol = value.charAt(0);
						break;
					default:
						throw new IllegalArgumentException("Unknown property name " + propertyName);
				}
			}
		}
	}

	/**
	 * Properties understood by {@link shamir.facade.ShamirFacade#ShamirFacade(Properties)}.
	 */
	public Properties toProperties() {
		Properties properties = new Properties();
		properties.put(Constants.TAG_RANDOM_GENERATOR, randomGenerator);
		properties.put(Constants.TAG_RANDOM_BITS, String.valueOf(randomBits));
		if (randomSeed != null)
			properties.put(Constants.TAG_RANDOM_SEED, randomSeed);
		properties.put(Constants.TAG_ALPHABET, alphabet);
		properties.put(Constants.TAG_PAD_SYMBOL, String.valueOf(padSymbol));
		return properties;
	}

	public String getRandomGenerator() {
		return randomGenerator;
	}

	public int getRandomBits() {
		return randomBits;
	}

	public String getRandomSeed() {
		return randomSeed;
	}

	public String getAlphabet() {
		return alphabet;
	}

	public char getPadSymbol() {
		return padSymbol;
	}
}
