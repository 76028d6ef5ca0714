package shamir.random;

import java.math.BigInteger;

/**
 * Source of random integers used to pick polynomial coefficients.
 * Cryptographic strength is the responsibility of the implementation.
 */
public interface RandomGenerator {

    /**
     * Produces a random integer.
     * @return Non-negative random integer, spanning a range much wider than the field
     */
    BigInteger getRandomInteger();
}
