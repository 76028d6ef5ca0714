package shamir.field;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Lookup table of multiplicative inverses modulo a small prime. It is filled by walking the
 * cycle of a primitive root g: when x = g^k then x^-1 = (g^-1)^k, so both sequences advance in
 * lock step. The table is built on first lookup and is read-only afterwards.
 */
final class InverseTable {
    private static final Logger logger = LoggerFactory.getLogger("shamir");

    /**
     * Largest prime for which a table is kept in memory.
     */
    static final long MAX_TABLE_PRIME = 65537L;

    private final int prime;
    private final int generator;
    private final int generatorInverse;
    private volatile int[] table;

    InverseTable(BigInteger prime, BigInteger generator) {
        if (!supports(prime))
            throw new IllegalArgumentException("Prime " + prime + " is too large for an inverse table");
        this.prime = prime.intValueExact();
        this.generator = generator.intValueExact();
        this.generatorInverse = generator.modInverse(prime).intValueExact();
    }

    static boolean supports(BigInteger prime) {
        return prime.compareTo(BigInteger.valueOf(MAX_TABLE_PRIME)) <= 0;
    }

    /**
     * @param x Value in ]0, p[
     * @return x^-1 mod p
     */
    BigInteger lookup(BigInteger x) {
        return BigInteger.valueOf(table()[x.intValueExact()]);
    }

    private int[] table() {
        int[] result = table;
        if (result == null) {
            synchronized (this) {
                result = table;
                if (result == null) {
                    result = build();
                    table = result;
                }
            }
        }
        return result;
    }

    private int[] build() {
        logger.debug("Building inverse table for prime {}", prime);
        int[] result = new int[prime];
        long x = 1;
        long y = 1;
        for (int i = 0; i < prime - 1; i++) {
            if (i > 0 && x == 1)
                throw new IllegalStateException(generator + " is not a primitive root of " + prime);
            result[(int) x] = (int) y;
            x = x * generator % prime;
            y = y * generatorInverse % prime;
        }
        return result;
    }
}
