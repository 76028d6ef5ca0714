package shamir.interpolation;

import shamir.facade.DuplicateShareException;
import shamir.field.PrimeField;

import java.math.BigInteger;

/**
 * This class implements Lagrange Interpolation equations.
 * All the computations are done on a finite field
 */
public class LagrangeInterpolation implements InterpolationStrategy {
    private final PrimeField field;

    /**
     * Instantiates object to allow interpolation of polynomials in finite field field
     * @param field Finite field
     */
    public LagrangeInterpolation(PrimeField field) {
        this.field = field;
    }

    /**
     * w_i = prod_{j != i} (-x_j) * (x_i - x_j)^-1 mod p. A zero weight can only come from
     * x_i == x_j, whose difference has no inverse.
     */
    @Override
    public BigInteger[] reverseCoefficients(BigInteger[] shareholders) throws DuplicateShareException {
        BigInteger[] coefficients = new BigInteger[shareholders.length];
        for (int i = 0; i < shareholders.length; i++) {
            BigInteger temp = BigInteger.ONE;
            for (int j = 0; j < shareholders.length; j++) {
                if (i == j)
                    continue;
                BigInteger inverse = field.inverse(shareholders[i].subtract(shareholders[j]));
                temp = field.modulo(temp.negate().multiply(shareholders[j]).multiply(inverse));
            }
            if (temp.signum() == 0)
                throw new DuplicateShareException("Repeated share detected - cannot compute reverse-coefficients");
            coefficients[i] = temp;
        }
        return coefficients;
    }

    @Override
    public BigInteger interpolateAtZero(BigInteger[] shares, BigInteger[] reverseCoefficients) {
        if (shares.length != reverseCoefficients.length)
            throw new IllegalArgumentException("Expected " + reverseCoefficients.length + " shares but got "
                    + shares.length);
        BigInteger result = BigInteger.ZERO;
        for (int i = 0; i < shares.length; i++) {
            result = field.modulo(result.add(shares[i].multiply(reverseCoefficients[i])));
        }
        return result;
    }
}
