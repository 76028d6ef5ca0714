package shamir.interpolation;

import shamir.facade.DuplicateShareException;

import java.math.BigInteger;

/**
 * Exposes methods that can be invoked to recover the constant term of a polynomial from its points
 */
public interface InterpolationStrategy {

    /**
     * Computes the weights w_i such that f(0) = sum(y_i * w_i) for any polynomial f of degree
     * shareholders.length - 1. The weights only depend on the x values, so they can be reused for
     * every polynomial evaluated at the same shareholders.
     * @param shareholders X values of the points
     * @return One weight per shareholder, in the same order
     * @throws DuplicateShareException If two shareholders are equal
     */
    BigInteger[] reverseCoefficients(BigInteger[] shareholders) throws DuplicateShareException;

    /**
     * Interpolates the value at x = 0.
     * @param shares Y values, in the order of the shareholders used to compute reverseCoefficients
     * @param reverseCoefficients Weights returned by {@link #reverseCoefficients(BigInteger[])}
     * @return f(0)
     */
    BigInteger interpolateAtZero(BigInteger[] shares, BigInteger[] reverseCoefficients);
}
