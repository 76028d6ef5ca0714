package shamir.polynomial;

import shamir.field.PrimeField;
import shamir.random.RandomGenerator;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Represents polynomial in a finite field. Coefficients are stored highest degree first,
 * the constant term being the last one.
 */
public class Polynomial {
    private final PrimeField field;
    private final BigInteger[] polynomial;
    private final int degree;

    /**
     * Generates polynomial of type a_degree*x^degree + ... + a_1*x + constant (mod p)
     * @param field Finite field
     * @param degree Degree of the polynomial
     * @param constant Constant term of this polynomial
     * @param rndGenerator Random generator to generate degree coefficients
     */
    public Polynomial(PrimeField field, int degree, BigInteger constant, RandomGenerator rndGenerator) {
        this(field, constant, generateCoefficients(field, degree, rndGenerator));
    }

    /**
     * Generates polynomial of type a_t*x^t+ ... + a_1*x + constant (mod p), where t = coefficients.length,
     * a_t,...,a_1 are coefficients[0],..., coefficients[t - 1], respectively.
     * @param field Finite field
     * @param constant Constant term of this polynomial
     * @param coefficients Coefficients of this polynomial
     */
    public Polynomial(PrimeField field, BigInteger constant, BigInteger[] coefficients) {
        this.field = field;
        this.polynomial = Arrays.copyOf(coefficients, coefficients.length + 1);
        this.polynomial[coefficients.length] = constant;
        this.degree = coefficients.length;
    }

    /**
     * Draws count random field elements. Zero draws from the generator are rejected before the
     * reduction modulo p.
     * @param field Finite field
     * @param count Number of coefficients
     * @param rndGenerator Source of random integers
     * @return Random coefficients
     */
    public static BigInteger[] generateCoefficients(PrimeField field, int count, RandomGenerator rndGenerator) {
        BigInteger[] coefficients = new BigInteger[count];
        for (int i = 0; i < count; i++) {
            BigInteger random;
            do {
                random = rndGenerator.getRandomInteger().abs();
            } while (random.signum() == 0);
            coefficients[i] = field.modulo(random);
        }
        return coefficients;
    }

    /**
     * This method uses Horner's method to evaluate polynomial at x.
     * @param x X value
     * @return Polynomial evaluated at x
     */
    public BigInteger evaluateAt(BigInteger x) {
        BigInteger b = BigInteger.ZERO;
        for (BigInteger coefficient : polynomial) {
            b = field.modulo(b.multiply(x).add(coefficient));
        }
        return b;
    }

    public int getDegree() {
        return degree;
    }

    public BigInteger getConstant() {
        return polynomial[polynomial.length - 1];
    }

    public BigInteger[] getCoefficients() {
        return Arrays.copyOf(polynomial, polynomial.length);
    }

    @Override
    public String toString() {
        int t = polynomial.length - 1;
        StringBuilder sb = new StringBuilder();
        boolean start = false;
        for (BigInteger bigInteger : polynomial) {
            if (!start && !bigInteger.equals(BigInteger.ZERO))
                start = true;
            if (start && t != 0) {
                sb.append(bigInteger);
                sb.append("x^");
                sb.append(t);
                sb.append(" + ");
            } else if (t == 0) {
                sb.append(bigInteger);
            }
            t--;
        }
        return sb.toString();
    }
}
