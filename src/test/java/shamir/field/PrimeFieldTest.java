package shamir.field;

import org.junit.Test;
import shamir.facade.ParameterRangeException;

import java.math.BigInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PrimeFieldTest {

    @Test
    public void byteWidthGrowsWithShareCount() {
        assertEquals(1, PrimeField.byteWidthOf(1));
        assertEquals(1, PrimeField.byteWidthOf(2));
        assertEquals(1, PrimeField.byteWidthOf(256));
        assertEquals(2, PrimeField.byteWidthOf(257));
        assertEquals(2, PrimeField.byteWidthOf(300));
        assertEquals(2, PrimeField.byteWidthOf(65536));
        assertEquals(3, PrimeField.byteWidthOf(65537));
        assertEquals(7, PrimeField.byteWidthOf(PrimeField.MAX_SHARE_COUNT));
    }

    @Test
    public void primesAreAboveTheirByteRange() throws ParameterRangeException {
        long[] expected = {257L, 65537L, 16777259L, 4294967311L, 1099511627791L, 281474976710677L,
                72057594037928017L};
        for (int byteWidth = 1; byteWidth <= PrimeField.MAX_BYTE_WIDTH; byteWidth++) {
            PrimeField field = PrimeField.forByteWidth(byteWidth);
            assertEquals(BigInteger.valueOf(expected[byteWidth - 1]), field.getPrime());
            assertTrue(field.getPrime().compareTo(BigInteger.ONE.shiftLeft(8 * byteWidth)) > 0);
            assertTrue(field.getPrime().isProbablePrime(50));
        }
    }

    @Test
    public void primeOfMatchesFieldPrime() throws ParameterRangeException {
        for (int b = 1; b <= PrimeField.MAX_BYTE_WIDTH; b++)
            assertEquals(PrimeField.forByteWidth(b).getPrime(), PrimeField.primeOf(b));
    }

    @Test(expected = IllegalArgumentException.class)
    public void primeOfRejectsUnsupportedWidth() {
        PrimeField.primeOf(8);
    }

    @Test
    public void selectsPrimeFromShareCount() throws ParameterRangeException {
        assertEquals(BigInteger.valueOf(257), PrimeField.forShareCount(5).getPrime());
        PrimeField field = PrimeField.forShareCount(300);
        assertEquals(2, field.getByteWidth());
        assertEquals(BigInteger.valueOf(65537), field.getPrime());
    }

    @Test(expected = ParameterRangeException.class)
    public void rejectsZeroShares() throws ParameterRangeException {
        PrimeField.forShareCount(0);
    }

    @Test(expected = ParameterRangeException.class)
    public void rejectsTooManyShares() throws ParameterRangeException {
        PrimeField.forShareCount(PrimeField.MAX_SHARE_COUNT + 1);
    }

    @Test(expected = ParameterRangeException.class)
    public void rejectsUnsupportedByteWidth() throws ParameterRangeException {
        PrimeField.forByteWidth(8);
    }

    @Test
    public void moduloIsAlwaysPositive() throws ParameterRangeException {
        PrimeField field = PrimeField.forByteWidth(1);
        assertEquals(BigInteger.valueOf(254), field.modulo(BigInteger.valueOf(-3)));
        assertEquals(BigInteger.ZERO, field.modulo(BigInteger.valueOf(-257)));
        assertEquals(BigInteger.ONE, field.modulo(BigInteger.valueOf(258)));
    }

    @Test
    public void inverseTableCoversSmallField() throws ParameterRangeException {
        PrimeField field = PrimeField.forByteWidth(1);
        assertTrue(field.hasInverseTable());
        for (int i = 1; i < 257; i++) {
            BigInteger x = BigInteger.valueOf(i);
            assertEquals("inverse of " + i, BigInteger.ONE, field.modulo(x.multiply(field.inverse(x))));
        }
        assertEquals(BigInteger.valueOf(86), field.inverse(BigInteger.valueOf(3)));
    }

    @Test
    public void inverseOfNegativeValue() throws ParameterRangeException {
        PrimeField field = PrimeField.forByteWidth(2);
        BigInteger inverse = field.inverse(BigInteger.valueOf(-5));
        assertEquals(BigInteger.ONE, field.modulo(inverse.multiply(BigInteger.valueOf(-5))));
        assertEquals(field.modulo(field.inverse(BigInteger.valueOf(5)).negate()), inverse);
    }

    @Test
    public void largeFieldsUseModularInverse() throws ParameterRangeException {
        PrimeField field = PrimeField.forByteWidth(7);
        assertFalse(field.hasInverseTable());
        BigInteger x = new BigInteger("123456789012345");
        assertEquals(BigInteger.ONE, field.modulo(x.multiply(field.inverse(x))));
    }

    @Test
    public void inverseOfZeroIsZero() throws ParameterRangeException {
        assertEquals(BigInteger.ZERO, PrimeField.forByteWidth(1).inverse(BigInteger.ZERO));
        assertEquals(BigInteger.ZERO, PrimeField.forByteWidth(5).inverse(BigInteger.ZERO));
    }
}
