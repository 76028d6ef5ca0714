package shamir.encoding;

import shamir.Constants;
import shamir.facade.SecretSharingException;

import java.util.HashSet;
import java.util.Set;

/**
 * Ordered set of symbols used as digits, plus the pad symbol that marks missing trailing bytes.
 * The pad symbol never belongs to the digits.
 */
public final class Alphabet {
    private final String symbols;
    private final char padSymbol;

    private Alphabet(String symbols, char padSymbol) {
        this.symbols = symbols;
        this.padSymbol = padSymbol;
    }

    /**
     * Creates the alphabet after checking that symbols are distinct and do not contain padSymbol.
     * @param symbols Digit symbols, the first one being the zero digit
     * @param padSymbol Symbol reserved for padding
     * @return Alphabet
     * @throws SecretSharingException If the symbols cannot be used as a positional alphabet
     */
    public static Alphabet of(String symbols, char padSymbol) throws SecretSharingException {
        if (symbols == null || symbols.length() < 2)
            throw new SecretSharingException("Alphabet needs at least two symbols");
        if (symbols.indexOf(padSymbol) >= 0)
            throw new SecretSharingException("Padding character must not be part of possible encryption chars");
        Set<Character> seen = new HashSet<>(symbols.length());
        for (int i = 0; i < symbols.length(); i++) {
            if (!seen.add(symbols.charAt(i)))
                throw new SecretSharingException("Alphabet symbol '" + symbols.charAt(i) + "' is repeated");
        }
        return new Alphabet(symbols, padSymbol);
    }

    public static Alphabet defaultAlphabet() {
        return new Alphabet(Constants.SHARE_ALPHABET, Constants.PAD_SYMBOL);
    }

    public String getSymbols() {
        return symbols;
    }

    public char getPadSymbol() {
        return padSymbol;
    }

    public char getZeroSymbol() {
        return symbols.charAt(0);
    }

    public int getBase() {
        return symbols.length();
    }

    @Override
    public String toString() {
        return symbols + " (pad " + padSymbol + ")";
    }
}
