package shamir;

public class Constants {
    public final static String DECIMAL_ALPHABET = "0123456789";
    public final static String SHARE_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz.,:;!?*#%";
    public final static char PAD_SYMBOL = '=';

    public final static int DEFAULT_RANDOM_BITS = 128;
    public final static int MIN_RANDOM_BITS = 64;

    public final static String TAG_RANDOM_GENERATOR = "randomGenerator";
    public final static String TAG_RANDOM_BITS = "randomBits";
    public final static String TAG_RANDOM_SEED = "randomSeed";
    public final static String TAG_ALPHABET = "alphabet";
    public final static String TAG_PAD_SYMBOL = "padSymbol";

    public final static String VALUE_SECURE_GENERATOR = "secure";
    public final static String VALUE_DIGEST_GENERATOR = "digest";
}
