package webscan.payload;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates unique per-request markers of the form {@code XSSMARK<8 alphanumerics>XSSMARK}.
 * Instances are safe for concurrent use.
 */
public final class MarkerGenerator {
    private static final String PREFIX = "XSSMARK";
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int RANDOM_LENGTH = 8;

    private final Random random;

    public MarkerGenerator() {
        this(new SecureRandom());
    }

    public MarkerGenerator(Random random) {
        this.random = random;
    }

    public String next() {
        return PREFIX + randomPart() + PREFIX;
    }

    /**
     * Short unique value for form fields that do not carry the payload.
     */
    public String nextTag() {
        return "wst" + randomPart();
    }

    private String randomPart() {
        StringBuilder sb = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
