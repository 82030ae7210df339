package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Seeded random words over the first {@code alphabetSize} lower-case letters, for stress
 * tests and the command line driver. Small alphabets give highly repetitive words, which is
 * where suffix links and canonicalization get exercised.
 */
public class WordGenerator {

    public static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";

    private final RandomGenerator rng;

    public WordGenerator(long seed) {
        // Seeded random number generator for reproducibility
        this.rng = new Well19937c(seed);
    }

    public String uniform(int length, int alphabetSize) {
        checkArguments(length, alphabetSize);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = LETTERS.charAt(rng.nextInt(alphabetSize));
        }
        return new String(chars);
    }

    // Letter of rank r (1-based) drawn with probability proportional to 1 / r^exponent.
    public String zipf(int length, int alphabetSize, double exponent) {
        checkArguments(length, alphabetSize);
        if (exponent <= 0.0) {
            throw new IllegalArgumentException("exponent must be positive");
        }
        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = LETTERS.charAt(dist.sample() - 1);
        }
        return new String(chars);
    }

    private static void checkArguments(int length, int alphabetSize) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (alphabetSize < 1 || alphabetSize > LETTERS.length()) {
            throw new IllegalArgumentException("alphabetSize must be in [1, " + LETTERS.length() + "]");
        }
    }
}
