package datagenerators;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeded generator of string lists with controlled prefix sharing, for benchmarks and
 * randomized checks. Same seed, same lists.
 */
public class PrefixDatasetGenerator {
    public static final char[] DEFAULT_ALPHABET = "abcdefghijklmnopqrstuvwxyz_/".toCharArray();

    private final RandomGenerator rng;
    private final char[] alphabet;

    public PrefixDatasetGenerator(long seed) {
        this(seed, DEFAULT_ALPHABET);
    }

    public PrefixDatasetGenerator(long seed, char[] alphabet) {
        if (alphabet == null || alphabet.length == 0) {
            throw new IllegalArgumentException("alphabet cannot be empty");
        }
        this.rng = new Well19937c(seed);
        this.alphabet = alphabet.clone();
    }

    public String randomString(int length) {
        if (length < 0) throw new IllegalArgumentException("length < 0");
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet[rng.nextInt(alphabet.length)];
        }
        return new String(chars);
    }

    // count strings = one random shared prefix + independent random suffixes.
    public List<String> sharedPrefix(int count, int prefixLength, int suffixLength) {
        if (count < 0) throw new IllegalArgumentException("count < 0");
        String prefix = randomString(prefixLength);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(prefix + randomString(suffixLength));
        }
        return out;
    }

    /**
     * Each string copies a random-length head of a common base string and continues with random
     * characters, so prefixes shrink irregularly as strings are added. Lengths vary in
     * {@code [0, maxLength]}, empty strings included.
     */
    public List<String> decaying(int count, int maxLength) {
        if (count < 0) throw new IllegalArgumentException("count < 0");
        if (maxLength < 0) throw new IllegalArgumentException("maxLength < 0");
        String base = randomString(maxLength);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int shared = rng.nextInt(maxLength + 1);
            int tail = rng.nextInt(maxLength - shared + 1);
            out.add(base.substring(0, shared) + randomString(tail));
        }
        return out;
    }
}
