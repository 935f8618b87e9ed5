package engram;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic text-to-vector encoder.
 *
 * <p>A token is lower-cased, trimmed and mapped to a unit vector made of four
 * equally sized sections:
 * <ol>
 *   <li>orthographic shape (length, character class ratios, repeats)</li>
 *   <li>hashed character bigrams and trigrams</li>
 *   <li>phonetic heuristics (syllables, consonant clusters, first/last sound)</li>
 *   <li>statistical heuristics (estimated frequency and rank, word shape)</li>
 * </ol>
 * Slots a section does not compute are filled from a stable string hash of
 * {@code token + section + index}, scaled into [-0.5, 0.5], so every dimension
 * is populated and the same token always yields a bit-identical vector.
 *
 * <p>Stateless and thread-safe.
 */
public final class FeatureEncoder {

    /** Default vector length. */
    public static final int DEFAULT_DIMENSIONS = 128;

    private static final String VOWELS = "aeiou";
    private static final String[] COMMON_PATTERNS = { "the", "ing", "er", "ed", "ly", "s" };

    private final int dimensions;
    private final int section;

    public FeatureEncoder() {
        this(DEFAULT_DIMENSIONS);
    }

    /**
     * @param dimensions vector length; must be a multiple of 4 and at least 64
     */
    public FeatureEncoder(int dimensions) {
        if (dimensions < 64 || dimensions % 4 != 0) {
            throw new IllegalArgumentException(
                "dimensions must be a multiple of 4 and >= 64, got " + dimensions);
        }
        this.dimensions = dimensions;
        this.section = dimensions / 4;
    }

    public int dimensions() {
        return dimensions;
    }

    /**
     * Encode a single token. Blank input yields the zero vector.
     *
     * @param token the token to encode
     * @return a fresh unit vector (or zero vector) of length {@link #dimensions()}
     */
    public float[] encode(String token) {
        if (token == null || token.isBlank()) {
            return new float[dimensions];
        }
        String word = token.toLowerCase(Locale.ROOT).trim();
        double[] features = new double[dimensions];

        encodeOrthographic(word, features, 0);
        encodeCharNGrams(word, features, section);
        encodePhonetic(word, features, 2 * section);
        encodeStatistical(word, features, 3 * section);

        return toUnitFloat(features);
    }

    /**
     * Encode a whitespace separated phrase as the re-normalized mean of its word vectors.
     */
    public float[] encodePhrase(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return new float[dimensions];
        }
        String[] words = phrase.trim().split("\\s+");
        double[] combined = new double[dimensions];
        for (String word : words) {
            float[] v = encode(word);
            for (int i = 0; i < dimensions; i++) {
                combined[i] += v[i];
            }
        }
        for (int i = 0; i < dimensions; i++) {
            combined[i] /= words.length;
        }
        return toUnitFloat(combined);
    }

    // =========================================================================
    // Sections
    // =========================================================================

    private void encodeOrthographic(String word, double[] f, int offset) {
        int len = word.length();
        f[offset] = Math.tanh(len / 10.0);

        int vowels = 0, consonants = 0, digits = 0, special = 0;
        for (int i = 0; i < len; i++) {
            char c = word.charAt(i);
            if (VOWELS.indexOf(c) >= 0) {
                vowels++;
            } else if (Character.isLetter(c)) {
                consonants++;
            }
            if (Character.isDigit(c)) {
                digits++;
            }
            if (!Character.isLetterOrDigit(c)) {
                special++;
            }
        }
        double denom = Math.max(1, len);
        f[offset + 1] = vowels / denom;
        f[offset + 2] = consonants / denom;
        f[offset + 3] = digits / denom;
        f[offset + 4] = special / denom;

        // Capitalization flags; the token is already lower-cased so these only
        // fire for scripts whose upper case survives Locale.ROOT lowering.
        boolean anyUpper = false, allUpper = true;
        for (int i = 0; i < len; i++) {
            boolean up = Character.isUpperCase(word.charAt(i));
            anyUpper |= up;
            allUpper &= up;
        }
        f[offset + 5] = Character.isUpperCase(word.charAt(0)) ? 1.0 : 0.0;
        f[offset + 6] = allUpper ? 1.0 : 0.0;
        f[offset + 7] = anyUpper && !allUpper ? 1.0 : 0.0;

        int maxRepeat = 1, run = 1;
        for (int i = 1; i < len; i++) {
            if (word.charAt(i) == word.charAt(i - 1)) {
                run++;
                maxRepeat = Math.max(maxRepeat, run);
            } else {
                run = 1;
            }
        }
        f[offset + 8] = Math.tanh(maxRepeat / 3.0);

        for (int i = 9; i < section; i++) {
            f[offset + i] = hashUnit(word + "_orth_" + i);
        }
    }

    private void encodeCharNGrams(String word, double[] f, int offset) {
        Set<String> bigrams = new LinkedHashSet<>();
        Set<String> trigrams = new LinkedHashSet<>();
        for (int i = 0; i < word.length() - 1; i++) {
            bigrams.add(word.substring(i, i + 2));
            if (i < word.length() - 2) {
                trigrams.add(word.substring(i, i + 3));
            }
        }
        int half = section / 2;
        int taken = 0;
        for (String bigram : bigrams) {
            if (taken++ == half) break;
            f[offset + stableHash(bigram) % half] += 0.5;
        }
        taken = 0;
        for (String trigram : trigrams) {
            if (taken++ == half) break;
            f[offset + half + stableHash(trigram) % half] += 0.5;
        }
    }

    private void encodePhonetic(String word, double[] f, int offset) {
        f[offset] = Math.tanh(estimateSyllables(word) / 4.0);

        int len = word.length();
        boolean startsCluster = len > 1 && !isVowel(word.charAt(0)) && !isVowel(word.charAt(1));
        boolean endsCluster = len > 1 && !isVowel(word.charAt(len - 1)) && !isVowel(word.charAt(len - 2));
        f[offset + 1] = startsCluster ? 1.0 : 0.0;
        f[offset + 2] = endsCluster ? 1.0 : 0.0;
        f[offset + 3] = hashUnit("first_" + word.charAt(0));
        f[offset + 4] = hashUnit("last_" + word.charAt(len - 1));

        for (int i = 5; i < section; i++) {
            f[offset + i] = hashUnit(word + "_phon_" + i);
        }
    }

    private void encodeStatistical(String word, double[] f, int offset) {
        double freq = frequencyEstimate(word);
        f[offset] = Math.tanh(Math.log(freq + 1) / 10.0);
        f[offset + 1] = Math.tanh(Math.log(estimateRank(freq) + 1) / 10.0);
        f[offset + 2] = hashUnit(wordShape(word));

        for (int i = 3; i < section; i++) {
            f[offset + i] = hashUnit(word + "_stat_" + i);
        }
    }

    // =========================================================================
    // Heuristics
    // =========================================================================

    static int estimateSyllables(String word) {
        int count = 0;
        boolean inGroup = false;
        for (int i = 0; i < word.length(); i++) {
            boolean vowel = "aeiouy".indexOf(word.charAt(i)) >= 0;
            if (vowel && !inGroup) {
                count++;
                inGroup = true;
            } else if (!vowel) {
                inGroup = false;
            }
        }
        if (word.endsWith("e") && count > 1) {
            count--; // silent e
        }
        return Math.max(1, count);
    }

    static double frequencyEstimate(String word) {
        double lengthScore = Math.max(0, 10 - word.length()) / 10.0;
        int patterns = 0;
        for (String p : COMMON_PATTERNS) {
            if (word.contains(p)) patterns++;
        }
        double patternScore = patterns * 0.1;
        return Math.max(1.0, lengthScore * 10 + patternScore * 5);
    }

    static int estimateRank(double freq) {
        if (freq > 5.0) {
            return (int) (1000 * (10.0 / freq));
        } else if (freq > 1.0) {
            return (int) (1000 + 9000 * (5.0 - freq) / 4.0);
        }
        return 10000 + (int) (1000 * (1.0 / Math.max(0.1, freq)));
    }

    private static String wordShape(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isUpperCase(c)) sb.append('X');
            else if (Character.isLowerCase(c)) sb.append('x');
            else if (Character.isDigit(c)) sb.append('9');
            else sb.append(c);
        }
        return sb.toString();
    }

    private static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }

    /**
     * Deterministic non-negative string hash (17/31 polynomial, sign bit cleared).
     * Unlike {@link String#hashCode()} the seed makes it independent of the JDK's choice.
     */
    public static int stableHash(String input) {
        int hash = 17;
        for (int i = 0; i < input.length(); i++) {
            hash = hash * 31 + input.charAt(i);
        }
        return hash & 0x7fffffff;
    }

    private static double hashUnit(String key) {
        return (stableHash(key) % 1000) / 1000.0 - 0.5;
    }

    private float[] toUnitFloat(double[] features) {
        double magnitude = 0.0;
        for (double x : features) {
            magnitude += x * x;
        }
        magnitude = Math.sqrt(magnitude);
        float[] out = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            out[i] = (float) (magnitude > 0 ? features[i] / magnitude : features[i]);
        }
        return out;
    }
}
