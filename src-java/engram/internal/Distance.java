package engram.internal;

/**
 * Scalar vector math shared by the encoder, quantizers and clusters.
 *
 * <p>All methods are static and tolerate zero vectors: a zero operand never
 * produces NaN, it produces a similarity of 0.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class Distance {

    private Distance() {} // Prevent instantiation

    /** Squared norm below which a vector is treated as zero. */
    public static final double EPSILON = 1e-12;

    // =========================================================================
    // Norms
    // =========================================================================

    /**
     * Squared L2 norm.
     */
    public static double normSquared(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return sum;
    }

    /**
     * True when every component is (numerically) zero.
     */
    public static boolean isZero(float[] v) {
        return normSquared(v) <= EPSILON;
    }

    /**
     * Normalize a vector in place (L2 normalization).
     * Zero vectors are left untouched.
     *
     * @param vector The vector to normalize (modified in place)
     */
    public static void normalizeVector(float[] vector) {
        double normSq = normSquared(vector);
        if (normSq > EPSILON) {
            float invNorm = (float) (1.0 / Math.sqrt(normSq));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= invNorm;
            }
        }
    }

    // =========================================================================
    // Pairwise
    // =========================================================================

    /**
     * Dot product of two vectors of equal length.
     */
    public static double innerProduct(float[] a, float[] b) {
        checkLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * Squared Euclidean distance.
     */
    public static double euclideanSquared(float[] a, float[] b) {
        checkLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * Cosine similarity in [-1, 1]. Returns 0 when either vector is zero.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        checkLength(a, b);
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na <= EPSILON || nb <= EPSILON) {
            return 0.0;
        }
        double cos = dot / (Math.sqrt(na) * Math.sqrt(nb));
        // Rounding can push identical vectors just past 1
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    private static void checkLength(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Vector length mismatch: " + a.length + " vs " + b.length);
        }
    }
}
