package engram;

import engram.internal.Distance;
import org.greymatter.engram.CodebookMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * Learned region quantizer: a fixed-size codebook refined online by
 * exponential-moving-average centroid updates (VQ-VAE style).
 *
 * <p>{@link #assign(float[])} picks the code with the smallest squared L2
 * distance and then moves it toward the input:
 * <pre>
 *   N_k   = decay * N_k   + (1 - decay)
 *   m_k   = decay * m_k   + (1 - decay) * v
 *   e_k   = m_k / (N_k + 1e-5)
 * </pre>
 * The cluster-size accumulator {@code N_k} corrects the start-up bias of the
 * plain EMA, so a fresh code snaps onto the first vector it wins and repeated
 * identical input leaves it fixed. A commitment loss
 * {@code commitment * ||v - e_k||^2} (measured before the update) is tracked
 * for diagnostics only.
 *
 * <p>A zero vector is assigned to the closest code by raw distance without
 * updating it.
 *
 * <p>Not thread-safe; the engine is single-writer.
 */
public final class CodebookRegionQuantizer implements RegionQuantizer {

    private static final float SMOOTHING = 1e-5f;

    private final int codebookSize;
    private final int dimensions;
    private final float commitment;
    private final float emaDecay;

    private final float[][] codebook;
    private final float[] emaClusterSize;
    private final float[][] emaCodebookSum;
    private final long[] usageCounts;
    private long totalEncodings;

    private double lastCommitmentLoss;
    private double commitmentLossSum;
    private long commitmentLossCount;

    public CodebookRegionQuantizer(int codebookSize, int dimensions,
                                   float commitment, float emaDecay, long seed) {
        if (codebookSize < 1) {
            throw new IllegalArgumentException("codebookSize must be positive, got " + codebookSize);
        }
        if (emaDecay <= 0f || emaDecay >= 1f) {
            throw new IllegalArgumentException("emaDecay must be in (0, 1), got " + emaDecay);
        }
        this.codebookSize = codebookSize;
        this.dimensions = dimensions;
        this.commitment = commitment;
        this.emaDecay = emaDecay;

        this.codebook = new float[codebookSize][dimensions];
        this.emaClusterSize = new float[codebookSize];
        this.emaCodebookSum = new float[codebookSize][dimensions];
        this.usageCounts = new long[codebookSize];

        Random rng = new Random(seed);
        for (float[] code : codebook) {
            for (int j = 0; j < dimensions; j++) {
                code[j] = (float) (rng.nextDouble() * 0.02 - 0.01);
            }
        }
    }

    /**
     * Region code for a codebook index.
     */
    public static String codeName(int index) {
        return String.format(Locale.ROOT, "vq%03d", index);
    }

    // =========================================================================
    // RegionQuantizer
    // =========================================================================

    /**
     * Quantize and train. Every call counts as one encoding and, for a
     * non-zero vector, moves the winning code toward {@code vector}.
     */
    @Override
    public String assign(float[] vector) {
        checkDimensions(vector);
        int best = closestCode(vector);
        usageCounts[best]++;
        totalEncodings++;

        if (!Distance.isZero(vector)) {
            double loss = commitment * Distance.euclideanSquared(vector, codebook[best]);
            lastCommitmentLoss = loss;
            commitmentLossSum += loss;
            commitmentLossCount++;
            updateEma(best, vector);
        }
        return codeName(best);
    }

    @Override
    public List<String> nearest(float[] vector, int k) {
        List<String> names = new ArrayList<>();
        for (int code : nearestCodes(vector, k)) {
            names.add(codeName(code));
        }
        return names;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public boolean isAdaptive() {
        return true;
    }

    @Override
    public Optional<QuantizerStats> stats() {
        return Optional.of(computeStats());
    }

    // =========================================================================
    // Codebook access
    // =========================================================================

    /**
     * Indices of the k closest codes, closest first. Read-only.
     */
    public int[] nearestCodes(float[] vector, int k) {
        checkDimensions(vector);
        int n = Math.max(0, Math.min(k, codebookSize));
        Integer[] order = new Integer[codebookSize];
        double[] dist = new double[codebookSize];
        for (int i = 0; i < codebookSize; i++) {
            order[i] = i;
            dist[i] = Distance.euclideanSquared(vector, codebook[i]);
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> dist[i]).thenComparingInt(i -> i));
        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = order[i];
        }
        return result;
    }

    /**
     * Copy of the code vector at {@code index}.
     */
    public float[] codeVector(int index) {
        if (index < 0 || index >= codebookSize) {
            throw new IllegalArgumentException("Code " + index + " out of range [0, " + codebookSize + ")");
        }
        return codebook[index].clone();
    }

    public int codebookSize() {
        return codebookSize;
    }

    public long totalEncodings() {
        return totalEncodings;
    }

    /**
     * Clear usage counters and loss tracking. The codebook itself is kept.
     */
    public void resetStats() {
        Arrays.fill(usageCounts, 0L);
        totalEncodings = 0;
        lastCommitmentLoss = 0.0;
        commitmentLossSum = 0.0;
        commitmentLossCount = 0;
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    public CodebookSnapshot exportSnapshot() {
        return new CodebookSnapshot(commitment, emaDecay,
            deepCopy(codebook), emaClusterSize.clone(), deepCopy(emaCodebookSum),
            usageCounts.clone(), totalEncodings);
    }

    /**
     * Replace the learnable state with a snapshot.
     *
     * @throws CodebookMismatchException if the snapshot shape differs from this quantizer
     */
    public void importSnapshot(CodebookSnapshot snapshot) {
        if (snapshot.getCodebookSize() != codebookSize || snapshot.getDimensions() != dimensions) {
            throw new CodebookMismatchException(codebookSize, snapshot.getCodebookSize(),
                                                dimensions, snapshot.getDimensions());
        }
        for (int i = 0; i < codebookSize; i++) {
            System.arraycopy(snapshot.getCodebook()[i], 0, codebook[i], 0, dimensions);
            System.arraycopy(snapshot.getEmaCodebookSum()[i], 0, emaCodebookSum[i], 0, dimensions);
        }
        System.arraycopy(snapshot.getEmaClusterSize(), 0, emaClusterSize, 0, codebookSize);
        System.arraycopy(snapshot.getUsageCounts(), 0, usageCounts, 0, codebookSize);
        totalEncodings = snapshot.getTotalEncodings();
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private int closestCode(float[] vector) {
        int best = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int k = 0; k < codebookSize; k++) {
            double d = Distance.euclideanSquared(vector, codebook[k]);
            if (d < bestDistance) {
                bestDistance = d;
                best = k;
            }
        }
        return best;
    }

    private void updateEma(int code, float[] vector) {
        float keep = emaDecay;
        float take = 1f - emaDecay;
        emaClusterSize[code] = keep * emaClusterSize[code] + take;
        float[] sum = emaCodebookSum[code];
        for (int i = 0; i < dimensions; i++) {
            sum[i] = keep * sum[i] + take * vector[i];
        }
        float n = emaClusterSize[code] + SMOOTHING;
        float[] target = codebook[code];
        for (int i = 0; i < dimensions; i++) {
            target[i] = sum[i] / n;
        }
    }

    private QuantizerStats computeStats() {
        double entropy = 0.0;
        int active = 0;
        int mostUsed = 0, leastUsed = 0;
        long maxUsage = 0, minUsage = Long.MAX_VALUE;
        for (int k = 0; k < codebookSize; k++) {
            long c = usageCounts[k];
            if (c > 0) {
                active++;
                double p = (double) c / totalEncodings;
                entropy -= p * Math.log(p);
            }
            if (c > maxUsage) {
                maxUsage = c;
                mostUsed = k;
            }
            if (c < minUsage) {
                minUsage = c;
                leastUsed = k;
            }
        }
        double meanLoss = commitmentLossCount == 0 ? 0.0 : commitmentLossSum / commitmentLossCount;
        return new QuantizerStats(codebookSize, dimensions, active, totalEncodings,
            Math.exp(entropy), mostUsed, maxUsage, leastUsed, minUsage,
            lastCommitmentLoss, meanLoss);
    }

    private void checkDimensions(float[] vector) {
        if (vector.length != dimensions) {
            throw new IllegalArgumentException(
                "Expected " + dimensions + "-dim vector, got " + vector.length);
        }
    }

    private static float[][] deepCopy(float[][] src) {
        float[][] copy = new float[src.length][];
        for (int i = 0; i < src.length; i++) {
            copy[i] = src[i].clone();
        }
        return copy;
    }
}
