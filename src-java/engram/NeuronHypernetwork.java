package engram;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Decides how many neurons a new pattern gets and what those neurons look like.
 *
 * <p>The count is
 * <pre>
 *   clamp(round(min + alpha*ln(1+frequency) + beta*novelty + gamma*complexity), min, max)
 * </pre>
 * and complexity blends the sparsity, variance and normalized entropy of the
 * vector. Both are pure functions of their inputs. Neuron properties are drawn
 * from a {@link java.util.Random} seeded by the configured seed and the exact
 * bits of the pattern, so identical patterns always get identical neurons.
 */
public final class NeuronHypernetwork {

    private final double alpha;
    private final double beta;
    private final double gamma;
    private final int minNeurons;
    private final int maxNeurons;
    private final long seed;

    public NeuronHypernetwork(double alpha, double beta, double gamma,
                              int minNeurons, int maxNeurons, long seed) {
        if (minNeurons < 0 || maxNeurons < minNeurons) {
            throw new IllegalArgumentException(
                "Invalid neuron bounds [" + minNeurons + ", " + maxNeurons + "]");
        }
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
        this.minNeurons = minNeurons;
        this.maxNeurons = maxNeurons;
        this.seed = seed;
    }

    /**
     * Target neuron count for a pattern.
     *
     * @param novelty 0 = familiar, 1 = unprecedented
     * @param frequency region activation frequency in [0, 1]
     * @param complexity pattern complexity in [0, 1]
     */
    public int neuronCount(double novelty, double frequency, double complexity) {
        double raw = minNeurons
                     + alpha * Math.log(1 + Math.max(0.0, frequency))
                     + beta * novelty
                     + gamma * complexity;
        long rounded = Math.round(raw);
        return (int) Math.max(minNeurons, Math.min(maxNeurons, rounded));
    }

    /**
     * Complexity in [0, 1]: {@code 0.3*sparsity + 0.3*min(1, 10*variance) + 0.4*entropy},
     * where sparsity is the share of non-zero components and entropy is the
     * Shannon entropy of the absolute components normalized by {@code ln(n)}.
     */
    public double complexity(float[] vector) {
        int n = vector.length;
        if (n == 0) {
            return 0.0;
        }
        int nonZero = 0;
        double mean = 0.0;
        double absSum = 0.0;
        for (float f : vector) {
            if (Math.abs(f) > 1e-6) nonZero++;
            mean += f;
            absSum += Math.abs(f);
        }
        mean /= n;
        double variance = 0.0;
        for (float f : vector) {
            variance += (f - mean) * (f - mean);
        }
        variance /= n;

        double entropy = 0.0;
        if (absSum > 0 && n > 1) {
            for (float f : vector) {
                double p = Math.abs(f) / absSum;
                if (p > 1e-10) {
                    entropy -= p * Math.log(p);
                }
            }
            entropy /= Math.log(n);
        }

        double sparsity = (double) nonZero / n;
        double varianceScore = Math.min(1.0, variance * 10);
        double c = 0.3 * sparsity + 0.3 * varianceScore + 0.4 * entropy;
        return Math.max(0.0, Math.min(1.0, c));
    }

    /**
     * Deterministic properties for {@code count} new neurons of a pattern.
     */
    public List<NeuronProperties> generateNeurons(float[] pattern, int count) {
        List<NeuronProperties> out = new ArrayList<>(count);
        Random rng = new Random(patternSeed(pattern));
        for (int i = 0; i < count; i++) {
            double threshold = 0.3 + rng.nextDouble() * 0.4;
            double decay = 0.9 + rng.nextDouble() * 0.09;
            out.add(new NeuronProperties(i, threshold, decay, roleFor(i, count, rng)));
        }
        return out;
    }

    public int minNeurons() {
        return minNeurons;
    }

    public int maxNeurons() {
        return maxNeurons;
    }

    private long patternSeed(float[] pattern) {
        long hash = seed;
        for (float v : pattern) {
            hash = hash * 31 + Float.floatToIntBits(v);
        }
        return hash;
    }

    private static NeuronRole roleFor(int index, int total, Random rng) {
        double position = index / (double) total;
        if (position < 0.2) {
            return NeuronRole.INPUT_RECEIVER;
        } else if (position < 0.8) {
            return rng.nextDouble() < 0.3 ? NeuronRole.PATTERN_DETECTOR : NeuronRole.INTEGRATOR;
        }
        return NeuronRole.OUTPUT_GENERATOR;
    }
}
