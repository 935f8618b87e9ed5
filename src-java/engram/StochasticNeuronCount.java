package engram;

import java.util.Map;
import java.util.Random;

/**
 * Alternative neuron-count estimate selected by {@link NeuronCountStrategy#STOCHASTIC}.
 *
 * <p>A base allocation of 30..129 neurons is jittered and pushed up or down by an
 * emergence score built from the concept's features (interaction of feature
 * magnitudes), its length and a random variation term, then shaped by a power
 * law with an exponent in [1.3, 1.7). The generator is seeded from the concept
 * name only, so the estimate is reproducible across runs.
 *
 * <p>The result is unclamped; {@link ConceptCapacityController} clamps it.
 */
public final class StochasticNeuronCount {

    private StochasticNeuronCount() {}

    public static int estimate(String concept, Map<String, Double> features) {
        Random rng = new Random(FeatureEncoder.stableHash(concept));
        int base = 50 + rng.nextInt(100) - 20;

        double emergence = 0.0;
        // Frequent (short) words are cheaper to represent
        emergence -= Math.max(0, 10 - concept.length()) * (0.5 + rng.nextDouble());

        double magnitude = 0.0;
        for (double v : features.values()) {
            magnitude += Math.abs(v);
        }
        emergence += magnitude * features.size() * (0.5 + rng.nextDouble());
        emergence += (rng.nextDouble() - 0.5) * 50.0;

        double exponent = 1.3 + rng.nextDouble() * 0.4;
        double shaped = Math.pow(Math.abs(emergence), exponent) * Math.signum(emergence);
        double total = Math.ceil(base + shaped);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, total));
    }
}
