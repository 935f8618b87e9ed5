package engram;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.IntSupplier;

/**
 * Per-concept target neuron count with slow adaptation and a hysteresis band.
 *
 * <p>The first request for a concept seeds its target from the configured
 * {@link NeuronCountStrategy}; later requests return the stored target.
 * {@link #adjust} moves the target toward the observed count with an EMA, but
 * only once {@code observed / target} leaves {@code [1 - h, 1 + h]}, so one noisy
 * sample never causes churn. Targets are always clamped to
 * {@code [minNeurons, maxNeurons]}.
 */
public final class ConceptCapacityController {

    private final int minNeurons;
    private final int maxNeurons;
    private final double emaAlpha;
    private final double hysteresis;
    private final NeuronCountStrategy strategy;

    private final Map<String, Integer> targets = new HashMap<>();
    private final Map<String, Double> lastDemand = new HashMap<>();

    public ConceptCapacityController(int minNeurons, int maxNeurons, double emaAlpha,
                                     double hysteresis, NeuronCountStrategy strategy) {
        if (minNeurons < 1 || maxNeurons < minNeurons) {
            throw new IllegalArgumentException(
                "Invalid capacity bounds [" + minNeurons + ", " + maxNeurons + "]");
        }
        this.minNeurons = minNeurons;
        this.maxNeurons = maxNeurons;
        this.emaAlpha = emaAlpha;
        this.hysteresis = hysteresis;
        this.strategy = strategy;
    }

    /**
     * Memoized target for a concept.
     *
     * @param concept the concept label
     * @param features the features of the current presentation (used by the stochastic strategy)
     * @param hypernetworkEstimate the hypernetwork count for the current pattern; only
     *                             evaluated when seeding with {@link NeuronCountStrategy#HYPERNETWORK}
     */
    public int targetFor(String concept, Map<String, Double> features, IntSupplier hypernetworkEstimate) {
        Integer existing = targets.get(concept);
        if (existing != null) {
            return clamp(existing);
        }
        int seeded = switch (strategy) {
            case STOCHASTIC -> StochasticNeuronCount.estimate(concept, features);
            case HYPERNETWORK -> hypernetworkEstimate.getAsInt();
        };
        int target = clamp(seeded);
        targets.put(concept, target);
        return target;
    }

    /**
     * Feed back the observed neuron count of a concept.
     *
     * @param demandSignal observed / target, capped by the caller; kept as the latest demand
     * @return the (possibly unchanged) target
     */
    public int adjust(String concept, int observedNeurons, double demandSignal) {
        lastDemand.put(concept, demandSignal);
        int current = clamp(targets.getOrDefault(concept, clamp(observedNeurons)));
        double ratio = (double) Math.max(1, observedNeurons) / Math.max(1, current);
        if (ratio < 1.0 - hysteresis || ratio > 1.0 + hysteresis) {
            int desired = clamp(observedNeurons);
            current = clamp((int) Math.round(current * (1 - emaAlpha) + desired * emaAlpha));
        }
        targets.put(concept, current);
        return current;
    }

    /**
     * Stored target, if the concept has been seen.
     */
    public OptionalInt currentTarget(String concept) {
        Integer t = targets.get(concept);
        return t == null ? OptionalInt.empty() : OptionalInt.of(t);
    }

    /**
     * Latest demand signal passed to {@link #adjust}, 0 if none.
     */
    public double lastDemand(String concept) {
        return lastDemand.getOrDefault(concept, 0.0);
    }

    public int size() {
        return targets.size();
    }

    public Map<String, Integer> targets() {
        return Collections.unmodifiableMap(targets);
    }

    /**
     * Replace all targets with persisted values, clamping each.
     */
    public void restore(Map<String, Integer> persisted) {
        targets.clear();
        lastDemand.clear();
        for (Map.Entry<String, Integer> e : persisted.entrySet()) {
            targets.put(e.getKey(), clamp(e.getValue()));
        }
    }

    public int minNeurons() {
        return minNeurons;
    }

    public int maxNeurons() {
        return maxNeurons;
    }

    private int clamp(int value) {
        return Math.max(minNeurons, Math.min(maxNeurons, value));
    }
}
