package engram;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * A single integrate-and-fire unit owned by exactly one {@link NeuronCluster}.
 *
 * <p>Inputs are feature-id keyed values. The potential is
 * {@code resting + bias + sum(input * weight)} over features the neuron has a
 * weight for. Above threshold the neuron fires and outputs
 * {@code tanh(2 * (potential - resting) / (threshold - resting))}; otherwise it
 * outputs 0 and its potential relaxes toward rest by its decay rate.
 *
 * <p>Learning is a delta rule: {@code w += learningRate * (target - output) * input}.
 */
public final class Neuron {

    public static final double RESTING_POTENTIAL = -70.0;
    public static final double DEFAULT_THRESHOLD = -69.0;
    public static final double DEFAULT_LEARNING_RATE = 0.1;

    private static final Duration STALE_AFTER = Duration.ofDays(7);

    private final String id;
    private final Map<Integer, Double> weights;
    private final Set<String> concepts;
    private final NeuronRole role;
    private final double activationThreshold;
    private final double decayRate;
    private final double restingPotential;
    private final double threshold;
    private final double learningRate;
    private final double bias;

    private double currentPotential;
    private long activationCount;
    private double importance;
    private Instant lastUsed;

    /**
     * A fresh neuron with empty weights, at rest.
     */
    public Neuron(String id, NeuronProperties properties, Instant createdAt) {
        this(id, new HashMap<>(), new LinkedHashSet<>(), properties.getRole(),
             properties.getActivationThreshold(), properties.getDecayRate(),
             RESTING_POTENTIAL, DEFAULT_THRESHOLD, DEFAULT_LEARNING_RATE,
             0.0, RESTING_POTENTIAL, 0L, 0.0, createdAt);
    }

    /**
     * Full-state constructor used when hydrating from storage.
     */
    public Neuron(String id, Map<Integer, Double> weights, Set<String> concepts, NeuronRole role,
                  double activationThreshold, double decayRate,
                  double restingPotential, double threshold, double learningRate,
                  double bias, double currentPotential, long activationCount,
                  double importance, Instant lastUsed) {
        this.id = id;
        this.weights = new HashMap<>(weights);
        this.concepts = new LinkedHashSet<>(concepts);
        this.role = role;
        this.activationThreshold = activationThreshold;
        this.decayRate = decayRate;
        this.restingPotential = restingPotential;
        this.threshold = threshold;
        this.learningRate = learningRate;
        this.bias = bias;
        this.currentPotential = currentPotential;
        this.activationCount = activationCount;
        this.importance = importance;
        this.lastUsed = lastUsed;
    }

    // =========================================================================
    // Dynamics
    // =========================================================================

    /**
     * Integrate inputs and fire if the potential crosses threshold.
     *
     * @return output in (-1, 1) when firing, otherwise 0
     */
    public double process(Map<Integer, Double> inputs, Instant now) {
        Instant previousUse = lastUsed;
        lastUsed = now;
        double sum = bias;
        for (Map.Entry<Integer, Double> in : inputs.entrySet()) {
            Double w = weights.get(in.getKey());
            if (w != null && Double.isFinite(in.getValue())) {
                sum += in.getValue() * w;
            }
        }
        currentPotential = restingPotential + sum;
        if (currentPotential > threshold) {
            activationCount++;
            importance = computeImportance(previousUse, now);
            return Math.tanh((currentPotential - restingPotential) / (threshold - restingPotential) * 2.0);
        }
        currentPotential = restingPotential + (currentPotential - restingPotential) * decayRate;
        return 0.0;
    }

    /**
     * Delta-rule update of one input weight. A non-finite delta is ignored and a
     * weight that overflows is clamped, so stored weights are always finite.
     */
    public void learn(int featureId, double input, double target, double actual) {
        double delta = learningRate * (target - actual) * input;
        if (delta == 0.0 || !Double.isFinite(delta)) {
            return;
        }
        double updated = weights.getOrDefault(featureId, 0.0) + delta;
        if (!Double.isFinite(updated)) {
            updated = Math.copySign(Double.MAX_VALUE, updated);
        }
        weights.put(featureId, updated);
    }

    /**
     * Give an untrained neuron a strong starting weight in [1.5, 4.5) for each feature,
     * so its first presentation fires. No-op once the neuron has any weight.
     *
     * @return true if weights were initialized
     */
    public boolean initializeWeights(Collection<Integer> featureIds, Random rng) {
        if (!weights.isEmpty()) {
            return false;
        }
        for (Integer f : featureIds) {
            weights.put(f, (rng.nextDouble() + 0.5) * 3.0);
        }
        return !featureIds.isEmpty();
    }

    /**
     * Remove weights whose magnitude is below {@code threshold}.
     *
     * @return number of weights removed
     */
    public int pruneWeights(double threshold) {
        int removed = 0;
        Iterator<Double> it = weights.values().iterator();
        while (it.hasNext()) {
            if (Math.abs(it.next()) < threshold) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Whether an output produced by {@link #process} is strong enough to count as firing.
     */
    public boolean isFiring(double output) {
        return output > activationThreshold;
    }

    public void associateConcept(String concept) {
        concepts.add(concept.toLowerCase(Locale.ROOT));
    }

    public boolean hasConcept(String concept) {
        return concepts.contains(concept.toLowerCase(Locale.ROOT));
    }

    /**
     * Potential above rest, never negative.
     */
    public double activationAboveRest() {
        return Math.max(0.0, currentPotential - restingPotential);
    }

    private double computeImportance(Instant previousUse, Instant now) {
        double usage = Math.log(activationCount + 1) / 10.0;
        double connections = weights.size() / 100.0;
        double conceptScore = concepts.size() / 10.0;
        double recency = Duration.between(previousUse, now).compareTo(STALE_AFTER) > 0 ? 0.5 : 1.0;
        return (usage + connections + conceptScore) * recency;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getId() { return id; }
    public Map<Integer, Double> getWeights() { return Collections.unmodifiableMap(weights); }
    public Set<String> getConcepts() { return Collections.unmodifiableSet(concepts); }
    public NeuronRole getRole() { return role; }
    public double getActivationThreshold() { return activationThreshold; }
    public double getDecayRate() { return decayRate; }
    public double getRestingPotential() { return restingPotential; }
    public double getThreshold() { return threshold; }
    public double getLearningRate() { return learningRate; }
    public double getBias() { return bias; }
    public double getCurrentPotential() { return currentPotential; }
    public long getActivationCount() { return activationCount; }
    public double getImportance() { return importance; }
    public Instant getLastUsed() { return lastUsed; }

    @Override
    public String toString() {
        return "Neuron{" +
               "id='" + id + '\'' +
               ", role=" + role +
               ", weights=" + weights.size() +
               ", concepts=" + concepts +
               ", activations=" + activationCount +
               '}';
    }
}
