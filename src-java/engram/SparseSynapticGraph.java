package engram;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Sparse directed weighted graph between neuron ids, grown by Hebbian co-activation.
 *
 * <p>Edges live in an adjacency map (source to target to synapse) with a reverse
 * index for incoming lookups, so memory is proportional to the number of edges.
 * Every stored weight is clamped to {@code [minWeight, maxWeight]}.
 */
public final class SparseSynapticGraph {

    private final double learningRate;
    private final double minWeight;
    private final double maxWeight;
    private final double pruneThreshold;
    private final double coactivationFloor;

    private final Map<String, Map<String, Synapse>> outgoing = new HashMap<>();
    private final Map<String, Set<String>> incoming = new HashMap<>();
    private int size;

    public SparseSynapticGraph(double learningRate, double minWeight, double maxWeight,
                               double pruneThreshold, double coactivationFloor) {
        if (maxWeight < minWeight) {
            throw new IllegalArgumentException("maxWeight < minWeight");
        }
        this.learningRate = learningRate;
        this.minWeight = minWeight;
        this.maxWeight = maxWeight;
        this.pruneThreshold = pruneThreshold;
        this.coactivationFloor = coactivationFloor;
    }

    // =========================================================================
    // Updates
    // =========================================================================

    /**
     * Hebbian update over one activation pattern.
     *
     * <p>For every unordered pair of distinct neurons whose strengths both exceed the
     * co-activation floor, both directed edges gain {@code learningRate * s_i * s_j}.
     * Missing edges are created.
     *
     * @param activations neuron id to activation strength
     * @return number of pairs updated
     */
    public int recordCoactivation(Map<String, Double> activations) {
        List<Map.Entry<String, Double>> active = new ArrayList<>();
        for (Map.Entry<String, Double> e : activations.entrySet()) {
            if (e.getValue() != null && e.getValue() > coactivationFloor) {
                active.add(e);
            }
        }
        int pairs = 0;
        for (int i = 0; i < active.size(); i++) {
            for (int j = i + 1; j < active.size(); j++) {
                String a = active.get(i).getKey();
                String b = active.get(j).getKey();
                if (a.equals(b)) continue;
                double delta = learningRate * active.get(i).getValue() * active.get(j).getValue();
                strengthen(a, b, delta);
                strengthen(b, a, delta);
                pairs++;
            }
        }
        return pairs;
    }

    /**
     * Add {@code delta} to the edge {@code source -> target}, creating it if absent.
     */
    public void link(String source, String target, double delta) {
        if (source.equals(target)) {
            return;
        }
        strengthen(source, target, delta);
    }

    private void strengthen(String source, String target, double delta) {
        Map<String, Synapse> row = outgoing.computeIfAbsent(source, k -> new HashMap<>());
        Synapse s = row.get(target);
        if (s == null) {
            row.put(target, new Synapse(source, target, clamp(delta), 0));
            incoming.computeIfAbsent(target, k -> new HashSet<>()).add(source);
            size++;
        } else {
            s.setWeight(clamp(s.getWeight() + delta));
        }
    }

    /**
     * Remove every edge whose weight is below the prune threshold.
     *
     * @return number of edges removed
     */
    public int prune() {
        return removeIf(false, 1.0);
    }

    /**
     * Age every edge by one pass: weight is multiplied by {@code decayFactor}, age is
     * incremented, and edges falling below the prune threshold are removed.
     *
     * @return number of edges removed
     */
    public int age(double decayFactor) {
        return removeIf(true, decayFactor);
    }

    private int removeIf(boolean decay, double decayFactor) {
        int removed = 0;
        Iterator<Map.Entry<String, Map<String, Synapse>>> rows = outgoing.entrySet().iterator();
        while (rows.hasNext()) {
            Map.Entry<String, Map<String, Synapse>> row = rows.next();
            Iterator<Synapse> it = row.getValue().values().iterator();
            while (it.hasNext()) {
                Synapse s = it.next();
                if (decay) {
                    s.setWeight(clamp(s.getWeight() * decayFactor));
                    s.incrementAge();
                }
                if (s.getWeight() < pruneThreshold) {
                    it.remove();
                    unindex(s.getSource(), s.getTarget());
                    removed++;
                }
            }
            if (row.getValue().isEmpty()) {
                rows.remove();
            }
        }
        size -= removed;
        return removed;
    }

    private void unindex(String source, String target) {
        Set<String> sources = incoming.get(target);
        if (sources != null) {
            sources.remove(source);
            if (sources.isEmpty()) {
                incoming.remove(target);
            }
        }
    }

    public void clear() {
        outgoing.clear();
        incoming.clear();
        size = 0;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * Weight of {@code source -> target}, 0 if absent.
     */
    public double weight(String source, String target) {
        Map<String, Synapse> row = outgoing.get(source);
        Synapse s = row == null ? null : row.get(target);
        return s == null ? 0.0 : s.getWeight();
    }

    public List<Synapse> outgoing(String source) {
        Map<String, Synapse> row = outgoing.get(source);
        if (row == null) {
            return Collections.emptyList();
        }
        List<Synapse> result = new ArrayList<>(row.size());
        for (Synapse s : row.values()) {
            result.add(s.copy());
        }
        return result;
    }

    public List<Synapse> incoming(String target) {
        Set<String> sources = incoming.get(target);
        if (sources == null) {
            return Collections.emptyList();
        }
        List<Synapse> result = new ArrayList<>(sources.size());
        for (String source : sources) {
            result.add(outgoing.get(source).get(target).copy());
        }
        return result;
    }

    public int size() {
        return size;
    }

    public Stats stats() {
        if (size == 0) {
            return new Stats(0, 0, 0.0, 0.0, 0.0, 0.0);
        }
        Set<String> neurons = new HashSet<>(outgoing.keySet());
        neurons.addAll(incoming.keySet());
        double sum = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (Map<String, Synapse> row : outgoing.values()) {
            for (Synapse s : row.values()) {
                sum += s.getWeight();
                min = Math.min(min, s.getWeight());
                max = Math.max(max, s.getWeight());
            }
        }
        long possible = (long) neurons.size() * (neurons.size() - 1);
        double sparsity = possible > 0 ? (double) size / possible : 0.0;
        return new Stats(size, neurons.size(), sum / size, min, max, sparsity);
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    /**
     * Copies of all edges.
     */
    public List<Synapse> export() {
        List<Synapse> all = new ArrayList<>(size);
        for (Map<String, Synapse> row : outgoing.values()) {
            for (Synapse s : row.values()) {
                all.add(s.copy());
            }
        }
        return all;
    }

    /**
     * Replace the graph with the given edges. Weights are clamped on the way in.
     */
    public void importAll(Collection<Synapse> synapses) {
        clear();
        for (Synapse s : synapses) {
            Map<String, Synapse> row = outgoing.computeIfAbsent(s.getSource(), k -> new HashMap<>());
            if (row.put(s.getTarget(), new Synapse(s.getSource(), s.getTarget(), clamp(s.getWeight()), s.getAge())) == null) {
                incoming.computeIfAbsent(s.getTarget(), k -> new HashSet<>()).add(s.getSource());
                size++;
            }
        }
    }

    private double clamp(double w) {
        if (Double.isNaN(w)) {
            return minWeight;
        }
        return Math.max(minWeight, Math.min(maxWeight, w));
    }

    /**
     * Aggregate edge statistics.
     */
    public static final class Stats {
        private final int synapses;
        private final int uniqueNeurons;
        private final double averageWeight;
        private final double minWeight;
        private final double maxWeight;
        private final double sparsity;

        Stats(int synapses, int uniqueNeurons, double averageWeight,
              double minWeight, double maxWeight, double sparsity) {
            this.synapses = synapses;
            this.uniqueNeurons = uniqueNeurons;
            this.averageWeight = averageWeight;
            this.minWeight = minWeight;
            this.maxWeight = maxWeight;
            this.sparsity = sparsity;
        }

        public int getSynapses() { return synapses; }
        public int getUniqueNeurons() { return uniqueNeurons; }
        public double getAverageWeight() { return averageWeight; }
        public double getMinWeight() { return minWeight; }
        public double getMaxWeight() { return maxWeight; }

        /** Edges present over edges possible between the neurons that have any edge. */
        public double getSparsity() { return sparsity; }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "Synapses{count=%d, neurons=%d, avg=%.3f, sparsity=%.2e}",
                                 synapses, uniqueNeurons, averageWeight, sparsity);
        }
    }
}
