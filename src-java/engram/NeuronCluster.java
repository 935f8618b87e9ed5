package engram;

import engram.internal.Distance;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A group of neurons sharing a centroid in feature space.
 *
 * <p>Cluster metadata (id, label, origin region, centroid, concepts, size,
 * timestamps) is always resident. The neurons themselves are hydrated lazily
 * through a {@link NeuronLoader} the first time they are needed and can be
 * dropped again with {@link #unload()}.
 *
 * <p>Every mutation (growth, training, centroid update) must end with
 * {@link #markDirty()}; the flag is cleared only by {@link #markSaved()} after a
 * successful write.
 */
public final class NeuronCluster {

    /** Similarity reported before a centroid exists, for a query from the cluster's own region. */
    public static final double SAME_REGION_PRIOR = 0.8;

    /** Similarity reported before a centroid exists, for a query from any other region. */
    public static final double OTHER_REGION_PRIOR = 0.5;

    private static final double OUTPUT_FLOOR = 0.001;

    private final String id;
    private final String label;
    private final String originRegion;
    private final int partition;
    private final Instant createdAt;
    private final Set<String> concepts;
    private final NeuronLoader loader;

    private float[] centroid;
    private long centroidSamples;
    private Instant lastAccessed;
    private long nextNeuronOrdinal;
    private int persistedSize;

    private Map<String, Neuron> neurons; // null while not hydrated
    private boolean dirty;

    /**
     * A brand-new, empty, loaded cluster.
     */
    public NeuronCluster(String id, String label, String originRegion, int partition,
                         NeuronLoader loader, Instant now) {
        this(id, label, originRegion, partition, null, 0L, new LinkedHashSet<>(),
             0, 0L, now, now, loader);
        this.neurons = new LinkedHashMap<>();
        this.dirty = true;
    }

    /**
     * A cluster known from the persisted index; neurons load on first use.
     */
    public NeuronCluster(String id, String label, String originRegion, int partition,
                         float[] centroid, long centroidSamples, Set<String> concepts,
                         int persistedSize, long nextNeuronOrdinal,
                         Instant createdAt, Instant lastAccessed, NeuronLoader loader) {
        this.id = id;
        this.label = label;
        this.originRegion = originRegion;
        this.partition = partition;
        this.centroid = centroid == null ? null : centroid.clone();
        this.centroidSamples = centroidSamples;
        this.concepts = new LinkedHashSet<>(concepts);
        this.persistedSize = persistedSize;
        this.nextNeuronOrdinal = nextNeuronOrdinal;
        this.createdAt = createdAt;
        this.lastAccessed = lastAccessed;
        this.loader = loader;
    }

    // =========================================================================
    // Matching
    // =========================================================================

    /**
     * Similarity in [0, 1] of a query to this cluster: the (non-negative) cosine
     * to the centroid, or a region-based prior while no centroid exists.
     */
    public double similarity(float[] query, String queryRegion) {
        if (centroid == null) {
            return originRegion.equals(queryRegion) ? SAME_REGION_PRIOR : OTHER_REGION_PRIOR;
        }
        return Math.max(0.0, Distance.cosineSimilarity(query, centroid));
    }

    /**
     * Move the centroid toward {@code vector} as a running mean. The first vector
     * becomes the centroid; repeating the current centroid leaves it unchanged.
     */
    public void updateCentroid(float[] vector) {
        if (centroid == null) {
            centroid = vector.clone();
            centroidSamples = 1;
        } else {
            centroidSamples++;
            for (int i = 0; i < centroid.length; i++) {
                centroid[i] += (vector[i] - centroid[i]) / centroidSamples;
            }
        }
        markDirty();
    }

    /**
     * Fraction of the larger of the two concept sets shared by both.
     */
    public double relevance(Collection<String> queryConcepts) {
        Set<String> query = new HashSet<>();
        for (String c : queryConcepts) {
            query.add(c.toLowerCase(Locale.ROOT));
        }
        int total = Math.max(concepts.size(), query.size());
        if (total == 0) {
            return 0.0;
        }
        query.retainAll(concepts);
        return (double) query.size() / total;
    }

    // =========================================================================
    // Membership
    // =========================================================================

    /**
     * Grow the cluster to {@code targetSize} members. Only the delta above the
     * current size is created; each new neuron starts with empty weights and is
     * tagged with {@code concept}.
     *
     * @param properties per-neuron parameters, indexed by creation order (the last
     *                   entry is reused if the list is shorter than the delta)
     * @return the neurons created, possibly empty
     */
    public List<Neuron> growTo(int targetSize, String concept,
                               List<NeuronProperties> properties, Instant now) {
        Map<String, Neuron> members = hydrate();
        int delta = targetSize - members.size();
        if (delta <= 0 || properties.isEmpty()) {
            return Collections.emptyList();
        }
        List<Neuron> created = new ArrayList<>(delta);
        for (int i = 0; i < delta; i++) {
            NeuronProperties p = properties.get(Math.min(i, properties.size() - 1));
            Neuron n = new Neuron(id + "/n" + nextNeuronOrdinal++, p, now);
            n.associateConcept(concept);
            members.put(n.getId(), n);
            created.add(n);
        }
        concepts.add(concept.toLowerCase(Locale.ROOT));
        markDirty();
        return created;
    }

    public List<Neuron> findNeuronsByConcept(String concept) {
        List<Neuron> result = new ArrayList<>();
        for (Neuron n : hydrate().values()) {
            if (n.hasConcept(concept)) {
                result.add(n);
            }
        }
        return result;
    }

    /**
     * Run every member over {@code inputs}. Does not mark the cluster dirty, so
     * the members' firing bookkeeping is not persisted by this call alone.
     *
     * @return neuron id to output, for outputs with magnitude above 0.001
     */
    public Map<String, Double> process(Map<Integer, Double> inputs, Instant now) {
        lastAccessed = now;
        Map<String, Double> outputs = new LinkedHashMap<>();
        for (Neuron n : hydrate().values()) {
            double out = n.process(inputs, now);
            if (Math.abs(out) > OUTPUT_FLOOR) {
                outputs.put(n.getId(), out);
            }
        }
        return outputs;
    }

    /**
     * All members, hydrating them if necessary.
     *
     * @throws org.greymatter.engram.StorageException if the partition bank cannot be read
     */
    public Collection<Neuron> neurons() {
        return Collections.unmodifiableCollection(hydrate().values());
    }

    public Optional<Neuron> neuron(String neuronId) {
        return Optional.ofNullable(hydrate().get(neuronId));
    }

    public int size() {
        return neurons != null ? neurons.size() : persistedSize;
    }

    public double averageImportance() {
        if (neurons == null || neurons.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Neuron n : neurons.values()) {
            sum += n.getImportance();
        }
        return sum / neurons.size();
    }

    private Map<String, Neuron> hydrate() {
        if (neurons == null) {
            Map<String, Neuron> loaded = new LinkedHashMap<>();
            for (Neuron n : loader.load(id).orElse(Collections.emptyList())) {
                loaded.put(n.getId(), n);
            }
            neurons = loaded;
        }
        return neurons;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public boolean isLoaded() {
        return neurons != null;
    }

    /**
     * Load members now rather than on first use.
     */
    public void ensureLoaded() {
        hydrate();
    }

    public void touch(Instant now) {
        lastAccessed = now;
    }

    /**
     * True while the cluster has been used within {@code idleLimit}.
     */
    public boolean shouldStayLoaded(Instant now, Duration idleLimit) {
        return Duration.between(lastAccessed, now).compareTo(idleLimit) < 0;
    }

    /**
     * Drop the members from memory. Metadata stays resident.
     *
     * @throws IllegalStateException if the cluster has unsaved changes
     */
    public void unload() {
        if (dirty) {
            throw new IllegalStateException("Cluster " + id + " has unsaved changes");
        }
        if (neurons != null) {
            persistedSize = neurons.size();
            neurons = null;
        }
    }

    public void markDirty() {
        dirty = true;
    }

    public boolean hasUnsavedChanges() {
        return dirty;
    }

    /**
     * Record a successful write of the current members.
     */
    public void markSaved() {
        dirty = false;
        if (neurons != null) {
            persistedSize = neurons.size();
        }
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getId() { return id; }
    public String getLabel() { return label; }
    public String getOriginRegion() { return originRegion; }
    public int getPartition() { return partition; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastAccessed() { return lastAccessed; }
    public long getCentroidSamples() { return centroidSamples; }
    public long getNextNeuronOrdinal() { return nextNeuronOrdinal; }
    public Set<String> getConcepts() { return Collections.unmodifiableSet(concepts); }

    /**
     * Copy of the centroid, or empty before the first pattern.
     */
    public Optional<float[]> getCentroid() {
        return centroid == null ? Optional.empty() : Optional.of(centroid.clone());
    }

    @Override
    public String toString() {
        return "NeuronCluster{" +
               "id='" + id + '\'' +
               ", label='" + label + '\'' +
               ", region='" + originRegion + '\'' +
               ", size=" + size() +
               ", loaded=" + isLoaded() +
               ", dirty=" + dirty +
               '}';
    }
}
