package org.greymatter.engram;

import engram.ActivationStats;
import engram.CodebookRegionQuantizer;
import engram.ConceptCapacityController;
import engram.FeatureEncoder;
import engram.FeatureMapper;
import engram.LshRegionQuantizer;
import engram.Neuron;
import engram.NeuronCluster;
import engram.NeuronHypernetwork;
import engram.NeuronLoader;
import engram.NeuronProperties;
import engram.QuantizerStats;
import engram.RegionQuantizer;
import engram.SparseSynapticGraph;
import engram.internal.Documents;
import engram.internal.FileClusterBankStorage;
import engram.internal.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Pattern-based associative memory.
 *
 * <p>Concepts are learned into clusters of integrate-and-fire neurons. A concept
 * token is encoded to a feature vector, bucketed into a region by the quantizer,
 * and matched against the clusters registered under that region and its
 * neighbors. A close enough cluster is reused; otherwise a new one is created.
 * The cluster then grows toward the concept's capacity target, its members are
 * trained on the caller's features, and co-firing members are linked in a
 * sparse synaptic graph.
 *
 * <h2>Basic Usage:</h2>
 * <pre>{@code
 * EngramConfig config = EngramConfig.builder()
 *     .storagePath("/data/engram")
 *     .build();
 *
 * try (EngramMemory memory = new EngramMemory(config)) {
 *     memory.initialize();
 *     memory.learnConcept("apple", Map.of("fruit", 1.0, "red", 0.7));
 *
 *     ProcessingResult r = memory.processInput("I ate an apple", Map.of());
 *     System.out.println(r.getResponse() + " " + r.getConfidence());
 * }
 * }</pre>
 *
 * <h2>Thread Safety:</h2>
 * <p>Not thread-safe. A single caller must serialize every operation; at most
 * one learn, process, save or maintenance call may be in flight. Only the
 * partition writes inside {@link #save()} run in parallel, bounded by
 * {@link EngramConfig#getMaxConcurrentWrites()}, and never two on the same partition.</p>
 *
 * @see EngramConfig
 * @see LearningResult
 * @see ProcessingResult
 */
public class EngramMemory implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EngramMemory.class);

    /** Activation count at which region frequency reaches {@code 1 - 1/e}. */
    private static final double FREQUENCY_SCALE = 10.0;

    /** Target output the training rule pulls every member toward. */
    private static final double TRAINING_TARGET = 1.0;

    /** Cap on the observed/target ratio fed back to the capacity controller. */
    private static final double MAX_DEMAND = 2.0;

    private static final String TOKEN_FEATURE_PREFIX = "token:";
    private static final int RECENT_CLUSTER_MEMORY = 8;

    private final EngramConfig config;
    private final StateStore store;
    private final FeatureEncoder encoder;
    private final RegionQuantizer quantizer;
    private final CodebookRegionQuantizer codebook; // null for LSH
    private final ActivationStats activationStats;
    private final NeuronHypernetwork hypernetwork;
    private final ConceptCapacityController capacity;
    private final SparseSynapticGraph synapses;
    private final FeatureMapper featureMapper;
    private final ForkJoinPool writePool;
    private final Random linkRandom;

    private final Map<String, NeuronCluster> clusters = new LinkedHashMap<>();
    private final Map<String, Set<String>> regionMap = new LinkedHashMap<>();
    private final Map<String, String> conceptAffinity = new HashMap<>();
    private final Deque<String> recentClusters = new ArrayDeque<>();

    private long nextClusterSequence;
    private boolean initialized;
    private boolean closed;

    /**
     * Create a memory over {@code config.getStoragePath()}. Nothing is read until
     * {@link #initialize()}.
     */
    public EngramMemory(EngramConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = new StateStore(config.getStoragePath(), config.getPartitionCount(), config.isCompressBanks());
        this.encoder = new FeatureEncoder(config.getDimensions());
        if (config.getQuantizer() == QuantizerType.CODEBOOK) {
            this.codebook = new CodebookRegionQuantizer(config.getCodebookSize(), config.getDimensions(),
                config.getCommitment(), config.getEmaDecay(), config.getQuantizerSeed());
            this.quantizer = codebook;
        } else {
            this.codebook = null;
            this.quantizer = new LshRegionQuantizer(config.getDimensions(), config.getLshBands(),
                config.getLshRowsPerBand(), config.getQuantizerSeed());
        }
        this.activationStats = new ActivationStats(config.getActivationHistory(), FREQUENCY_SCALE);
        this.hypernetwork = new NeuronHypernetwork(config.getHypernetworkAlpha(), config.getHypernetworkBeta(),
            config.getHypernetworkGamma(), config.getHypernetworkMinNeurons(),
            config.getHypernetworkMaxNeurons(), config.getHypernetworkSeed());
        this.capacity = new ConceptCapacityController(config.getMinConceptNeurons(), config.getMaxConceptNeurons(),
            config.getCapacityEmaAlpha(), config.getCapacityHysteresis(), config.getNeuronCountStrategy());
        this.synapses = new SparseSynapticGraph(config.getHebbianLearningRate(), config.getMinSynapseWeight(),
            config.getMaxSynapseWeight(), config.getPruneThreshold(), config.getCoactivationFloor());
        this.featureMapper = new FeatureMapper();
        this.writePool = new ForkJoinPool(config.getMaxConcurrentWrites());
        this.linkRandom = new Random(config.getHypernetworkSeed());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Load all persisted state. Idempotent.
     *
     * <p>Each store loads independently: an absent store is a cold start, and a
     * store that fails to read is logged and left at its defaults, so one bad
     * file never fails the whole load. Neurons are not read here; clusters
     * hydrate from their partition bank on first use.</p>
     */
    public void initialize() {
        if (initialized) {
            return;
        }
        ensureOpen();
        long start = System.nanoTime();
        store.open();

        if (codebook != null) {
            loadStep(StateStore.CODEBOOK, () -> store.readCodebook().ifPresent(codebook::importSnapshot));
        }
        loadStep(StateStore.FEATURE_MAP, () -> store.readDocument(StateStore.FEATURE_MAP, Documents.FeatureMap.class)
            .ifPresent(doc -> featureMapper.restore(doc.features)));
        loadStep(StateStore.CAPACITIES, () -> store.readDocument(StateStore.CAPACITIES, Documents.Capacities.class)
            .ifPresent(doc -> capacity.restore(doc.targets)));
        loadStep(StateStore.ACTIVATION_STATS, () -> store.readDocument(StateStore.ACTIVATION_STATS,
                Documents.ActivationStatsDocument.class)
            .ifPresent(doc -> doc.restoreInto(activationStats)));
        loadStep(StateStore.SYNAPSES, () -> store.readSynapses().ifPresent(synapses::importAll));
        loadStep(StateStore.CLUSTER_INDEX, () -> store.readDocument(StateStore.CLUSTER_INDEX, Documents.ClusterIndex.class)
            .ifPresent(this::restoreIndex));
        loadStep(StateStore.REGION_MAP, () -> store.readDocument(StateStore.REGION_MAP, Documents.RegionMap.class)
            .ifPresent(this::restoreRegionMap));
        if (regionMap.isEmpty() && !clusters.isEmpty()) {
            for (NeuronCluster c : clusters.values()) {
                regionMap.computeIfAbsent(c.getOriginRegion(), k -> new LinkedHashSet<>()).add(c.getId());
            }
        }

        initialized = true;
        logger.info("Initialized engram at {}: {} clusters, {} regions, {} synapses, {} concepts, {} features in {} ms",
            store.root(), clusters.size(), regionMap.size(), synapses.size(), capacity.size(),
            featureMapper.size(), (System.nanoTime() - start) / 1_000_000);
    }

    private void loadStep(String name, Runnable step) {
        try {
            step.run();
        } catch (EngramException e) {
            logger.warn("Ignoring unreadable {} in {}, starting it empty: {}", name, store.root(), e.getMessage());
        }
    }

    private void restoreIndex(Documents.ClusterIndex doc) {
        clusters.clear();
        for (Documents.ClusterEntry e : doc.clusters) {
            int partition = Math.floorMod(e.partition, config.getPartitionCount());
            Set<String> concepts = e.concepts == null ? Set.of() : new LinkedHashSet<>(e.concepts);
            NeuronCluster cluster = new NeuronCluster(e.id, e.label, e.originRegion, partition,
                e.centroid, e.centroidSamples, concepts, e.size, e.nextNeuronOrdinal,
                e.createdAt, e.lastAccessed, loaderFor(partition));
            clusters.put(cluster.getId(), cluster);
        }
        nextClusterSequence = doc.nextClusterSequence;
        conceptAffinity.clear();
        if (doc.conceptAffinity != null) {
            doc.conceptAffinity.forEach((concept, id) -> {
                if (clusters.containsKey(id)) {
                    conceptAffinity.put(concept, id);
                }
            });
        }
    }

    private void restoreRegionMap(Documents.RegionMap doc) {
        regionMap.clear();
        doc.regions.forEach((region, ids) -> {
            for (String id : ids) {
                if (clusters.containsKey(id)) {
                    regionMap.computeIfAbsent(region, k -> new LinkedHashSet<>()).add(id);
                }
            }
        });
    }

    private NeuronLoader loaderFor(int partition) {
        FileClusterBankStorage banks = store.banks();
        return clusterId -> banks.restore(partition, clusterId);
    }

    /**
     * Save everything and release the write pool. Further calls fail.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            if (initialized) {
                save();
            }
        } finally {
            closed = true;
            writePool.shutdown();
            try {
                if (!writePool.awaitTermination(30, TimeUnit.SECONDS)) {
                    logger.warn("Write pool did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("EngramMemory is closed");
        }
    }

    private void ensureInitialized() {
        ensureOpen();
        if (!initialized) {
            initialize();
        }
    }

    // =========================================================================
    // Learn
    // =========================================================================

    /**
     * Learn a concept from its label and a set of named features.
     *
     * <p>The label is encoded and matched against known clusters. A cluster whose
     * centroid reaches {@link EngramConfig#getSimilarityThreshold()} is reused;
     * otherwise a new cluster is created under the label's region. The cluster
     * then grows toward the concept's capacity target (uncapped the first time
     * the concept is allocated, at most {@link EngramConfig#getMaxGrowthPerRun()}
     * neurons afterwards), every member is trained on the features, co-firing
     * members are linked, and a few cross-cluster links are made to recently
     * learned clusters.</p>
     *
     * @param conceptLabel the concept, e.g. a word
     * @param features named feature strengths; may be empty. Null, NaN and infinite values are ignored
     * @return the outcome; unsuccessful for a blank label
     */
    public LearningResult learnConcept(String conceptLabel, Map<String, Double> features) {
        Objects.requireNonNull(conceptLabel, "conceptLabel");
        ensureInitialized();
        String concept = conceptLabel.trim().toLowerCase(Locale.ROOT);
        if (concept.isEmpty()) {
            logger.debug("Ignoring blank concept label");
            return LearningResult.failed(conceptLabel);
        }
        Map<String, Double> safeFeatures = finiteFeatures(features);
        Instant now = config.getClock().instant();

        // Encode and quantize
        float[] vector = encoder.encode(concept);
        String region = quantizer.assign(vector);
        double novelty = activationStats.calculateNovelty(region, vector);
        activationStats.recordActivation(region, vector);
        double frequency = activationStats.frequency(region);

        // Match or create
        NeuronCluster cluster = bestLoadableMatch(vector, region, concept, config.getSimilarityThreshold());
        boolean created = cluster == null;
        if (created) {
            cluster = createCluster(conceptLabel.trim(), region, now);
        } else {
            regionMap.computeIfAbsent(region, k -> new LinkedHashSet<>()).add(cluster.getId());
        }
        cluster.updateCentroid(vector);
        cluster.touch(now);

        // Size and grow
        double complexity = hypernetwork.complexity(vector);
        int target = capacity.targetFor(concept, safeFeatures,
            () -> hypernetwork.neuronCount(novelty, frequency, complexity));
        int existing = cluster.findNeuronsByConcept(concept).size();
        int needed = Math.max(0, target - existing);
        int grow = existing == 0 ? needed : Math.min(needed, config.getMaxGrowthPerRun());
        List<Neuron> createdNeurons = Collections.emptyList();
        if (grow > 0) {
            int from = cluster.size();
            List<NeuronProperties> properties = hypernetwork.generateNeurons(vector, from + grow).subList(from, from + grow);
            createdNeurons = cluster.growTo(from + grow, concept, properties, now);
        }

        // Train every member, then Hebbian update over the strongest firing ones
        Map<Integer, Double> inputs = featureMapper.toInputs(withTokenFeatures(safeFeatures, List.of(concept)));
        Map<String, Double> firing = train(cluster, inputs, now);
        int pairs = synapses.recordCoactivation(firing);
        cluster.markDirty();

        // Capacity feedback
        int involved = cluster.findNeuronsByConcept(concept).size();
        double demand = Math.min(MAX_DEMAND, (double) involved / Math.max(1, target));
        int adjusted = capacity.adjust(concept, involved, demand);

        int links = crossLink(cluster);
        remember(cluster.getId());
        conceptAffinity.put(concept, cluster.getId());

        logger.debug("Learned '{}' into {} ({}; region {}, novelty {}, target {} -> {}, created {}, firing {}, pairs {}, links {})",
            concept, cluster.getId(), created ? "new" : "reused", region,
            String.format(Locale.ROOT, "%.3f", novelty), target, adjusted, createdNeurons.size(),
            firing.size(), pairs, links);
        return new LearningResult(conceptLabel, cluster.getId(), true, created, involved, createdNeurons.size());
    }

    private NeuronCluster createCluster(String label, String region, Instant now) {
        String id = String.format(Locale.ROOT, "cl-%06d", ++nextClusterSequence);
        int partition = partitionOf(id);
        NeuronCluster cluster = new NeuronCluster(id, label, region, partition, loaderFor(partition), now);
        clusters.put(id, cluster);
        regionMap.computeIfAbsent(region, k -> new LinkedHashSet<>()).add(id);
        return cluster;
    }

    private int partitionOf(String clusterId) {
        return Math.floorMod(clusterId.hashCode(), config.getPartitionCount());
    }

    /**
     * Run every member on the inputs, initializing untrained neurons and applying
     * the delta rule toward the training target.
     *
     * @return firing neurons with their outputs, strongest first, capped at the
     *         configured number of Hebbian participants
     */
    private Map<String, Double> train(NeuronCluster cluster, Map<Integer, Double> inputs, Instant now) {
        List<Map.Entry<String, Double>> firing = new ArrayList<>();
        for (Neuron n : cluster.neurons()) {
            n.initializeWeights(inputs.keySet(), new Random(FeatureEncoder.stableHash(n.getId())));
            double output = n.process(inputs, now);
            for (Map.Entry<Integer, Double> in : inputs.entrySet()) {
                n.learn(in.getKey(), in.getValue(), TRAINING_TARGET, output);
            }
            if (n.isFiring(output)) {
                firing.add(Map.entry(n.getId(), output));
            }
        }
        firing.sort(Map.Entry.<String, Double>comparingByValue().reversed());
        Map<String, Double> participants = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : firing) {
            if (participants.size() == config.getMaxHebbianParticipants()) break;
            participants.put(e.getKey(), e.getValue());
        }
        return participants;
    }

    /**
     * Link random members of {@code cluster} with random members of recently
     * learned clusters, in both directions.
     *
     * @return number of directed links made
     */
    private int crossLink(NeuronCluster cluster) {
        List<Neuron> sources = new ArrayList<>(cluster.neurons());
        if (sources.isEmpty()) {
            return 0;
        }
        int links = 0;
        int visited = 0;
        for (String otherId : recentClusters) {
            if (visited == config.getCrossLinkClusters()) break;
            if (otherId.equals(cluster.getId())) continue;
            NeuronCluster other = clusters.get(otherId);
            List<Neuron> targets;
            try {
                targets = other == null ? List.of() : new ArrayList<>(other.neurons());
            } catch (StorageException e) {
                logger.warn("Skipping cross-link to {}: {}", otherId, e.getMessage());
                continue;
            }
            visited++;
            if (targets.isEmpty()) continue;
            for (int i = 0; i < config.getCrossLinkFanOut(); i++) {
                String a = sources.get(linkRandom.nextInt(sources.size())).getId();
                String b = targets.get(linkRandom.nextInt(targets.size())).getId();
                synapses.link(a, b, config.getCrossLinkWeight());
                synapses.link(b, a, config.getCrossLinkWeight());
                links += 2;
            }
        }
        return links;
    }

    private void remember(String clusterId) {
        recentClusters.remove(clusterId);
        recentClusters.addFirst(clusterId);
        while (recentClusters.size() > RECENT_CLUSTER_MEMORY) {
            recentClusters.removeLast();
        }
    }

    // =========================================================================
    // Process
    // =========================================================================

    /**
     * Recognize free text against what has been learned.
     *
     * <p>The input is split into candidate concepts (lower-cased words longer than
     * two characters). For each, the best matching clusters are retrieved without
     * creating anything; scores are summed per cluster across concepts and the
     * top clusters are run on the features plus the concept tokens.</p>
     *
     * <p>Clusters are not marked dirty. Running a neuron updates its potential,
     * firing count, importance and last use in memory, but that bookkeeping is
     * transient: it is written only if a later {@link #learnConcept} dirties the
     * same cluster before a save, and is lost when the cluster is evicted or the
     * memory is reopened. Weights are never changed here.</p>
     *
     * @param input free text
     * @param features optional extra named features; may be empty. Null, NaN and infinite values are ignored
     */
    public ProcessingResult processInput(String input, Map<String, Double> features) {
        Objects.requireNonNull(input, "input");
        ensureInitialized();
        Instant now = config.getClock().instant();
        List<String> concepts = extractConcepts(input);

        Map<String, Double> scores = new HashMap<>();
        List<String> regions = new ArrayList<>();
        for (String concept : concepts) {
            float[] vector = encoder.encode(concept);
            String region = quantizer.assign(vector);
            activationStats.recordActivation(region, vector);
            if (!regions.contains(region)) {
                regions.add(region);
            }
            List<Map.Entry<NeuronCluster, Double>> matches =
                rankCandidates(vector, region, concept, config.getRetrievalThreshold());
            for (Map.Entry<NeuronCluster, Double> m
                    : matches.subList(0, Math.min(matches.size(), config.getClustersPerConcept()))) {
                scores.merge(m.getKey().getId(), m.getValue(), Double::sum);
            }
        }
        activationStats.recordCoactivation(regions);

        List<Map.Entry<String, Double>> ranked = new ArrayList<>(scores.entrySet());
        ranked.sort(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()));

        Map<Integer, Double> inputs = featureMapper.toKnownInputs(
            withTokenFeatures(finiteFeatures(features), concepts));
        List<String> activated = new ArrayList<>();
        List<Double> outputs = new ArrayList<>();
        for (Map.Entry<String, Double> e : ranked) {
            if (activated.size() == config.getActivatedClusters()) break;
            NeuronCluster cluster = clusters.get(e.getKey());
            Map<String, Double> out;
            try {
                out = cluster.process(inputs, now);
            } catch (StorageException ex) {
                logger.warn("Skipping cluster {} during processing: {}", cluster.getId(), ex.getMessage());
                continue;
            }
            activated.add(cluster.getId());
            outputs.addAll(out.values());
        }

        ProcessingResult result = describe(input, activated, outputs);
        logger.debug("Processed '{}': concepts {}, clusters {}, confidence {}",
            input, concepts, activated, String.format(Locale.ROOT, "%.3f", result.getConfidence()));
        return result;
    }

    private static ProcessingResult describe(String input, List<String> activated, List<Double> outputs) {
        if (outputs.isEmpty()) {
            return new ProcessingResult(input, "I need to learn more about this.", activated, 0, 0.0);
        }
        double sum = 0.0;
        double max = -Double.MAX_VALUE;
        for (double o : outputs) {
            sum += o;
            max = Math.max(max, o);
        }
        double avg = sum / outputs.size();
        String response;
        if (max > 0.7) {
            response = "I recognize this strongly!";
        } else if (max > 0.4) {
            response = "This seems familiar to me.";
        } else if (avg > 0.2) {
            response = "I have some knowledge about this.";
        } else {
            response = "This is quite new to me.";
        }
        double confidence = Math.max(0.0, Math.min(1.0, (avg + max) / 2.0));
        return new ProcessingResult(input, response, activated, outputs.size(), confidence);
    }

    /**
     * Lower-cased words longer than two characters, in order of first appearance.
     */
    static List<String> extractConcepts(String input) {
        Set<String> concepts = new LinkedHashSet<>();
        for (String word : input.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (word.length() > 2) {
                concepts.add(word);
            }
        }
        return new ArrayList<>(concepts);
    }

    /**
     * Copy of {@code features} without null, NaN or infinite values.
     */
    private static Map<String, Double> finiteFeatures(Map<String, Double> features) {
        if (features == null) {
            return Map.of();
        }
        Map<String, Double> finite = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : features.entrySet()) {
            if (e.getValue() != null && Double.isFinite(e.getValue())) {
                finite.put(e.getKey(), e.getValue());
            } else {
                logger.debug("Dropping non-finite feature '{}' = {}", e.getKey(), e.getValue());
            }
        }
        return finite;
    }

    private static Map<String, Double> withTokenFeatures(Map<String, Double> features, List<String> concepts) {
        Map<String, Double> all = new LinkedHashMap<>(features);
        for (String c : concepts) {
            all.put(TOKEN_FEATURE_PREFIX + c, 1.0);
        }
        return all;
    }

    // =========================================================================
    // Matching
    // =========================================================================

    /**
     * Regions searched for a vector: its assigned region first, then the
     * quantizer's nearest ones.
     */
    private Set<String> searchRegions(float[] vector, String assigned) {
        Set<String> regions = new LinkedHashSet<>();
        if (assigned != null) {
            regions.add(assigned);
        }
        regions.addAll(quantizer.nearest(vector, config.getNeighborRegions()));
        return regions;
    }

    /**
     * Candidate clusters at or above {@code threshold}, best first. Candidates
     * come from the searched regions and the concept's affinity cache. Ties are
     * broken by id so results are stable.
     */
    private List<Map.Entry<NeuronCluster, Double>> rankCandidates(float[] vector, String region,
                                                                  String concept, double threshold) {
        Set<String> ids = new LinkedHashSet<>();
        String affinity = conceptAffinity.get(concept);
        if (affinity != null) {
            ids.add(affinity);
        }
        for (String r : searchRegions(vector, region)) {
            ids.addAll(regionMap.getOrDefault(r, Collections.emptySet()));
        }
        List<Map.Entry<NeuronCluster, Double>> ranked = new ArrayList<>();
        for (String id : ids) {
            NeuronCluster c = clusters.get(id);
            if (c == null) continue;
            double similarity = c.similarity(vector, region);
            if (similarity >= threshold) {
                ranked.add(Map.entry(c, similarity));
            }
        }
        ranked.sort(Comparator.<Map.Entry<NeuronCluster, Double>>comparingDouble(Map.Entry::getValue).reversed()
            .thenComparing(e -> e.getKey().getId()));
        return ranked;
    }

    /**
     * Best candidate whose members can be hydrated; candidates failing to load are skipped.
     */
    private NeuronCluster bestLoadableMatch(float[] vector, String region, String concept, double threshold) {
        for (Map.Entry<NeuronCluster, Double> candidate : rankCandidates(vector, region, concept, threshold)) {
            NeuronCluster c = candidate.getKey();
            try {
                c.ensureLoaded();
                logger.debug("Matched '{}' to {} (similarity {})", concept, c.getId(),
                    String.format(Locale.ROOT, "%.3f", candidate.getValue()));
                return c;
            } catch (StorageException e) {
                logger.warn("Skipping candidate cluster {}: {}", c.getId(), e.getMessage());
            }
        }
        return null;
    }

    // =========================================================================
    // Mastery
    // =========================================================================

    /**
     * How well a concept is known: the mean activation above resting potential of
     * the neurons tagged with it, over up to {@link EngramConfig#getClustersPerConcept()}
     * matching clusters. 0 for an unknown concept. Does not train the quantizer.
     */
    public double getConceptMasteryLevel(String concept) {
        Objects.requireNonNull(concept, "concept");
        ensureInitialized();
        String key = concept.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return 0.0;
        }
        float[] vector = encoder.encode(key);
        List<String> nearest = quantizer.nearest(vector, 1);
        String region = nearest.isEmpty() ? null : nearest.get(0);

        double sum = 0.0;
        int count = 0;
        int visited = 0;
        for (Map.Entry<NeuronCluster, Double> m : rankCandidates(vector, region, key, config.getRetrievalThreshold())) {
            if (visited == config.getClustersPerConcept()) break;
            List<Neuron> tagged;
            try {
                tagged = m.getKey().findNeuronsByConcept(key);
            } catch (StorageException e) {
                logger.warn("Skipping cluster {} for mastery: {}", m.getKey().getId(), e.getMessage());
                continue;
            }
            visited++;
            for (Neuron n : tagged) {
                sum += n.activationAboveRest();
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    // =========================================================================
    // Save and maintenance
    // =========================================================================

    /**
     * Flush all dirty state.
     *
     * <p>Dirty clusters are written a partition at a time, partitions in parallel.
     * Each file is replaced atomically. Failures are logged and leave the affected
     * clusters dirty for the next attempt; earlier durable state stays intact.</p>
     *
     * @return number of clusters written
     */
    public int save() {
        ensureOpen();
        if (!initialized) {
            return 0;
        }
        long start = System.nanoTime();
        List<NeuronCluster> dirty = new ArrayList<>();
        Set<Integer> partitions = new LinkedHashSet<>();
        for (NeuronCluster c : clusters.values()) {
            if (c.hasUnsavedChanges()) {
                dirty.add(c);
                partitions.add(c.getPartition());
            }
        }
        int written = saveClusters(dirty);

        saveStep(StateStore.CLUSTER_INDEX, () -> store.writeDocument(StateStore.CLUSTER_INDEX, indexDocument()));
        saveStep(StateStore.REGION_MAP, () -> store.writeDocument(StateStore.REGION_MAP, regionDocument()));
        saveStep(StateStore.ACTIVATION_STATS, () -> store.writeDocument(StateStore.ACTIVATION_STATS,
            Documents.ActivationStatsDocument.from(activationStats)));
        saveStep(StateStore.FEATURE_MAP, () -> {
            Documents.FeatureMap doc = new Documents.FeatureMap();
            doc.features.putAll(featureMapper.mappings());
            store.writeDocument(StateStore.FEATURE_MAP, doc);
        });
        saveStep(StateStore.CAPACITIES, () -> {
            Documents.Capacities doc = new Documents.Capacities();
            doc.targets.putAll(capacity.targets());
            store.writeDocument(StateStore.CAPACITIES, doc);
        });
        saveStep(StateStore.SYNAPSES, () -> store.writeSynapses(synapses.export()));
        if (codebook != null) {
            saveStep(StateStore.CODEBOOK, () -> store.writeCodebook(codebook.exportSnapshot()));
        }

        logger.info("Saved {} of {} dirty clusters across {} partitions in {} ms", written, dirty.size(),
            partitions.size(), (System.nanoTime() - start) / 1_000_000);
        return written;
    }

    private void saveStep(String name, Runnable step) {
        try {
            step.run();
        } catch (StorageException e) {
            logger.warn("Failed to save {}: {}", name, e.getMessage());
        }
    }

    /**
     * Write clusters grouped by partition, one task per partition.
     */
    private int saveClusters(List<NeuronCluster> dirty) {
        if (dirty.isEmpty()) {
            return 0;
        }
        Map<Integer, List<NeuronCluster>> byPartition = new TreeMap<>();
        for (NeuronCluster c : dirty) {
            byPartition.computeIfAbsent(c.getPartition(), k -> new ArrayList<>()).add(c);
        }
        List<Callable<Integer>> tasks = new ArrayList<>();
        List<List<NeuronCluster>> groups = new ArrayList<>();
        for (Map.Entry<Integer, List<NeuronCluster>> e : byPartition.entrySet()) {
            int partition = e.getKey();
            Map<String, List<Neuron>> payload = new LinkedHashMap<>();
            for (NeuronCluster c : e.getValue()) {
                payload.put(c.getId(), new ArrayList<>(c.neurons()));
            }
            groups.add(e.getValue());
            tasks.add(() -> {
                store.banks().store(partition, payload);
                return payload.size();
            });
        }

        int written = 0;
        List<Future<Integer>> results = writePool.invokeAll(tasks);
        for (int i = 0; i < results.size(); i++) {
            try {
                written += results.get(i).get();
                for (NeuronCluster c : groups.get(i)) {
                    c.markSaved();
                }
            } catch (ExecutionException e) {
                logger.warn("Failed to save partition {}: {}", groups.get(i).get(0).getPartition(),
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageException("Interrupted while saving clusters", e);
            }
        }
        return written;
    }

    private Documents.ClusterIndex indexDocument() {
        Documents.ClusterIndex doc = new Documents.ClusterIndex();
        doc.nextClusterSequence = nextClusterSequence;
        for (NeuronCluster c : clusters.values()) {
            Documents.ClusterEntry e = new Documents.ClusterEntry();
            e.id = c.getId();
            e.label = c.getLabel();
            e.originRegion = c.getOriginRegion();
            e.partition = c.getPartition();
            e.centroid = c.getCentroid().orElse(null);
            e.centroidSamples = c.getCentroidSamples();
            e.concepts = new ArrayList<>(c.getConcepts());
            e.size = c.size();
            e.nextNeuronOrdinal = c.getNextNeuronOrdinal();
            e.createdAt = c.getCreatedAt();
            e.lastAccessed = c.getLastAccessed();
            doc.clusters.add(e);
        }
        doc.conceptAffinity.putAll(new TreeMap<>(conceptAffinity));
        return doc;
    }

    private Documents.RegionMap regionDocument() {
        Documents.RegionMap doc = new Documents.RegionMap();
        regionMap.forEach((region, ids) -> doc.regions.put(region, new ArrayList<>(ids)));
        return doc;
    }

    /**
     * Evict idle clusters, prune weak synapses and age the rest, and drop
     * activation stats of regions seen fewer than
     * {@link EngramConfig#getActivationPruneMinCount()} times.
     *
     * <p>A cluster idle for longer than {@link EngramConfig#getIdleUnload()} is
     * unloaded; one with unsaved changes is saved first and stays loaded if that
     * save fails.</p>
     *
     * @return number of clusters evicted
     */
    public int maintenance() {
        ensureInitialized();
        Instant now = config.getClock().instant();
        int evicted = 0;
        for (NeuronCluster c : clusters.values()) {
            if (!c.isLoaded() || c.shouldStayLoaded(now, config.getIdleUnload())) {
                continue;
            }
            if (c.hasUnsavedChanges()) {
                saveClusters(List.of(c));
                if (c.hasUnsavedChanges()) {
                    logger.warn("Keeping idle cluster {} loaded: save failed", c.getId());
                    continue;
                }
            }
            c.unload();
            evicted++;
        }
        int pruned = synapses.prune();
        int aged = synapses.age(config.getSynapseDecay());
        int regionsDropped = activationStats.prune(config.getActivationPruneMinCount());
        logger.info("Maintenance: evicted {} clusters, removed {} synapses ({} remain), dropped {} rare regions ({} remain)",
            evicted, pruned + aged, synapses.size(), regionsDropped, activationStats.regionCount());
        return evicted;
    }

    // =========================================================================
    // Inspection
    // =========================================================================

    public MemoryStats getStats() {
        ensureInitialized();
        int loaded = 0;
        int dirty = 0;
        long neurons = 0;
        for (NeuronCluster c : clusters.values()) {
            if (c.isLoaded()) {
                loaded++;
                neurons += c.size();
            }
            if (c.hasUnsavedChanges()) {
                dirty++;
            }
        }
        return new MemoryStats(clusters.size(), loaded, dirty, neurons, synapses.size(),
            regionMap.size(), capacity.size(), store.totalBytes());
    }

    public EnhancedMemoryStats getEnhancedStats() {
        MemoryStats basic = getStats();
        int partitions = config.getPartitionCount();
        int[] perPartition = new int[partitions];
        long[] bankBytes = new long[partitions];
        for (NeuronCluster c : clusters.values()) {
            perPartition[c.getPartition()]++;
        }
        for (int p = 0; p < partitions; p++) {
            bankBytes[p] = store.banks().partitionBytes(p);
        }
        QuantizerStats qs = quantizer.stats().orElse(null);
        return new EnhancedMemoryStats(basic, perPartition, bankBytes, qs, activationStats.summary(),
            synapses.stats(), featureMapper.size());
    }

    /**
     * Compare the in-memory membership size of up to {@code sampleSize} loaded,
     * saved clusters with what their partition bank holds on disk.
     */
    public IntegrityReport verifyIntegrity(int sampleSize) {
        ensureInitialized();
        store.banks().invalidate();
        List<String> mismatches = new ArrayList<>();
        int checked = 0;
        for (NeuronCluster c : clusters.values()) {
            if (checked == sampleSize) break;
            if (!c.isLoaded() || c.hasUnsavedChanges()) continue;
            checked++;
            try {
                int stored = store.banks().restore(c.getPartition(), c.getId()).map(List::size).orElse(-1);
                if (stored != c.size()) {
                    mismatches.add(c.getId() + ": memory " + c.size() + ", storage " + (stored < 0 ? "missing" : stored));
                }
            } catch (StorageException e) {
                mismatches.add(c.getId() + ": " + e.getMessage());
            }
        }
        if (!mismatches.isEmpty()) {
            logger.warn("Integrity check found {} mismatches in {} clusters", mismatches.size(), checked);
        }
        return new IntegrityReport(checked, mismatches);
    }

    /**
     * Summary of one cluster.
     *
     * @throws ClusterNotFoundException if no cluster has this id
     */
    public ClusterSummary getCluster(String clusterId) {
        ensureInitialized();
        NeuronCluster c = clusters.get(clusterId);
        if (c == null) {
            throw new ClusterNotFoundException(clusterId);
        }
        return summarize(c);
    }

    public List<ClusterSummary> listClusters() {
        ensureInitialized();
        List<ClusterSummary> result = new ArrayList<>(clusters.size());
        for (NeuronCluster c : clusters.values()) {
            result.add(summarize(c));
        }
        return result;
    }

    private static ClusterSummary summarize(NeuronCluster c) {
        return new ClusterSummary(c.getId(), c.getLabel(), c.getOriginRegion(), c.getPartition(), c.size(),
            c.getConcepts(), c.isLoaded(), c.hasUnsavedChanges(), c.getCreatedAt(), c.getLastAccessed());
    }

    /**
     * Current capacity target of a concept, if it has one.
     */
    public OptionalInt getCapacityTarget(String concept) {
        return capacity.currentTarget(concept.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Weight of the synapse {@code source -> target}, 0 if absent.
     */
    public double getSynapseWeight(String sourceNeuron, String targetNeuron) {
        return synapses.weight(sourceNeuron, targetNeuron);
    }

    public EngramConfig getConfig() {
        return config;
    }
}
