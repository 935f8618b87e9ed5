package org.greymatter.engram;

import engram.NeuronCountStrategy;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for an {@link EngramMemory}.
 *
 * <p>This is an immutable record of every tunable the engine uses.
 * Use {@link #builder()} to construct one; every property has a default, except
 * {@code storagePath}, which is required.</p>
 */
public final class EngramConfig {

    private final Path storagePath;
    private final int dimensions;

    // Quantization
    private final QuantizerType quantizer;
    private final int codebookSize;
    private final float emaDecay;
    private final float commitment;
    private final long quantizerSeed;
    private final int lshBands;
    private final int lshRowsPerBand;
    private final int neighborRegions;

    // Matching
    private final double similarityThreshold;
    private final double retrievalThreshold;

    // Allocation
    private final double hypernetworkAlpha;
    private final double hypernetworkBeta;
    private final double hypernetworkGamma;
    private final int hypernetworkMinNeurons;
    private final int hypernetworkMaxNeurons;
    private final long hypernetworkSeed;
    private final NeuronCountStrategy neuronCountStrategy;
    private final int minConceptNeurons;
    private final int maxConceptNeurons;
    private final double capacityEmaAlpha;
    private final double capacityHysteresis;
    private final int maxGrowthPerRun;
    private final int activationHistory;
    private final long activationPruneMinCount;

    // Synapses
    private final double hebbianLearningRate;
    private final double minSynapseWeight;
    private final double maxSynapseWeight;
    private final double pruneThreshold;
    private final double coactivationFloor;
    private final double synapseDecay;
    private final int maxHebbianParticipants;
    private final int crossLinkClusters;
    private final int crossLinkFanOut;
    private final double crossLinkWeight;

    // Retrieval
    private final int clustersPerConcept;
    private final int activatedClusters;

    // Storage and lifecycle
    private final int partitionCount;
    private final int maxConcurrentWrites;
    private final boolean compressBanks;
    private final Duration idleUnload;
    private final Clock clock;

    private EngramConfig(Builder b) {
        this.storagePath = Objects.requireNonNull(b.storagePath, "storagePath is required");
        this.dimensions = b.dimensions;
        this.quantizer = b.quantizer;
        this.codebookSize = b.codebookSize;
        this.emaDecay = b.emaDecay;
        this.commitment = b.commitment;
        this.quantizerSeed = b.quantizerSeed;
        this.lshBands = b.lshBands;
        this.lshRowsPerBand = b.lshRowsPerBand;
        this.neighborRegions = b.neighborRegions;
        this.similarityThreshold = b.similarityThreshold;
        this.retrievalThreshold = b.retrievalThreshold;
        this.hypernetworkAlpha = b.hypernetworkAlpha;
        this.hypernetworkBeta = b.hypernetworkBeta;
        this.hypernetworkGamma = b.hypernetworkGamma;
        this.hypernetworkMinNeurons = b.hypernetworkMinNeurons;
        this.hypernetworkMaxNeurons = b.hypernetworkMaxNeurons;
        this.hypernetworkSeed = b.hypernetworkSeed;
        this.neuronCountStrategy = b.neuronCountStrategy;
        this.minConceptNeurons = b.minConceptNeurons;
        this.maxConceptNeurons = b.maxConceptNeurons;
        this.capacityEmaAlpha = b.capacityEmaAlpha;
        this.capacityHysteresis = b.capacityHysteresis;
        this.maxGrowthPerRun = b.maxGrowthPerRun;
        this.activationHistory = b.activationHistory;
        this.activationPruneMinCount = b.activationPruneMinCount;
        this.hebbianLearningRate = b.hebbianLearningRate;
        this.minSynapseWeight = b.minSynapseWeight;
        this.maxSynapseWeight = b.maxSynapseWeight;
        this.pruneThreshold = b.pruneThreshold;
        this.coactivationFloor = b.coactivationFloor;
        this.synapseDecay = b.synapseDecay;
        this.maxHebbianParticipants = b.maxHebbianParticipants;
        this.crossLinkClusters = b.crossLinkClusters;
        this.crossLinkFanOut = b.crossLinkFanOut;
        this.crossLinkWeight = b.crossLinkWeight;
        this.clustersPerConcept = b.clustersPerConcept;
        this.activatedClusters = b.activatedClusters;
        this.partitionCount = b.partitionCount;
        this.maxConcurrentWrites = b.maxConcurrentWrites;
        this.compressBanks = b.compressBanks;
        this.idleUnload = Objects.requireNonNull(b.idleUnload, "idleUnload");
        this.clock = Objects.requireNonNull(b.clock, "clock");

        if (similarityThreshold < 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException("similarityThreshold must be in [0, 1], got " + similarityThreshold);
        }
        if (partitionCount < 1 || maxConcurrentWrites < 1) {
            throw new IllegalArgumentException("partitionCount and maxConcurrentWrites must be positive");
        }
        if (activationPruneMinCount < 0) {
            throw new IllegalArgumentException("activationPruneMinCount must be non-negative, got " + activationPruneMinCount);
        }
    }

    /**
     * Create a builder with default settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Path getStoragePath() { return storagePath; }
    public int getDimensions() { return dimensions; }
    public QuantizerType getQuantizer() { return quantizer; }
    public int getCodebookSize() { return codebookSize; }
    public float getEmaDecay() { return emaDecay; }
    public float getCommitment() { return commitment; }
    public long getQuantizerSeed() { return quantizerSeed; }
    public int getLshBands() { return lshBands; }
    public int getLshRowsPerBand() { return lshRowsPerBand; }
    public int getNeighborRegions() { return neighborRegions; }
    public double getSimilarityThreshold() { return similarityThreshold; }
    public double getRetrievalThreshold() { return retrievalThreshold; }
    public double getHypernetworkAlpha() { return hypernetworkAlpha; }
    public double getHypernetworkBeta() { return hypernetworkBeta; }
    public double getHypernetworkGamma() { return hypernetworkGamma; }
    public int getHypernetworkMinNeurons() { return hypernetworkMinNeurons; }
    public int getHypernetworkMaxNeurons() { return hypernetworkMaxNeurons; }
    public long getHypernetworkSeed() { return hypernetworkSeed; }
    public NeuronCountStrategy getNeuronCountStrategy() { return neuronCountStrategy; }
    public int getMinConceptNeurons() { return minConceptNeurons; }
    public int getMaxConceptNeurons() { return maxConceptNeurons; }
    public double getCapacityEmaAlpha() { return capacityEmaAlpha; }
    public double getCapacityHysteresis() { return capacityHysteresis; }
    public int getMaxGrowthPerRun() { return maxGrowthPerRun; }
    public int getActivationHistory() { return activationHistory; }
    public long getActivationPruneMinCount() { return activationPruneMinCount; }
    public double getHebbianLearningRate() { return hebbianLearningRate; }
    public double getMinSynapseWeight() { return minSynapseWeight; }
    public double getMaxSynapseWeight() { return maxSynapseWeight; }
    public double getPruneThreshold() { return pruneThreshold; }
    public double getCoactivationFloor() { return coactivationFloor; }
    public double getSynapseDecay() { return synapseDecay; }
    public int getMaxHebbianParticipants() { return maxHebbianParticipants; }
    public int getCrossLinkClusters() { return crossLinkClusters; }
    public int getCrossLinkFanOut() { return crossLinkFanOut; }
    public double getCrossLinkWeight() { return crossLinkWeight; }
    public int getClustersPerConcept() { return clustersPerConcept; }
    public int getActivatedClusters() { return activatedClusters; }
    public int getPartitionCount() { return partitionCount; }
    public int getMaxConcurrentWrites() { return maxConcurrentWrites; }
    public boolean isCompressBanks() { return compressBanks; }
    public Duration getIdleUnload() { return idleUnload; }
    public Clock getClock() { return clock; }

    @Override
    public String toString() {
        return "EngramConfig{" +
               "storagePath='" + storagePath + '\'' +
               ", dimensions=" + dimensions +
               ", quantizer=" + quantizer +
               ", codebookSize=" + codebookSize +
               ", similarityThreshold=" + similarityThreshold +
               ", neuronCountStrategy=" + neuronCountStrategy +
               ", conceptNeurons=[" + minConceptNeurons + ", " + maxConceptNeurons + "]" +
               ", partitionCount=" + partitionCount +
               ", maxConcurrentWrites=" + maxConcurrentWrites +
               ", compressBanks=" + compressBanks +
               ", idleUnload=" + idleUnload +
               '}';
    }

    /**
     * Builder for {@link EngramConfig}.
     */
    public static final class Builder {
        private Path storagePath;
        private int dimensions = 128;

        private QuantizerType quantizer = QuantizerType.CODEBOOK;
        private int codebookSize = 512;
        private float emaDecay = 0.99f;
        private float commitment = 0.25f;
        private long quantizerSeed = 42L;
        private int lshBands = 16;
        private int lshRowsPerBand = 4;
        private int neighborRegions = 5;

        private double similarityThreshold = 0.85;
        private double retrievalThreshold = 0.5;

        private double hypernetworkAlpha = 20.0;
        private double hypernetworkBeta = 100.0;
        private double hypernetworkGamma = 50.0;
        private int hypernetworkMinNeurons = 5;
        private int hypernetworkMaxNeurons = 500;
        private long hypernetworkSeed = 42L;
        private NeuronCountStrategy neuronCountStrategy = NeuronCountStrategy.HYPERNETWORK;
        private int minConceptNeurons = 50;
        private int maxConceptNeurons = 600;
        private double capacityEmaAlpha = 0.05;
        private double capacityHysteresis = 0.15;
        private int maxGrowthPerRun = 64;
        private int activationHistory = 32;
        private long activationPruneMinCount = 2;

        private double hebbianLearningRate = 0.01;
        private double minSynapseWeight = 0.0;
        private double maxSynapseWeight = 1.0;
        private double pruneThreshold = 0.1;
        private double coactivationFloor = 0.1;
        private double synapseDecay = 0.99;
        private int maxHebbianParticipants = 64;
        private int crossLinkClusters = 2;
        private int crossLinkFanOut = 3;
        private double crossLinkWeight = 0.2;

        private int clustersPerConcept = 3;
        private int activatedClusters = 5;

        private int partitionCount = 16;
        private int maxConcurrentWrites = 2;
        private boolean compressBanks = true;
        private Duration idleUnload = Duration.ofMinutes(30);
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /** Directory holding all persisted state. Required. */
        public Builder storagePath(Path p) { this.storagePath = p; return this; }
        public Builder storagePath(String p) { this.storagePath = Path.of(p); return this; }
        public Builder dimensions(int d) { this.dimensions = d; return this; }

        public Builder quantizer(QuantizerType q) { this.quantizer = q; return this; }
        public Builder codebookSize(int n) { this.codebookSize = n; return this; }
        public Builder emaDecay(float d) { this.emaDecay = d; return this; }
        public Builder commitment(float c) { this.commitment = c; return this; }
        public Builder quantizerSeed(long s) { this.quantizerSeed = s; return this; }
        public Builder lshBands(int n) { this.lshBands = n; return this; }
        public Builder lshRowsPerBand(int n) { this.lshRowsPerBand = n; return this; }
        /** Neighboring regions searched besides the assigned one. */
        public Builder neighborRegions(int k) { this.neighborRegions = k; return this; }

        /** Minimum centroid cosine for a learn call to reuse an existing cluster. */
        public Builder similarityThreshold(double t) { this.similarityThreshold = t; return this; }
        /** Minimum similarity for a cluster to be retrieved on the process path. */
        public Builder retrievalThreshold(double t) { this.retrievalThreshold = t; return this; }

        public Builder hypernetworkAlpha(double a) { this.hypernetworkAlpha = a; return this; }
        public Builder hypernetworkBeta(double b) { this.hypernetworkBeta = b; return this; }
        public Builder hypernetworkGamma(double g) { this.hypernetworkGamma = g; return this; }
        public Builder hypernetworkMinNeurons(int n) { this.hypernetworkMinNeurons = n; return this; }
        public Builder hypernetworkMaxNeurons(int n) { this.hypernetworkMaxNeurons = n; return this; }
        public Builder hypernetworkSeed(long s) { this.hypernetworkSeed = s; return this; }
        public Builder neuronCountStrategy(NeuronCountStrategy s) { this.neuronCountStrategy = s; return this; }
        public Builder minConceptNeurons(int n) { this.minConceptNeurons = n; return this; }
        public Builder maxConceptNeurons(int n) { this.maxConceptNeurons = n; return this; }
        public Builder capacityEmaAlpha(double a) { this.capacityEmaAlpha = a; return this; }
        public Builder capacityHysteresis(double h) { this.capacityHysteresis = h; return this; }
        /** Growth cap per learn call once a concept has neurons. */
        public Builder maxGrowthPerRun(int n) { this.maxGrowthPerRun = n; return this; }
        public Builder activationHistory(int n) { this.activationHistory = n; return this; }
        /** Regions seen fewer times than this are dropped from activation stats by maintenance; 0 keeps all. */
        public Builder activationPruneMinCount(long n) { this.activationPruneMinCount = n; return this; }

        public Builder hebbianLearningRate(double r) { this.hebbianLearningRate = r; return this; }
        public Builder minSynapseWeight(double w) { this.minSynapseWeight = w; return this; }
        public Builder maxSynapseWeight(double w) { this.maxSynapseWeight = w; return this; }
        public Builder pruneThreshold(double t) { this.pruneThreshold = t; return this; }
        public Builder coactivationFloor(double f) { this.coactivationFloor = f; return this; }
        /** Weight multiplier applied to every synapse per maintenance pass. */
        public Builder synapseDecay(double d) { this.synapseDecay = d; return this; }
        public Builder maxHebbianParticipants(int n) { this.maxHebbianParticipants = n; return this; }
        public Builder crossLinkClusters(int n) { this.crossLinkClusters = n; return this; }
        public Builder crossLinkFanOut(int n) { this.crossLinkFanOut = n; return this; }
        public Builder crossLinkWeight(double w) { this.crossLinkWeight = w; return this; }

        public Builder clustersPerConcept(int n) { this.clustersPerConcept = n; return this; }
        public Builder activatedClusters(int n) { this.activatedClusters = n; return this; }

        public Builder partitionCount(int n) { this.partitionCount = n; return this; }
        public Builder maxConcurrentWrites(int n) { this.maxConcurrentWrites = n; return this; }
        public Builder compressBanks(boolean c) { this.compressBanks = c; return this; }
        public Builder idleUnload(Duration d) { this.idleUnload = d; return this; }
        /** Time source for access and eviction bookkeeping. */
        public Builder clock(Clock c) { this.clock = c; return this; }

        public EngramConfig build() {
            return new EngramConfig(this);
        }
    }
}
