package org.greymatter.engram;

import engram.ActivationStats;
import engram.QuantizerStats;
import engram.SparseSynapticGraph;

import java.util.Optional;

/**
 * {@link MemoryStats} plus per-partition and per-subsystem detail.
 */
public final class EnhancedMemoryStats {

    private final MemoryStats basic;
    private final int[] clustersPerPartition;
    private final long[] bankBytesPerPartition;
    private final QuantizerStats quantizer;
    private final ActivationStats.Summary activation;
    private final SparseSynapticGraph.Stats synapses;
    private final int mappedFeatures;

    EnhancedMemoryStats(MemoryStats basic, int[] clustersPerPartition, long[] bankBytesPerPartition,
                        QuantizerStats quantizer, ActivationStats.Summary activation,
                        SparseSynapticGraph.Stats synapses, int mappedFeatures) {
        this.basic = basic;
        this.clustersPerPartition = clustersPerPartition;
        this.bankBytesPerPartition = bankBytesPerPartition;
        this.quantizer = quantizer;
        this.activation = activation;
        this.synapses = synapses;
        this.mappedFeatures = mappedFeatures;
    }

    public MemoryStats getBasic() { return basic; }

    /** Known clusters by partition, index = partition number. */
    public int[] getClustersPerPartition() { return clustersPerPartition.clone(); }

    /** Bank file size by partition, 0 for partitions never written. */
    public long[] getBankBytesPerPartition() { return bankBytesPerPartition.clone(); }

    /**
     * Codebook statistics; empty for the LSH quantizer.
     */
    public Optional<QuantizerStats> getQuantizer() { return Optional.ofNullable(quantizer); }

    public ActivationStats.Summary getActivation() { return activation; }
    public SparseSynapticGraph.Stats getSynapses() { return synapses; }
    public int getMappedFeatures() { return mappedFeatures; }

    @Override
    public String toString() {
        return "EnhancedMemoryStats{" +
               "basic=" + basic +
               ", quantizer=" + quantizer +
               ", activation=" + activation +
               ", synapses=" + synapses +
               ", mappedFeatures=" + mappedFeatures +
               '}';
    }
}
