package org.greymatter.engram.spring;

import engram.NeuronCountStrategy;
import org.greymatter.engram.QuantizerType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for {@link EngramAutoConfiguration}.
 *
 * <p>Unset properties keep the {@link org.greymatter.engram.EngramConfig} defaults.
 */
@ConfigurationProperties(prefix = "engram")
public class EngramProperties {

    /**
     * Directory holding the persisted memory.
     */
    private String storagePath;

    private Integer dimensions;
    private QuantizerType quantizer;
    private Integer codebookSize;

    /**
     * Minimum centroid similarity for a learned concept to reuse a cluster.
     */
    private Double similarityThreshold;

    private NeuronCountStrategy neuronCountStrategy;
    private Integer minConceptNeurons;
    private Integer maxConceptNeurons;
    private Integer partitionCount;
    private Integer maxConcurrentWrites;
    private Boolean compressBanks;

    /**
     * Idle time after which maintenance unloads a cluster.
     */
    private Duration idleUnload;

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public Integer getDimensions() {
        return dimensions;
    }

    public void setDimensions(Integer dimensions) {
        this.dimensions = dimensions;
    }

    public QuantizerType getQuantizer() {
        return quantizer;
    }

    public void setQuantizer(QuantizerType quantizer) {
        this.quantizer = quantizer;
    }

    public Integer getCodebookSize() {
        return codebookSize;
    }

    public void setCodebookSize(Integer codebookSize) {
        this.codebookSize = codebookSize;
    }

    public Double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(Double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public NeuronCountStrategy getNeuronCountStrategy() {
        return neuronCountStrategy;
    }

    public void setNeuronCountStrategy(NeuronCountStrategy neuronCountStrategy) {
        this.neuronCountStrategy = neuronCountStrategy;
    }

    public Integer getMinConceptNeurons() {
        return minConceptNeurons;
    }

    public void setMinConceptNeurons(Integer minConceptNeurons) {
        this.minConceptNeurons = minConceptNeurons;
    }

    public Integer getMaxConceptNeurons() {
        return maxConceptNeurons;
    }

    public void setMaxConceptNeurons(Integer maxConceptNeurons) {
        this.maxConceptNeurons = maxConceptNeurons;
    }

    public Integer getPartitionCount() {
        return partitionCount;
    }

    public void setPartitionCount(Integer partitionCount) {
        this.partitionCount = partitionCount;
    }

    public Integer getMaxConcurrentWrites() {
        return maxConcurrentWrites;
    }

    public void setMaxConcurrentWrites(Integer maxConcurrentWrites) {
        this.maxConcurrentWrites = maxConcurrentWrites;
    }

    public Boolean getCompressBanks() {
        return compressBanks;
    }

    public void setCompressBanks(Boolean compressBanks) {
        this.compressBanks = compressBanks;
    }

    public Duration getIdleUnload() {
        return idleUnload;
    }

    public void setIdleUnload(Duration idleUnload) {
        this.idleUnload = idleUnload;
    }
}
