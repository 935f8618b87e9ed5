package org.greymatter.engram;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link EngramMemory#processInput}.
 */
public final class ProcessingResult {

    private final String input;
    private final String response;
    private final List<String> activatedClusters;
    private final int activatedNeuronCount;
    private final double confidence;

    ProcessingResult(String input, String response, List<String> activatedClusters,
                     int activatedNeuronCount, double confidence) {
        this.input = input;
        this.response = response;
        this.activatedClusters = Collections.unmodifiableList(activatedClusters);
        this.activatedNeuronCount = activatedNeuronCount;
        this.confidence = confidence;
    }

    public String getInput() { return input; }

    /** Human readable description of how strongly the input was recognized. */
    public String getResponse() { return response; }

    /** Ids of the activated clusters, strongest accumulated match first. */
    public List<String> getActivatedClusters() { return activatedClusters; }

    /** Neurons whose output magnitude exceeded the reporting floor. */
    public int getActivatedNeuronCount() { return activatedNeuronCount; }

    /** Mean of average and maximum neuron output; 0 when nothing fired. */
    public double getConfidence() { return confidence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessingResult that = (ProcessingResult) o;
        return activatedNeuronCount == that.activatedNeuronCount
               && Double.compare(that.confidence, confidence) == 0
               && Objects.equals(input, that.input)
               && Objects.equals(response, that.response)
               && Objects.equals(activatedClusters, that.activatedClusters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, response, activatedClusters, activatedNeuronCount, confidence);
    }

    @Override
    public String toString() {
        return "ProcessingResult{" +
               "response='" + response + '\'' +
               ", activatedClusters=" + activatedClusters +
               ", activatedNeuronCount=" + activatedNeuronCount +
               ", confidence=" + confidence +
               '}';
    }
}
