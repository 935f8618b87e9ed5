package org.greymatter.engram;

import java.util.Objects;

/**
 * Outcome of {@link EngramMemory#learnConcept}.
 */
public final class LearningResult {

    private final String concept;
    private final String clusterId;
    private final boolean success;
    private final boolean newCluster;
    private final int neuronsInvolved;
    private final int neuronsCreated;

    LearningResult(String concept, String clusterId, boolean success, boolean newCluster,
                   int neuronsInvolved, int neuronsCreated) {
        this.concept = concept;
        this.clusterId = clusterId;
        this.success = success;
        this.newCluster = newCluster;
        this.neuronsInvolved = neuronsInvolved;
        this.neuronsCreated = neuronsCreated;
    }

    static LearningResult failed(String concept) {
        return new LearningResult(concept, null, false, false, 0, 0);
    }

    public String getConcept() { return concept; }

    /**
     * Cluster the concept was learned into, or null when the call failed.
     */
    public String getClusterId() { return clusterId; }

    public boolean isSuccess() { return success; }

    /** True when no existing cluster was similar enough and one was created. */
    public boolean isNewCluster() { return newCluster; }

    /** Concept-tagged neurons in the cluster after this call. */
    public int getNeuronsInvolved() { return neuronsInvolved; }

    public int getNeuronsCreated() { return neuronsCreated; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LearningResult that = (LearningResult) o;
        return success == that.success && newCluster == that.newCluster
               && neuronsInvolved == that.neuronsInvolved && neuronsCreated == that.neuronsCreated
               && Objects.equals(concept, that.concept) && Objects.equals(clusterId, that.clusterId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(concept, clusterId, success, newCluster, neuronsInvolved, neuronsCreated);
    }

    @Override
    public String toString() {
        return "LearningResult{" +
               "concept='" + concept + '\'' +
               ", clusterId='" + clusterId + '\'' +
               ", success=" + success +
               ", newCluster=" + newCluster +
               ", neuronsInvolved=" + neuronsInvolved +
               ", neuronsCreated=" + neuronsCreated +
               '}';
    }
}
