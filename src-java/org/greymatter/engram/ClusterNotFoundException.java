package org.greymatter.engram;

/**
 * Thrown when a cluster id is looked up explicitly but is not known to the index.
 */
public class ClusterNotFoundException extends EngramException {

    private final String clusterId;

    /**
     * @param clusterId the id that was requested
     */
    public ClusterNotFoundException(String clusterId) {
        super("Cluster not found: " + clusterId);
        this.clusterId = clusterId;
    }

    /**
     * Get the id that was requested.
     *
     * @return the cluster id
     */
    public String getClusterId() {
        return clusterId;
    }
}
