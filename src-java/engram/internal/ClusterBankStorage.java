package engram.internal;

import engram.Neuron;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage interface for lazy neuron hydration.
 *
 * <p>Neurons are grouped by cluster, and clusters by partition. When a cluster's
 * neurons are needed and not in memory, {@link #restore} is called to load them;
 * dirty clusters are written back a partition at a time with {@link #store}.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public interface ClusterBankStorage {

    /**
     * Restore the neurons of one cluster.
     *
     * @param partition the partition the cluster hashes to
     * @param clusterId the cluster id
     * @return the neurons, or empty if the partition has no record of the cluster
     * @throws org.greymatter.engram.StorageException if the bank exists but cannot be read
     */
    Optional<List<Neuron>> restore(int partition, String clusterId);

    /**
     * Write updated clusters into a partition, keeping every other cluster already stored there.
     *
     * <p>Callers must not store the same partition from two threads at once.
     *
     * @param partition the partition
     * @param clusters cluster id to its full member list
     * @throws org.greymatter.engram.StorageException on I/O failure; the previous bank stays intact
     */
    void store(int partition, Map<String, List<Neuron>> clusters);

    /**
     * Bytes on disk for a partition, 0 if it was never written.
     */
    long partitionBytes(int partition);

    /**
     * Number of clusters stored in a partition.
     */
    default int clusterCount(int partition) {
        return 0;
    }
}
