package engram;

import java.util.List;
import java.util.Optional;

/**
 * Source of a cluster's members for lazy hydration.
 *
 * <p>Implementations read the partition bank holding the cluster.
 */
@FunctionalInterface
public interface NeuronLoader {

    /**
     * Load the persisted members of a cluster.
     *
     * @param clusterId the cluster to load
     * @return the members, or empty if the cluster has never been saved
     * @throws org.greymatter.engram.StorageException if the bank exists but cannot be read
     */
    Optional<List<Neuron>> load(String clusterId);
}
