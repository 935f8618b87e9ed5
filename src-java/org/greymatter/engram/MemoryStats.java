package org.greymatter.engram;

/**
 * Read-only counters of an {@link EngramMemory}.
 */
public final class MemoryStats {

    private final int totalClusters;
    private final int loadedClusters;
    private final int dirtyClusters;
    private final long loadedNeurons;
    private final int synapses;
    private final int regions;
    private final int trackedConcepts;
    private final long storageBytes;

    MemoryStats(int totalClusters, int loadedClusters, int dirtyClusters, long loadedNeurons,
                int synapses, int regions, int trackedConcepts, long storageBytes) {
        this.totalClusters = totalClusters;
        this.loadedClusters = loadedClusters;
        this.dirtyClusters = dirtyClusters;
        this.loadedNeurons = loadedNeurons;
        this.synapses = synapses;
        this.regions = regions;
        this.trackedConcepts = trackedConcepts;
        this.storageBytes = storageBytes;
    }

    public int getTotalClusters() { return totalClusters; }
    public int getLoadedClusters() { return loadedClusters; }
    public int getDirtyClusters() { return dirtyClusters; }
    public long getLoadedNeurons() { return loadedNeurons; }
    public int getSynapses() { return synapses; }

    /** Region codes with at least one registered cluster. */
    public int getRegions() { return regions; }

    /** Concepts with a capacity target. */
    public int getTrackedConcepts() { return trackedConcepts; }

    /** Bytes currently on disk under the storage path. */
    public long getStorageBytes() { return storageBytes; }

    @Override
    public String toString() {
        return "MemoryStats{" +
               "clusters=" + loadedClusters + "/" + totalClusters +
               ", dirty=" + dirtyClusters +
               ", loadedNeurons=" + loadedNeurons +
               ", synapses=" + synapses +
               ", regions=" + regions +
               ", concepts=" + trackedConcepts +
               ", storageBytes=" + storageBytes +
               '}';
    }
}
