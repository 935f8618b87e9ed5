package org.greymatter.engram;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * Snapshot of one cluster's index entry.
 */
public final class ClusterSummary {

    private final String id;
    private final String label;
    private final String originRegion;
    private final int partition;
    private final int size;
    private final Set<String> concepts;
    private final boolean loaded;
    private final boolean dirty;
    private final Instant createdAt;
    private final Instant lastAccessed;

    ClusterSummary(String id, String label, String originRegion, int partition, int size,
                   Set<String> concepts, boolean loaded, boolean dirty,
                   Instant createdAt, Instant lastAccessed) {
        this.id = id;
        this.label = label;
        this.originRegion = originRegion;
        this.partition = partition;
        this.size = size;
        this.concepts = Collections.unmodifiableSet(concepts);
        this.loaded = loaded;
        this.dirty = dirty;
        this.createdAt = createdAt;
        this.lastAccessed = lastAccessed;
    }

    public String getId() { return id; }

    /** Concept the cluster was created for. */
    public String getLabel() { return label; }

    public String getOriginRegion() { return originRegion; }
    public int getPartition() { return partition; }
    public int getSize() { return size; }
    public Set<String> getConcepts() { return concepts; }
    public boolean isLoaded() { return loaded; }
    public boolean isDirty() { return dirty; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastAccessed() { return lastAccessed; }

    @Override
    public String toString() {
        return "ClusterSummary{" +
               "id='" + id + '\'' +
               ", label='" + label + '\'' +
               ", size=" + size +
               ", concepts=" + concepts +
               ", loaded=" + loaded +
               '}';
    }
}
