package engram.internal;

import engram.ActivationStats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned JSON document shapes for the persisted state.
 *
 * <p>Each top-level document carries a {@code version}; readers reject any
 * version they do not know. Field names are the on-disk contract.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class Documents {

    public static final int CURRENT_VERSION = 1;

    private Documents() {}

    /**
     * Base of every top-level document.
     */
    public abstract static class Versioned {
        public int version = CURRENT_VERSION;
    }

    // =========================================================================
    // Cluster index
    // =========================================================================

    public static final class ClusterIndex extends Versioned {
        public long nextClusterSequence;
        public List<ClusterEntry> clusters = new ArrayList<>();
        /** Concept label to the cluster it was last learned into. */
        public Map<String, String> conceptAffinity = new LinkedHashMap<>();
    }

    public static final class ClusterEntry {
        public String id;
        public String label;
        public String originRegion;
        public int partition;
        public float[] centroid;
        public long centroidSamples;
        public List<String> concepts = new ArrayList<>();
        public int size;
        public long nextNeuronOrdinal;
        public Instant createdAt;
        public Instant lastAccessed;
    }

    // =========================================================================
    // Region map
    // =========================================================================

    public static final class RegionMap extends Versioned {
        public Map<String, List<String>> regions = new LinkedHashMap<>();
    }

    // =========================================================================
    // Activation statistics
    // =========================================================================

    public static final class ActivationStatsDocument extends Versioned {
        public long totalActivations;
        public List<RegionEntry> regions = new ArrayList<>();
        public List<CoactivationEntry> coactivations = new ArrayList<>();

        public static ActivationStatsDocument from(ActivationStats stats) {
            ActivationStatsDocument doc = new ActivationStatsDocument();
            doc.totalActivations = stats.totalActivations();
            for (String region : stats.regions()) {
                RegionEntry e = new RegionEntry();
                e.region = region;
                e.count = stats.count(region);
                e.history = new ArrayList<>(stats.history(region));
                doc.regions.add(e);
            }
            for (Map.Entry<String, Map<String, Long>> a : stats.coactivations().entrySet()) {
                for (Map.Entry<String, Long> b : a.getValue().entrySet()) {
                    CoactivationEntry c = new CoactivationEntry();
                    c.a = a.getKey();
                    c.b = b.getKey();
                    c.count = b.getValue();
                    doc.coactivations.add(c);
                }
            }
            return doc;
        }

        /**
         * Replace the contents of {@code stats} with this document.
         */
        public void restoreInto(ActivationStats stats) {
            stats.reset();
            for (RegionEntry e : regions) {
                stats.restoreRegion(e.region, e.count, e.history == null ? List.of() : e.history);
            }
            for (CoactivationEntry c : coactivations) {
                stats.restoreCoactivation(c.a, c.b, c.count);
            }
            stats.restoreTotal(totalActivations);
        }
    }

    public static final class RegionEntry {
        public String region;
        public long count;
        public List<float[]> history = new ArrayList<>();
    }

    public static final class CoactivationEntry {
        public String a;
        public String b;
        public long count;
    }

    // =========================================================================
    // Feature map and capacities
    // =========================================================================

    public static final class FeatureMap extends Versioned {
        public Map<String, Integer> features = new LinkedHashMap<>();
    }

    public static final class Capacities extends Versioned {
        public Map<String, Integer> targets = new LinkedHashMap<>();
    }
}
