package engram;

import engram.internal.Distance;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-region activation counters used to score novelty and frequency.
 *
 * <p>Each region keeps a total activation count and a capped window of its most
 * recent vectors. Novelty of a vector against a region combines
 * <ul>
 *   <li>{@code 1 / (1 + count)}: well-visited regions are less novel</li>
 *   <li>the distance of the vector from the window mean plus the window's own
 *       spread (mean distance from that mean): tight regions and vectors close
 *       to them are less novel</li>
 * </ul>
 * weighted 0.3 / 0.7 and clamped to [0, 1]. An unseen region scores 1.0.
 *
 * <p>Region pairs that fire in the same operation are counted as co-activations.
 */
public final class ActivationStats {

    private static final double COUNT_WEIGHT = 0.3;
    private static final double DISTANCE_WEIGHT = 0.7;

    private final int historyCap;
    private final double frequencyScale;

    private final Map<String, Region> regions = new HashMap<>();
    private final Map<String, Map<String, Long>> coactivations = new HashMap<>();
    private long totalActivations;

    /**
     * @param historyCap vectors kept per region for the running mean
     * @param frequencyScale activation count at which frequency reaches {@code 1 - 1/e}
     */
    public ActivationStats(int historyCap, double frequencyScale) {
        if (historyCap < 1) {
            throw new IllegalArgumentException("historyCap must be positive, got " + historyCap);
        }
        this.historyCap = historyCap;
        this.frequencyScale = frequencyScale > 0 ? frequencyScale : 10.0;
    }

    // =========================================================================
    // Recording
    // =========================================================================

    public void recordActivation(String region, float[] vector) {
        Region r = regions.computeIfAbsent(region, k -> new Region());
        r.count++;
        r.history.addLast(vector.clone());
        while (r.history.size() > historyCap) {
            r.history.removeFirst();
        }
        totalActivations++;
    }

    /**
     * Count every unordered pair of distinct regions in {@code activeRegions} once.
     */
    public void recordCoactivation(List<String> activeRegions) {
        for (int i = 0; i < activeRegions.size(); i++) {
            for (int j = i + 1; j < activeRegions.size(); j++) {
                String a = activeRegions.get(i);
                String b = activeRegions.get(j);
                if (a.equals(b)) continue;
                addCoactivation(a, b, 1L);
            }
        }
    }

    // =========================================================================
    // Scoring
    // =========================================================================

    /**
     * Novelty in [0, 1]; 1.0 for a region never recorded.
     */
    public double calculateNovelty(String region, float[] vector) {
        Region r = regions.get(region);
        if (r == null || r.history.isEmpty()) {
            return 1.0;
        }
        float[] mean = r.mean(vector.length);
        double distance = Math.sqrt(Distance.euclideanSquared(vector, mean));
        double spread = 0.0;
        for (float[] h : r.history) {
            spread += Math.sqrt(Distance.euclideanSquared(h, mean));
        }
        spread /= r.history.size();

        double countTerm = 1.0 / (1.0 + r.count);
        double distanceTerm = Math.min(1.0, (distance + spread) / 2.0);
        double novelty = COUNT_WEIGHT * countTerm + DISTANCE_WEIGHT * distanceTerm;
        return Math.max(0.0, Math.min(1.0, novelty));
    }

    /**
     * Saturating activation frequency in [0, 1): {@code 1 - exp(-count / scale)}.
     */
    public double frequency(String region) {
        long count = count(region);
        return count == 0 ? 0.0 : 1.0 - Math.exp(-count / frequencyScale);
    }

    public long count(String region) {
        Region r = regions.get(region);
        return r == null ? 0L : r.count;
    }

    /**
     * Co-activation count of the pair normalized by total activations.
     */
    public double coactivationStrength(String a, String b) {
        return (double) coactivationCount(a, b) / Math.max(1L, totalActivations);
    }

    public long coactivationCount(String a, String b) {
        boolean swap = a.compareTo(b) > 0;
        String lo = swap ? b : a;
        String hi = swap ? a : b;
        Map<String, Long> row = coactivations.get(lo);
        return row == null ? 0L : row.getOrDefault(hi, 0L);
    }

    /**
     * The n most activated regions, most active first.
     */
    public List<Map.Entry<String, Long>> topRegions(int n) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>();
        for (Map.Entry<String, Region> e : regions.entrySet()) {
            entries.add(Map.entry(e.getKey(), e.getValue().count));
        }
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                     .thenComparing(Map.Entry.comparingByKey()));
        return entries.size() > n ? new ArrayList<>(entries.subList(0, n)) : entries;
    }

    public Summary summary() {
        long pairs = 0;
        for (Map<String, Long> row : coactivations.values()) {
            pairs += row.size();
        }
        double avg = regions.isEmpty() ? 0.0 : (double) totalActivations / regions.size();
        List<Map.Entry<String, Long>> top = topRegions(1);
        String mostFrequent = top.isEmpty() ? "none" : top.get(0).getKey();
        return new Summary(totalActivations, regions.size(), pairs, avg, mostFrequent);
    }

    // =========================================================================
    // Maintenance
    // =========================================================================

    /**
     * Add another instance's counts and histories into this one.
     */
    public void merge(ActivationStats other) {
        totalActivations += other.totalActivations;
        for (Map.Entry<String, Region> e : other.regions.entrySet()) {
            Region mine = regions.computeIfAbsent(e.getKey(), k -> new Region());
            mine.count += e.getValue().count;
            for (float[] h : e.getValue().history) {
                mine.history.addLast(h.clone());
            }
            while (mine.history.size() > historyCap) {
                mine.history.removeFirst();
            }
        }
        for (Map.Entry<String, Map<String, Long>> row : other.coactivations.entrySet()) {
            for (Map.Entry<String, Long> cell : row.getValue().entrySet()) {
                addCoactivation(row.getKey(), cell.getKey(), cell.getValue());
            }
        }
    }

    /**
     * Drop regions seen fewer than {@code minCount} times, with their co-activations.
     *
     * @return number of regions removed
     */
    public int prune(long minCount) {
        int removed = 0;
        Iterator<Map.Entry<String, Region>> it = regions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Region> e = it.next();
            if (e.getValue().count < minCount) {
                it.remove();
                removed++;
            }
        }
        coactivations.keySet().retainAll(regions.keySet());
        for (Map<String, Long> row : coactivations.values()) {
            row.keySet().retainAll(regions.keySet());
        }
        coactivations.values().removeIf(Map::isEmpty);
        return removed;
    }

    public void reset() {
        regions.clear();
        coactivations.clear();
        totalActivations = 0;
    }

    // =========================================================================
    // Persistence hooks
    // =========================================================================

    public long totalActivations() {
        return totalActivations;
    }

    public int regionCount() {
        return regions.size();
    }

    /**
     * Read-only view of the recent vectors of a region, oldest first.
     */
    public List<float[]> history(String region) {
        Region r = regions.get(region);
        return r == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(r.history));
    }

    public Iterable<String> regions() {
        return Collections.unmodifiableSet(regions.keySet());
    }

    /**
     * Canonical (lexicographically ordered) co-activation pairs and their counts.
     */
    public Map<String, Map<String, Long>> coactivations() {
        return Collections.unmodifiableMap(coactivations);
    }

    /**
     * Restore a region exactly as persisted, replacing any existing state for it.
     */
    public void restoreRegion(String region, long count, List<float[]> history) {
        Region r = new Region();
        r.count = count;
        for (float[] h : history) {
            r.history.addLast(h.clone());
        }
        while (r.history.size() > historyCap) {
            r.history.removeFirst();
        }
        regions.put(region, r);
    }

    public void restoreCoactivation(String a, String b, long count) {
        addCoactivation(a, b, count);
    }

    public void restoreTotal(long total) {
        this.totalActivations = total;
    }

    private void addCoactivation(String a, String b, long count) {
        boolean swap = a.compareTo(b) > 0;
        String lo = swap ? b : a;
        String hi = swap ? a : b;
        coactivations.computeIfAbsent(lo, k -> new HashMap<>()).merge(hi, count, Long::sum);
    }

    private static final class Region {
        long count;
        final Deque<float[]> history = new ArrayDeque<>();

        float[] mean(int dimensions) {
            float[] mean = new float[dimensions];
            for (float[] h : history) {
                for (int i = 0; i < dimensions; i++) {
                    mean[i] += h[i];
                }
            }
            for (int i = 0; i < dimensions; i++) {
                mean[i] /= history.size();
            }
            return mean;
        }
    }

    /**
     * Aggregate view of the counters.
     */
    public static final class Summary {
        private final long totalActivations;
        private final int uniqueRegions;
        private final long uniqueCoactivations;
        private final double averageRegionFrequency;
        private final String mostFrequentRegion;

        Summary(long totalActivations, int uniqueRegions, long uniqueCoactivations,
                double averageRegionFrequency, String mostFrequentRegion) {
            this.totalActivations = totalActivations;
            this.uniqueRegions = uniqueRegions;
            this.uniqueCoactivations = uniqueCoactivations;
            this.averageRegionFrequency = averageRegionFrequency;
            this.mostFrequentRegion = mostFrequentRegion;
        }

        public long getTotalActivations() { return totalActivations; }
        public int getUniqueRegions() { return uniqueRegions; }
        public long getUniqueCoactivations() { return uniqueCoactivations; }
        public double getAverageRegionFrequency() { return averageRegionFrequency; }
        public String getMostFrequentRegion() { return mostFrequentRegion; }

        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                "ActivationStats{total=%d, regions=%d, coactivations=%d, avgPerRegion=%.2f, mostFrequent=%s}",
                totalActivations, uniqueRegions, uniqueCoactivations, averageRegionFrequency, mostFrequentRegion);
        }
    }
}
