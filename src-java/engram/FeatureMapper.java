package engram;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Stable feature-name to integer-id mapping.
 *
 * <p>Names are lower-cased; ids are handed out sequentially from 0 and never reused,
 * so a persisted neuron weight keyed by id keeps its meaning across restarts.
 */
public final class FeatureMapper {

    private final Map<String, Integer> idsByName = new LinkedHashMap<>();
    private final Map<Integer, String> namesById = new HashMap<>();
    private int nextId;

    /**
     * Id for a feature name, allocating one on first sight.
     */
    public int idFor(String featureName) {
        String key = featureName.toLowerCase(Locale.ROOT);
        Integer id = idsByName.get(key);
        if (id == null) {
            id = nextId++;
            idsByName.put(key, id);
            namesById.put(id, key);
        }
        return id;
    }

    public String nameFor(int id) {
        return namesById.get(id);
    }

    /**
     * Translate named feature values into id-keyed neuron inputs. Null, NaN and
     * infinite values are dropped.
     */
    public Map<Integer, Double> toInputs(Map<String, Double> features) {
        Map<Integer, Double> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : features.entrySet()) {
            if (isUsable(e.getValue())) {
                inputs.put(idFor(e.getKey()), e.getValue());
            }
        }
        return inputs;
    }

    /**
     * Like {@link #toInputs} but drops names that were never mapped, so lookups
     * on the read path do not grow the mapping.
     */
    public Map<Integer, Double> toKnownInputs(Map<String, Double> features) {
        Map<Integer, Double> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : features.entrySet()) {
            Integer id = idsByName.get(e.getKey().toLowerCase(Locale.ROOT));
            if (id != null && isUsable(e.getValue())) {
                inputs.put(id, e.getValue());
            }
        }
        return inputs;
    }

    public int size() {
        return idsByName.size();
    }

    private static boolean isUsable(Double value) {
        return value != null && Double.isFinite(value);
    }

    public Map<String, Integer> mappings() {
        return Collections.unmodifiableMap(idsByName);
    }

    /**
     * Replace all mappings with a persisted snapshot.
     */
    public void restore(Map<String, Integer> mappings) {
        idsByName.clear();
        namesById.clear();
        nextId = 0;
        for (Map.Entry<String, Integer> e : mappings.entrySet()) {
            idsByName.put(e.getKey(), e.getValue());
            namesById.put(e.getValue(), e.getKey());
            nextId = Math.max(nextId, e.getValue() + 1);
        }
    }
}
