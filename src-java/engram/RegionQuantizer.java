package engram;

import java.util.List;
import java.util.Optional;

/**
 * Maps a feature vector onto a discrete region code.
 *
 * <p>Two strategies exist: {@link LshRegionQuantizer} (static random hyperplanes)
 * and {@link CodebookRegionQuantizer} (learned codebook refined online).
 *
 * <p><b>Contract for adaptive implementations:</b> {@link #assign(float[])} is
 * both a query and a training step. On the learned path there is no read-only
 * assignment; use {@link #nearest(float[], int)} when state must not change.
 * Region codes of an adaptive quantizer are stable only until it re-centers,
 * so callers mapping codes to clusters must tolerate drift.
 */
public interface RegionQuantizer {

    /**
     * Assign a vector to its region. Adaptive implementations update the
     * winning code as a side effect.
     *
     * @param vector a vector of length {@link #dimensions()}
     * @return the region code
     */
    String assign(float[] vector);

    /**
     * The k closest region codes, closest first. Never mutates state.
     *
     * @param vector query vector
     * @param k maximum number of codes to return
     * @return up to k region codes
     */
    List<String> nearest(float[] vector, int k);

    /**
     * Vector length accepted by this quantizer.
     */
    int dimensions();

    /**
     * True when {@link #assign(float[])} mutates the quantizer.
     */
    boolean isAdaptive();

    /**
     * Usage statistics, when the strategy tracks them.
     */
    default Optional<QuantizerStats> stats() {
        return Optional.empty();
    }
}
