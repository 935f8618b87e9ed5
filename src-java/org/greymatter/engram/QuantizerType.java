package org.greymatter.engram;

/**
 * Region quantization strategies.
 *
 * <p>The choice decides how feature vectors are bucketed before cluster search:</p>
 * <ul>
 *   <li><b>CODEBOOK:</b> Learned codebook, refined online. Preferred.</li>
 *   <li><b>LSH:</b> Static random hyperplanes. Legacy.</li>
 * </ul>
 */
public enum QuantizerType {

    /**
     * Learned codebook quantizer.
     *
     * <p>Every assignment also trains the winning code, so region codes drift
     * as the codebook adapts. Its state is persisted as the codebook snapshot.</p>
     */
    CODEBOOK,

    /**
     * Locality-sensitive hashing over seeded random hyperplanes.
     *
     * <p>Fully deterministic and stateless; nothing to persist.</p>
     */
    LSH
}
