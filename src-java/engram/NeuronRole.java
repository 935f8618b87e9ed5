package engram;

/**
 * Functional position of a neuron inside its cluster, assigned at growth time.
 */
public enum NeuronRole {

    /** First fifth of a growth batch: receives external input. */
    INPUT_RECEIVER,

    /** Middle band, roughly 30%: detects sub-patterns. */
    PATTERN_DETECTOR,

    /** Middle band, roughly 70%: combines signals. */
    INTEGRATOR,

    /** Last fifth: produces cluster output. */
    OUTPUT_GENERATOR
}
