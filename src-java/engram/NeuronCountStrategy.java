package engram;

/**
 * How the initial neuron target of a concept is seeded.
 *
 * <p>{@link #HYPERNETWORK} is the default and the one the learn pipeline is
 * tuned for. {@link #STOCHASTIC} is kept as a selectable alternative; it is
 * never used as a fallback.
 */
public enum NeuronCountStrategy {

    /**
     * {@link NeuronHypernetwork#neuronCount(double, double, double)} over the
     * pattern's novelty, region frequency and complexity.
     */
    HYPERNETWORK,

    /**
     * A jittered base allocation seeded by the concept name and shaped by a
     * power-law over feature emergence. See {@link StochasticNeuronCount}.
     */
    STOCHASTIC
}
