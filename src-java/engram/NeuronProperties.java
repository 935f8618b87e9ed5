package engram;

import java.util.Locale;

/**
 * Per-neuron parameters produced by {@link NeuronHypernetwork#generateNeurons}.
 */
public final class NeuronProperties {

    private final int index;
    private final double activationThreshold;
    private final double decayRate;
    private final NeuronRole role;

    NeuronProperties(int index, double activationThreshold, double decayRate, NeuronRole role) {
        this.index = index;
        this.activationThreshold = activationThreshold;
        this.decayRate = decayRate;
        this.role = role;
    }

    /** Position in the generated batch. */
    public int getIndex() { return index; }

    /** Output level in [0.3, 0.7) above which the neuron counts as firing for Hebbian updates. */
    public double getActivationThreshold() { return activationThreshold; }

    /** Potential decay factor in [0.9, 0.99) applied when the neuron stays below threshold. */
    public double getDecayRate() { return decayRate; }

    public NeuronRole getRole() { return role; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "NeuronProperties{index=%d, threshold=%.3f, decay=%.3f, role=%s}",
                             index, activationThreshold, decayRate, role);
    }
}
