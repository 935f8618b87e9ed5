package engram;

import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NeuronHypernetwork")
class NeuronHypernetworkTest {

    private final NeuronHypernetwork net = new NeuronHypernetwork(20, 100, 50, 5, 500, 42L);

    @Test
    @DisplayName("neuron count follows the allocation formula")
    void testFormula() {
        assertEquals(5, net.neuronCount(0, 0, 0));
        // 5 + 20 ln 2 + 100 + 50 = 168.86
        assertEquals(169, net.neuronCount(1, 1, 1));
        assertEquals(net.neuronCount(0.4, 0.2, 0.7), net.neuronCount(0.4, 0.2, 0.7));
    }

    @Test
    @DisplayName("neuron count is clamped to the configured range")
    void testClamp() {
        NeuronHypernetwork small = new NeuronHypernetwork(20, 100, 50, 5, 100, 42L);
        assertEquals(100, small.neuronCount(1, 1, 1));
        assertEquals(5, small.neuronCount(-3, 0, 0));
    }

    @Test
    @DisplayName("complexity stays within [0, 1]")
    void testComplexity() {
        FeatureEncoder encoder = new FeatureEncoder();
        assertEquals(0.0, net.complexity(new float[128]));
        for (String w : new String[]{"a", "apple", "extraordinarily"}) {
            double c = net.complexity(encoder.encode(w));
            assertTrue(c > 0.0 && c <= 1.0, w + " -> " + c);
        }
    }

    @Test
    @DisplayName("generated neurons are deterministic per pattern")
    void testGenerateNeurons() {
        float[] pattern = new FeatureEncoder().encode("apple");
        List<NeuronProperties> a = net.generateNeurons(pattern, 10);
        List<NeuronProperties> b = net.generateNeurons(pattern, 10);

        assertEquals(10, a.size());
        for (int i = 0; i < 10; i++) {
            NeuronProperties p = a.get(i);
            assertEquals(i, p.getIndex());
            assertEquals(p.getActivationThreshold(), b.get(i).getActivationThreshold());
            assertEquals(p.getRole(), b.get(i).getRole());
            assertTrue(p.getActivationThreshold() >= 0.3 && p.getActivationThreshold() < 0.7);
            assertTrue(p.getDecayRate() >= 0.9 && p.getDecayRate() < 0.99);
        }
        assertEquals(NeuronRole.INPUT_RECEIVER, a.get(0).getRole());
        assertEquals(NeuronRole.OUTPUT_GENERATOR, a.get(9).getRole());
    }
}
