package engram;

import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Neuron")
class NeuronTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Neuron neuron() {
        return new Neuron("c/n0", new NeuronProperties(0, 0.5, 0.95, NeuronRole.INTEGRATOR), T0);
    }

    @Test
    @DisplayName("a fresh neuron rests and does not fire")
    void testFreshNeuron() {
        Neuron n = neuron();
        assertEquals(0.0, n.process(Map.of(1, 1.0), T0));
        assertEquals(Neuron.RESTING_POTENTIAL, n.getCurrentPotential(), 1e-9);
        assertEquals(0, n.getActivationCount());
        assertEquals(0.0, n.activationAboveRest());
    }

    @Test
    @DisplayName("initialized weights make the first presentation fire")
    void testInitializeAndFire() {
        Neuron n = neuron();
        assertTrue(n.initializeWeights(List.of(1, 2), new Random(1)));
        assertFalse(n.initializeWeights(List.of(3), new Random(1)), "only untrained neurons initialize");
        for (double w : n.getWeights().values()) {
            assertTrue(w >= 1.5 && w < 4.5);
        }

        double out = n.process(Map.of(1, 1.0, 2, 0.7), T0.plusSeconds(1));
        assertTrue(out > 0.0 && out < 1.0);
        assertTrue(n.isFiring(out));
        assertEquals(1, n.getActivationCount());
        assertTrue(n.activationAboveRest() > 1.0);
        assertTrue(n.getImportance() > 0.0);
        assertEquals(T0.plusSeconds(1), n.getLastUsed());
    }

    @Test
    @DisplayName("delta rule moves the weight toward the target")
    void testLearn() {
        Neuron n = neuron();
        n.learn(7, 1.0, 1.0, 0.0);
        assertEquals(Neuron.DEFAULT_LEARNING_RATE, n.getWeights().get(7), 1e-12);
        n.learn(7, 1.0, 0.0, 1.0);
        assertEquals(0.0, n.getWeights().get(7), 1e-12);
    }

    @Test
    @DisplayName("non-finite inputs never leave a non-finite weight or potential")
    void testNonFiniteInputs() {
        Neuron n = neuron();
        n.initializeWeights(List.of(1, 2), new Random(1));
        double before = n.getWeights().get(1);

        n.learn(1, Double.NaN, 1.0, 0.0);
        n.learn(2, Double.POSITIVE_INFINITY, 1.0, 0.0);
        n.learn(3, Double.NEGATIVE_INFINITY, 1.0, 0.0);
        assertEquals(before, n.getWeights().get(1).doubleValue());
        assertFalse(n.getWeights().containsKey(3));
        n.learn(2, Double.MAX_VALUE, 10.0, 0.0);
        n.learn(2, Double.MAX_VALUE, 10.0, 0.0);
        assertEquals(Double.MAX_VALUE, n.getWeights().get(2).doubleValue(), "overflow clamps");
        for (double w : n.getWeights().values()) {
            assertTrue(Double.isFinite(w), "weight " + w);
        }

        double out = n.process(Map.of(1, 1.0, 2, Double.NaN), T0.plusSeconds(1));
        assertTrue(n.isFiring(out));
        assertTrue(Double.isFinite(n.getCurrentPotential()));
        assertTrue(Double.isFinite(n.activationAboveRest()));
    }

    @Test
    @DisplayName("pruneWeights drops small magnitudes")
    void testPrune() {
        Neuron n = neuron();
        n.learn(1, 1.0, 1.0, 0.0);   // 0.1
        n.learn(2, 0.1, 1.0, 0.0);   // 0.01
        assertEquals(1, n.pruneWeights(0.05));
        assertEquals(Set.of(1), n.getWeights().keySet());
    }

    @Test
    @DisplayName("concepts are case-insensitive")
    void testConcepts() {
        Neuron n = neuron();
        n.associateConcept("Apple");
        assertTrue(n.hasConcept("APPLE"));
        assertEquals(Set.of("apple"), n.getConcepts());
    }
}
