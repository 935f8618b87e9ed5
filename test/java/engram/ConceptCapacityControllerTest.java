package engram;

import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConceptCapacityController")
class ConceptCapacityControllerTest {

    private ConceptCapacityController controller() {
        return new ConceptCapacityController(50, 600, 0.05, 0.15, NeuronCountStrategy.HYPERNETWORK);
    }

    @Test
    @DisplayName("first target is seeded, clamped and then memoized")
    void testSeeding() {
        ConceptCapacityController c = controller();
        assertEquals(50, c.targetFor("tiny", Map.of(), () -> 5));
        assertEquals(600, c.targetFor("huge", Map.of(), () -> 10_000));
        assertEquals(120, c.targetFor("apple", Map.of(), () -> 120));
        assertEquals(120, c.targetFor("apple", Map.of(), () -> 300));
        assertEquals(OptionalInt.of(120), c.currentTarget("apple"));
        assertTrue(c.currentTarget("unknown").isEmpty());
    }

    @Test
    @DisplayName("observations inside the hysteresis band leave the target alone")
    void testHysteresis() {
        ConceptCapacityController c = controller();
        c.targetFor("apple", Map.of(), () -> 100);
        assertEquals(100, c.adjust("apple", 110, 1.1));
        assertEquals(100, c.adjust("apple", 90, 0.9));
        assertEquals(0.9, c.lastDemand("apple"));
    }

    @Test
    @DisplayName("sustained drift moves the target by EMA")
    void testDrift() {
        ConceptCapacityController c = controller();
        c.targetFor("apple", Map.of(), () -> 100);
        assertEquals(105, c.adjust("apple", 200, 2.0));
        int target = 105;
        for (int i = 0; i < 50; i++) {
            target = c.adjust("apple", 200, 2.0);
        }
        assertTrue(target > 105 && target <= 200);
    }

    @Test
    @DisplayName("targets stay within bounds after any adjustment sequence")
    void testBounds() {
        ConceptCapacityController c = controller();
        Random rng = new Random(7);
        c.targetFor("x", Map.of(), () -> 300);
        for (int i = 0; i < 1000; i++) {
            int t = c.adjust("x", rng.nextInt(5000) - 1000, rng.nextDouble());
            assertTrue(t >= 50 && t <= 600, "target " + t);
        }
    }

    @Test
    @DisplayName("stochastic strategy ignores the hypernetwork estimate")
    void testStochastic() {
        ConceptCapacityController c =
            new ConceptCapacityController(50, 600, 0.05, 0.15, NeuronCountStrategy.STOCHASTIC);
        Map<String, Double> features = Map.of("fruit", 1.0, "red", 0.7);
        int target = c.targetFor("apple", features, () -> { throw new AssertionError("not used"); });
        assertTrue(target >= 50 && target <= 600);

        ConceptCapacityController again =
            new ConceptCapacityController(50, 600, 0.05, 0.15, NeuronCountStrategy.STOCHASTIC);
        assertEquals(target, again.targetFor("apple", features, () -> 0));
    }

    @Test
    @DisplayName("restore clamps persisted values")
    void testRestore() {
        ConceptCapacityController c = controller();
        c.restore(Map.of("a", 10, "b", 700, "c", 200));
        assertEquals(OptionalInt.of(50), c.currentTarget("a"));
        assertEquals(OptionalInt.of(600), c.currentTarget("b"));
        assertEquals(OptionalInt.of(200), c.currentTarget("c"));
        assertEquals(3, c.size());
    }
}
