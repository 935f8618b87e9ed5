package engram;

import org.greymatter.engram.StorageException;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NeuronCluster")
class NeuronClusterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final FeatureEncoder encoder = new FeatureEncoder();
    private final NeuronHypernetwork hypernetwork = new NeuronHypernetwork(20, 100, 50, 5, 500, 42L);

    private NeuronCluster newCluster() {
        return new NeuronCluster("cl-000001", "apple", "vq001", 3, id -> Optional.empty(), T0);
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTest {

        @Test
        @DisplayName("without a centroid the region prior is reported")
        void testPrior() {
            NeuronCluster c = newCluster();
            float[] v = encoder.encode("apple");
            assertEquals(NeuronCluster.SAME_REGION_PRIOR, c.similarity(v, "vq001"));
            assertEquals(NeuronCluster.OTHER_REGION_PRIOR, c.similarity(v, "vq002"));
            assertTrue(c.getCentroid().isEmpty());
        }

        @Test
        @DisplayName("repeating the same vector leaves the centroid unchanged")
        void testCentroidIdempotent() {
            NeuronCluster c = newCluster();
            float[] v = encoder.encode("apple");
            c.updateCentroid(v);
            c.updateCentroid(v);
            c.updateCentroid(v);

            assertArrayEquals(v, c.getCentroid().orElseThrow(), 1e-6f);
            assertEquals(3, c.getCentroidSamples());
            assertEquals(1.0, c.similarity(v, "other"), 1e-6);
        }

        @Test
        @DisplayName("similarity is never negative")
        void testNonNegative() {
            NeuronCluster c = newCluster();
            float[] v = encoder.encode("apple");
            c.updateCentroid(v);
            float[] opposite = v.clone();
            for (int i = 0; i < opposite.length; i++) opposite[i] = -opposite[i];
            assertEquals(0.0, c.similarity(opposite, "vq001"));
        }

        @Test
        @DisplayName("relevance is the shared share of the larger concept set")
        void testRelevance() {
            NeuronCluster c = newCluster();
            float[] v = encoder.encode("apple");
            c.growTo(2, "apple", hypernetwork.generateNeurons(v, 2), T0);
            c.growTo(4, "fruit", hypernetwork.generateNeurons(v, 2), T0);
            assertEquals(1.0, c.relevance(List.of("APPLE", "fruit")), 1e-12);
            assertEquals(0.5, c.relevance(List.of("apple")), 1e-12);
            assertEquals(0.0, c.relevance(List.of()), 1e-12);
        }
    }

    @Nested
    @DisplayName("Membership")
    class MembershipTest {

        @Test
        @DisplayName("growTo creates only the delta above the current size")
        void testGrowDelta() {
            NeuronCluster c = newCluster();
            float[] v = encoder.encode("apple");
            List<Neuron> first = c.growTo(5, "apple", hypernetwork.generateNeurons(v, 5), T0);
            List<Neuron> none = c.growTo(3, "apple", hypernetwork.generateNeurons(v, 3), T0);
            List<Neuron> more = c.growTo(8, "apple", hypernetwork.generateNeurons(v, 3), T0);

            assertEquals(5, first.size());
            assertTrue(none.isEmpty());
            assertEquals(3, more.size());
            assertEquals(8, c.size());
            assertEquals("cl-000001/n0", first.get(0).getId());
            assertEquals("cl-000001/n7", more.get(2).getId());
            assertTrue(more.get(0).getWeights().isEmpty());
            assertEquals(8, c.findNeuronsByConcept("Apple").size());
            assertTrue(c.getConcepts().contains("apple"));
        }

        @Test
        @DisplayName("process reports outputs of firing neurons only")
        void testProcess() {
            NeuronCluster c = newCluster();
            float[] v = encoder.encode("apple");
            List<Neuron> created = c.growTo(3, "apple", hypernetwork.generateNeurons(v, 3), T0);
            created.get(0).initializeWeights(List.of(1), new Random(3));

            Map<String, Double> outputs = c.process(Map.of(1, 1.0), T0.plusSeconds(5));
            assertEquals(Set.of(created.get(0).getId()), outputs.keySet());
            assertEquals(T0.plusSeconds(5), c.getLastAccessed());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTest {

        @Test
        @DisplayName("indexed clusters hydrate lazily through the loader")
        void testLazyHydration() {
            AtomicInteger loads = new AtomicInteger();
            Neuron stored = new Neuron("cl-000009/n0",
                new NeuronProperties(0, 0.5, 0.95, NeuronRole.INPUT_RECEIVER), T0);
            NeuronCluster c = new NeuronCluster("cl-000009", "pear", "vq004", 1, null, 0L,
                Set.of("pear"), 1, 1L, T0, T0, id -> {
                    loads.incrementAndGet();
                    return Optional.of(List.of(stored));
                });

            assertFalse(c.isLoaded());
            assertEquals(1, c.size());
            assertEquals(0, loads.get());

            assertEquals(1, c.neurons().size());
            c.neurons();
            assertTrue(c.isLoaded());
            assertEquals(1, loads.get());
            assertFalse(c.hasUnsavedChanges());
        }

        @Test
        @DisplayName("loader failures propagate to the caller")
        void testLoaderFailure() {
            NeuronCluster c = new NeuronCluster("cl-000010", "x", "vq0", 0, null, 0L, Set.of(), 4, 4L, T0, T0,
                id -> { throw new StorageException("corrupt bank"); });
            assertThrows(StorageException.class, c::ensureLoaded);
            assertFalse(c.isLoaded());
        }

        @Test
        @DisplayName("dirty clusters refuse to unload until saved")
        void testUnload() {
            NeuronCluster c = newCluster();
            c.growTo(2, "apple", hypernetwork.generateNeurons(encoder.encode("apple"), 2), T0);
            assertTrue(c.hasUnsavedChanges());
            assertThrows(IllegalStateException.class, c::unload);

            c.markSaved();
            c.unload();
            assertFalse(c.isLoaded());
            assertEquals(2, c.size());
        }

        @Test
        @DisplayName("idle clusters stop asking to stay loaded")
        void testIdle() {
            NeuronCluster c = newCluster();
            Duration idle = Duration.ofMinutes(30);
            assertTrue(c.shouldStayLoaded(T0.plus(Duration.ofMinutes(29)), idle));
            assertFalse(c.shouldStayLoaded(T0.plus(Duration.ofMinutes(31)), idle));
            c.touch(T0.plus(Duration.ofMinutes(30)));
            assertTrue(c.shouldStayLoaded(T0.plus(Duration.ofMinutes(31)), idle));
        }
    }
}
