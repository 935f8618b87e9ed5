package engram;

import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ActivationStats")
class ActivationStatsTest {

    private final FeatureEncoder encoder = new FeatureEncoder();

    @Nested
    @DisplayName("Novelty")
    class NoveltyTest {

        @Test
        @DisplayName("an unseen region is fully novel")
        void testUnseenRegion() {
            ActivationStats stats = new ActivationStats(32, 10.0);
            assertEquals(1.0, stats.calculateNovelty("vq001", encoder.encode("apple")));
        }

        @Test
        @DisplayName("repeating the same vector drives novelty toward zero")
        void testRepetitionLowersNovelty() {
            ActivationStats stats = new ActivationStats(32, 10.0);
            float[] v = encoder.encode("apple");
            double previous = 1.0;
            for (int i = 0; i < 20; i++) {
                stats.recordActivation("vq001", v);
                double novelty = stats.calculateNovelty("vq001", v);
                assertTrue(novelty >= 0.0);
                assertTrue(novelty <= previous, "novelty should not increase");
                previous = novelty;
            }
            assertTrue(previous < 0.05, "novelty after 20 repeats was " + previous);
        }

        @Test
        @DisplayName("a far vector is more novel than the familiar one")
        void testDistantVector() {
            ActivationStats stats = new ActivationStats(32, 10.0);
            float[] apple = encoder.encode("apple");
            for (int i = 0; i < 5; i++) {
                stats.recordActivation("vq001", apple);
            }
            assertTrue(stats.calculateNovelty("vq001", encoder.encode("zebra"))
                       > stats.calculateNovelty("vq001", apple));
        }
    }

    @Test
    @DisplayName("frequency saturates below one")
    void testFrequency() {
        ActivationStats stats = new ActivationStats(4, 10.0);
        assertEquals(0.0, stats.frequency("r"));
        float[] v = encoder.encode("apple");
        stats.recordActivation("r", v);
        double once = stats.frequency("r");
        for (int i = 0; i < 100; i++) {
            stats.recordActivation("r", v);
        }
        assertTrue(once > 0.0);
        assertTrue(stats.frequency("r") > once);
        assertTrue(stats.frequency("r") < 1.0);
        assertEquals(101, stats.count("r"));
        assertEquals(4, stats.history("r").size());
    }

    @Nested
    @DisplayName("Co-activation and summaries")
    class CoactivationTest {

        @Test
        @DisplayName("pairs are counted symmetrically")
        void testPairs() {
            ActivationStats stats = new ActivationStats(8, 10.0);
            stats.recordCoactivation(List.of("b", "a", "c"));
            stats.recordCoactivation(List.of("a", "b"));
            assertEquals(2, stats.coactivationCount("a", "b"));
            assertEquals(2, stats.coactivationCount("b", "a"));
            assertEquals(1, stats.coactivationCount("a", "c"));
            assertEquals(0, stats.coactivationCount("a", "z"));
        }

        @Test
        @DisplayName("topRegions and summary rank by activation count")
        void testTopRegions() {
            ActivationStats stats = new ActivationStats(8, 10.0);
            float[] v = encoder.encode("apple");
            for (int i = 0; i < 3; i++) stats.recordActivation("busy", v);
            stats.recordActivation("quiet", v);

            List<Map.Entry<String, Long>> top = stats.topRegions(5);
            assertEquals(2, top.size());
            assertEquals("busy", top.get(0).getKey());
            assertEquals(3L, top.get(0).getValue());

            ActivationStats.Summary summary = stats.summary();
            assertEquals(4, summary.getTotalActivations());
            assertEquals(2, summary.getUniqueRegions());
            assertEquals("busy", summary.getMostFrequentRegion());
            assertEquals(2.0, summary.getAverageRegionFrequency(), 1e-9);
        }

        @Test
        @DisplayName("merge adds counts; prune and reset drop state")
        void testMergePruneReset() {
            float[] v = encoder.encode("apple");
            ActivationStats a = new ActivationStats(8, 10.0);
            ActivationStats b = new ActivationStats(8, 10.0);
            a.recordActivation("x", v);
            b.recordActivation("x", v);
            b.recordActivation("y", v);
            b.recordCoactivation(List.of("x", "y"));

            a.merge(b);
            assertEquals(2, a.count("x"));
            assertEquals(1, a.count("y"));
            assertEquals(3, a.totalActivations());
            assertEquals(1, a.coactivationCount("x", "y"));

            assertEquals(1, a.prune(2));
            assertEquals(0, a.count("y"));
            assertEquals(0, a.coactivationCount("x", "y"));

            a.reset();
            assertEquals(0, a.regionCount());
            assertEquals(0, a.totalActivations());
        }
    }
}
