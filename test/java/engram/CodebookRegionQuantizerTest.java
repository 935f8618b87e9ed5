package engram;

import engram.internal.Distance;
import org.greymatter.engram.CodebookMismatchException;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CodebookRegionQuantizer")
class CodebookRegionQuantizerTest {

    private final FeatureEncoder encoder = new FeatureEncoder();

    private CodebookRegionQuantizer quantizer() {
        return new CodebookRegionQuantizer(64, 128, 0.25f, 0.99f, 42L);
    }

    @Test
    @DisplayName("assign trains the winning code toward the vector")
    void testAssignMovesCode() {
        CodebookRegionQuantizer q = quantizer();
        float[] v = encoder.encode("apple");
        int code = q.nearestCodes(v, 1)[0];
        double before = Distance.euclideanSquared(v, q.codeVector(code));

        String region = q.assign(v);

        assertEquals(CodebookRegionQuantizer.codeName(code), region);
        double after = Distance.euclideanSquared(v, q.codeVector(code));
        assertTrue(after < before, "code should move toward the vector");
        assertEquals(1, q.totalEncodings());
        assertTrue(q.isAdaptive());
    }

    @Test
    @DisplayName("repeated vectors land in the same region")
    void testStableAssignment() {
        CodebookRegionQuantizer q = quantizer();
        float[] v = encoder.encode("apple");
        String first = q.assign(v);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, q.assign(v));
        }
    }

    @Test
    @DisplayName("nearest is read-only and starts with the closest code")
    void testNearestIsPure() {
        CodebookRegionQuantizer q = quantizer();
        float[] v = encoder.encode("zebra");
        CodebookSnapshot before = q.exportSnapshot();

        List<String> nearest = q.nearest(v, 5);

        assertEquals(5, nearest.size());
        assertEquals(5, new HashSet<>(nearest).size());
        assertEquals(CodebookRegionQuantizer.codeName(q.nearestCodes(v, 1)[0]), nearest.get(0));
        assertEquals(0, q.totalEncodings());
        assertArrayEquals(before.getCodebook()[0], q.codeVector(0));
    }

    @Test
    @DisplayName("zero vector is assigned without training or NaNs")
    void testZeroVector() {
        CodebookRegionQuantizer q = quantizer();
        float[] zero = new float[128];
        int code = q.nearestCodes(zero, 1)[0];
        float[] before = q.codeVector(code);

        assertEquals(CodebookRegionQuantizer.codeName(code), q.assign(zero));
        assertArrayEquals(before, q.codeVector(code));
        for (float f : q.codeVector(code)) {
            assertFalse(Float.isNaN(f));
        }
    }

    @Test
    @DisplayName("wrong vector length is rejected")
    void testDimensionCheck() {
        assertThrows(IllegalArgumentException.class, () -> quantizer().assign(new float[10]));
    }

    @Nested
    @DisplayName("Statistics")
    class StatsTest {

        @Test
        @DisplayName("usage, perplexity and commitment loss are tracked")
        void testStats() {
            CodebookRegionQuantizer q = quantizer();
            q.assign(encoder.encode("apple"));
            q.assign(encoder.encode("zebra"));
            q.assign(encoder.encode("apple"));

            QuantizerStats stats = q.stats().orElseThrow();
            assertEquals(64, stats.getCodebookSize());
            assertEquals(3, stats.getTotalEncodings());
            assertTrue(stats.getActiveCodes() >= 1 && stats.getActiveCodes() <= 2);
            assertTrue(stats.getPerplexity() >= 1.0);
            assertTrue(stats.getMeanCommitmentLoss() > 0.0);
            assertTrue(stats.getUtilization() > 0.0 && stats.getUtilization() <= 1.0);
        }

        @Test
        @DisplayName("resetStats clears counters but keeps the codebook")
        void testResetStats() {
            CodebookRegionQuantizer q = quantizer();
            float[] v = encoder.encode("apple");
            String region = q.assign(v);
            q.resetStats();

            assertEquals(0, q.totalEncodings());
            assertEquals(0, q.stats().orElseThrow().getActiveCodes());
            assertEquals(region, q.nearest(v, 1).get(0));
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTest {

        @Test
        @DisplayName("import restores the exported state")
        void testExportImport() {
            CodebookRegionQuantizer trained = quantizer();
            trained.assign(encoder.encode("apple"));
            trained.assign(encoder.encode("banana"));

            CodebookRegionQuantizer fresh = quantizer();
            fresh.importSnapshot(trained.exportSnapshot());

            for (int i = 0; i < 64; i++) {
                assertArrayEquals(trained.codeVector(i), fresh.codeVector(i));
            }
            assertEquals(trained.totalEncodings(), fresh.totalEncodings());
            float[] v = encoder.encode("banana");
            assertEquals(trained.nearest(v, 3), fresh.nearest(v, 3));
        }

        @Test
        @DisplayName("a snapshot of another shape is refused")
        void testMismatch() {
            CodebookSnapshot small = new CodebookRegionQuantizer(8, 128, 0.25f, 0.99f, 1L).exportSnapshot();
            CodebookMismatchException e = assertThrows(CodebookMismatchException.class,
                () -> quantizer().importSnapshot(small));
            assertEquals(64, e.getExpectedCodes());
            assertEquals(8, e.getActualCodes());
        }
    }
}
