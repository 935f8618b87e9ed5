package engram;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Legacy locality-sensitive hashing quantizer.
 *
 * <p>Each of {@code bands} bands holds {@code rowsPerBand} random unit hyperplanes
 * generated once from a fixed seed. A band hash is the sign pattern of the
 * projections; the region code is the band hashes rendered as four hex digits
 * and joined with {@code '_'}. Similar vectors agree on most bands.
 *
 * <p>Non-adaptive: identical input always yields the identical code.
 */
public final class LshRegionQuantizer implements RegionQuantizer {

    private final int dimensions;
    private final int bands;
    private final int rowsPerBand;
    private final double[][][] hyperplanes; // [band][row][dim]

    public LshRegionQuantizer(int dimensions, int bands, int rowsPerBand, long seed) {
        if (rowsPerBand < 1 || rowsPerBand > 16) {
            throw new IllegalArgumentException("rowsPerBand must be in [1, 16], got " + rowsPerBand);
        }
        this.dimensions = dimensions;
        this.bands = bands;
        this.rowsPerBand = rowsPerBand;
        this.hyperplanes = new double[bands][rowsPerBand][];

        Random rng = new Random(seed);
        for (int b = 0; b < bands; b++) {
            for (int r = 0; r < rowsPerBand; r++) {
                hyperplanes[b][r] = randomUnitVector(rng, dimensions);
            }
        }
    }

    @Override
    public String assign(float[] vector) {
        return regionOf(bandHashes(vector), -1);
    }

    /**
     * The primary region followed by regions that differ from it in the low bit
     * of one band, in band order.
     */
    @Override
    public List<String> nearest(float[] vector, int k) {
        int[] hashes = bandHashes(vector);
        Set<String> regions = new LinkedHashSet<>();
        regions.add(regionOf(hashes, -1));
        for (int b = 0; b < bands && regions.size() < k; b++) {
            regions.add(regionOf(hashes, b));
        }
        List<String> result = new ArrayList<>(regions);
        return result.size() > k ? result.subList(0, Math.max(0, k)) : result;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public boolean isAdaptive() {
        return false;
    }

    public int bands() {
        return bands;
    }

    public int rowsPerBand() {
        return rowsPerBand;
    }

    private int[] bandHashes(float[] vector) {
        if (vector.length != dimensions) {
            throw new IllegalArgumentException(
                "Expected " + dimensions + "-dim vector, got " + vector.length);
        }
        int[] hashes = new int[bands];
        for (int b = 0; b < bands; b++) {
            int hash = 0;
            for (int r = 0; r < rowsPerBand; r++) {
                double[] plane = hyperplanes[b][r];
                double projection = 0.0;
                for (int i = 0; i < dimensions; i++) {
                    projection += vector[i] * plane[i];
                }
                hash = (hash << 1) | (projection > 0 ? 1 : 0);
            }
            hashes[b] = hash;
        }
        return hashes;
    }

    private String regionOf(int[] hashes, int flipBand) {
        StringBuilder sb = new StringBuilder(bands * 5);
        for (int b = 0; b < bands; b++) {
            if (b > 0) sb.append('_');
            int h = b == flipBand ? hashes[b] ^ 0x1 : hashes[b];
            sb.append(String.format(Locale.ROOT, "%04X", h));
        }
        return sb.toString();
    }

    private static double[] randomUnitVector(Random rng, int dimensions) {
        double[] v = new double[dimensions];
        double norm = 0.0;
        for (int i = 0; i < dimensions; i++) {
            v[i] = rng.nextGaussian();
            norm += v[i] * v[i];
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < dimensions; i++) {
            v[i] /= norm;
        }
        return v;
    }
}
