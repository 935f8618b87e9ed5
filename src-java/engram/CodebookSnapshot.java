package engram;

/**
 * Complete learnable state of a {@link CodebookRegionQuantizer}: code vectors,
 * EMA accumulators and usage counters.
 *
 * <p>Arrays are owned by the snapshot; {@link CodebookRegionQuantizer#exportSnapshot()}
 * hands out copies and {@link CodebookRegionQuantizer#importSnapshot(CodebookSnapshot)}
 * copies in.
 */
public final class CodebookSnapshot {

    private final float commitment;
    private final float emaDecay;
    private final float[][] codebook;
    private final float[] emaClusterSize;
    private final float[][] emaCodebookSum;
    private final long[] usageCounts;
    private final long totalEncodings;

    public CodebookSnapshot(float commitment, float emaDecay, float[][] codebook,
                            float[] emaClusterSize, float[][] emaCodebookSum,
                            long[] usageCounts, long totalEncodings) {
        if (codebook.length != emaClusterSize.length
                || codebook.length != emaCodebookSum.length
                || codebook.length != usageCounts.length) {
            throw new IllegalArgumentException("Codebook snapshot arrays disagree on code count");
        }
        this.commitment = commitment;
        this.emaDecay = emaDecay;
        this.codebook = codebook;
        this.emaClusterSize = emaClusterSize;
        this.emaCodebookSum = emaCodebookSum;
        this.usageCounts = usageCounts;
        this.totalEncodings = totalEncodings;
    }

    public int getCodebookSize() { return codebook.length; }
    public int getDimensions() { return codebook.length == 0 ? 0 : codebook[0].length; }
    public float getCommitment() { return commitment; }
    public float getEmaDecay() { return emaDecay; }
    public float[][] getCodebook() { return codebook; }
    public float[] getEmaClusterSize() { return emaClusterSize; }
    public float[][] getEmaCodebookSum() { return emaCodebookSum; }
    public long[] getUsageCounts() { return usageCounts; }
    public long getTotalEncodings() { return totalEncodings; }
}
