package engram;

import java.util.Locale;

/**
 * Codebook utilization snapshot of a {@link CodebookRegionQuantizer}.
 *
 * <p>Perplexity is {@code exp(entropy)} of the code usage distribution, i.e. the
 * effective number of codes in use.
 */
public final class QuantizerStats {

    private final int codebookSize;
    private final int dimensions;
    private final int activeCodes;
    private final long totalEncodings;
    private final double perplexity;
    private final int mostUsedCode;
    private final long mostUsedCount;
    private final int leastUsedCode;
    private final long leastUsedCount;
    private final double lastCommitmentLoss;
    private final double meanCommitmentLoss;

    QuantizerStats(int codebookSize, int dimensions, int activeCodes, long totalEncodings,
                   double perplexity, int mostUsedCode, long mostUsedCount,
                   int leastUsedCode, long leastUsedCount,
                   double lastCommitmentLoss, double meanCommitmentLoss) {
        this.codebookSize = codebookSize;
        this.dimensions = dimensions;
        this.activeCodes = activeCodes;
        this.totalEncodings = totalEncodings;
        this.perplexity = perplexity;
        this.mostUsedCode = mostUsedCode;
        this.mostUsedCount = mostUsedCount;
        this.leastUsedCode = leastUsedCode;
        this.leastUsedCount = leastUsedCount;
        this.lastCommitmentLoss = lastCommitmentLoss;
        this.meanCommitmentLoss = meanCommitmentLoss;
    }

    public int getCodebookSize() { return codebookSize; }
    public int getDimensions() { return dimensions; }
    public int getActiveCodes() { return activeCodes; }
    public long getTotalEncodings() { return totalEncodings; }
    public double getPerplexity() { return perplexity; }
    public int getMostUsedCode() { return mostUsedCode; }
    public long getMostUsedCount() { return mostUsedCount; }
    public int getLeastUsedCode() { return leastUsedCode; }
    public long getLeastUsedCount() { return leastUsedCount; }
    public double getLastCommitmentLoss() { return lastCommitmentLoss; }
    public double getMeanCommitmentLoss() { return meanCommitmentLoss; }

    /** Fraction of codes used at least once. */
    public double getUtilization() {
        return codebookSize == 0 ? 0.0 : (double) activeCodes / codebookSize;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "QuantizerStats{codes=%d, active=%d, encodings=%d, perplexity=%.2f, utilization=%.3f, meanLoss=%.4f}",
            codebookSize, activeCodes, totalEncodings, perplexity, getUtilization(), meanCommitmentLoss);
    }
}
