package org.greymatter.engram;

/**
 * Thrown when a codebook snapshot doesn't match the configured quantizer shape.
 */
public class CodebookMismatchException extends EngramException {

    private final int expectedCodes;
    private final int actualCodes;
    private final int expectedDimensions;
    private final int actualDimensions;

    /**
     * Create a new codebook mismatch exception.
     *
     * @param expectedCodes configured code count
     * @param actualCodes code count found in the snapshot
     * @param expectedDimensions configured vector length
     * @param actualDimensions vector length found in the snapshot
     */
    public CodebookMismatchException(int expectedCodes, int actualCodes,
                                     int expectedDimensions, int actualDimensions) {
        super("Codebook mismatch: expected " + expectedCodes + "x" + expectedDimensions
              + ", got " + actualCodes + "x" + actualDimensions);
        this.expectedCodes = expectedCodes;
        this.actualCodes = actualCodes;
        this.expectedDimensions = expectedDimensions;
        this.actualDimensions = actualDimensions;
    }

    public int getExpectedCodes() {
        return expectedCodes;
    }

    public int getActualCodes() {
        return actualCodes;
    }

    public int getExpectedDimensions() {
        return expectedDimensions;
    }

    public int getActualDimensions() {
        return actualDimensions;
    }
}
