package org.greymatter.engram;

import java.util.Collections;
import java.util.List;

/**
 * Result of {@link EngramMemory#verifyIntegrity(int)}.
 */
public final class IntegrityReport {

    private final int checked;
    private final List<String> mismatches;

    IntegrityReport(int checked, List<String> mismatches) {
        this.checked = checked;
        this.mismatches = Collections.unmodifiableList(mismatches);
    }

    /** Clusters compared against storage. */
    public int getChecked() { return checked; }

    /** One line per cluster whose stored membership differs from memory. */
    public List<String> getMismatches() { return mismatches; }

    public boolean isConsistent() { return mismatches.isEmpty(); }

    @Override
    public String toString() {
        return "IntegrityReport{checked=" + checked + ", mismatches=" + mismatches + '}';
    }
}
