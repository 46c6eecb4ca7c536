package com.taskforest.core.model;

import java.io.Serializable;

/**
 * Aggregate counters for one reconstruction run (one pass or several merged).
 */
public record ReconstructionStats(
    int processed,
    int malformed,
    int persistedKept,
    int persistedInvalidated,
    int instructionsIndexed,
    int indexSize,
    int resolvedByMatching,
    int orphans,
    double averageConfidence,
    int cyclesBroken,
    long durationMs
) implements Serializable {

    public static ReconstructionStats empty() {
        return new ReconstructionStats(0, 0, 0, 0, 0, 0, 0, 0, 0.0, 0, 0L);
    }

    /** Sums two stats; the confidence average is weighted by matched counts. */
    public ReconstructionStats plus(ReconstructionStats other) {
        int matched = resolvedByMatching + other.resolvedByMatching;
        double confidence = matched == 0 ? 0.0
                : (averageConfidence * resolvedByMatching + other.averageConfidence * other.resolvedByMatching) / matched;
        return new ReconstructionStats(
                processed + other.processed,
                malformed + other.malformed,
                persistedKept + other.persistedKept,
                persistedInvalidated + other.persistedInvalidated,
                instructionsIndexed + other.instructionsIndexed,
                indexSize + other.indexSize,
                matched,
                orphans + other.orphans,
                confidence,
                cyclesBroken + other.cyclesBroken,
                durationMs + other.durationMs);
    }

    public ReconstructionStats withRunTotals(int malformed, int cyclesBroken, int orphans, long durationMs) {
        return new ReconstructionStats(processed, malformed, persistedKept, persistedInvalidated,
                instructionsIndexed, indexSize, resolvedByMatching, orphans, averageConfidence,
                cyclesBroken, durationMs);
    }
}
