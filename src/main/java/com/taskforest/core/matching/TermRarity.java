package com.taskforest.core.matching;

import com.taskforest.core.index.InstructionIndex;

/**
 * Per-token weight for the lexical component. Rare tokens weigh more.
 */
@FunctionalInterface
public interface TermRarity {

    double weight(String token);

    static TermRarity uniform() {
        return token -> 1.0;
    }

    /**
     * {@code ln(1 + N / (1 + df))} over the index's current entries. A heuristic
     * inverse document frequency, recomputed on every call.
     */
    static TermRarity of(InstructionIndex index) {
        return token -> Math.log(1.0 + (double) index.entryCount() / (1.0 + index.documentFrequency(token)));
    }
}
