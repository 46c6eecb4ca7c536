package com.taskforest.core.model;

/**
 * Per-skeleton progress through one reconstruction pass.
 */
public enum SkeletonState {
    DECLARED,
    VALIDATED,
    INVALIDATED,
    ORPHAN_PENDING,
    MATCHED_VALIDATED,
    ORPHAN_FINAL;

    /** Terminal states carry the pass's final answer for the skeleton. */
    public boolean isTerminal() {
        return this == VALIDATED || this == MATCHED_VALIDATED || this == ORPHAN_FINAL;
    }
}
