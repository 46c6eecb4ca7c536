package com.taskforest.core.model;

/**
 * Policy for where parent ids may come from.
 * <p>
 * METADATA_ONLY: parents come only from persisted metadata; invalid ones are cleared, nothing is inferred.
 * MATCHING_ENABLED: orphans are additionally matched against declared sub-instructions.
 * EXACT_PREFIX: orphans are matched only when their opening instruction hits a declared
 * instruction exactly at one of the index cut lengths; such matches carry confidence 1.
 */
public enum ReconstructionMode {
    METADATA_ONLY,
    MATCHING_ENABLED,
    EXACT_PREFIX
}
