package com.taskforest.core.model;

/**
 * One declared sub-instruction stored in the instruction index.
 *
 * @param normalizedPrefix bounded, case-folded, whitespace-collapsed form used as the tree key
 * @param ownerTaskId      the task that declared the instruction
 * @param originalText     the instruction as extracted, before normalization
 * @param ownerWorkspace   workspace of the owner, used to tag entries in a shared index (nullable)
 */
public record IndexedInstruction(
    String normalizedPrefix,
    String ownerTaskId,
    String originalText,
    String ownerWorkspace
) {}
