package com.taskforest.core.index;

/**
 * Snapshot of an {@link InstructionIndex}.
 *
 * @param distinctPrefixes      number of distinct normalized keys
 * @param entries               total (owner, prefix) entries
 * @param owners                number of tasks that declared at least one instruction
 * @param radixNodes            nodes in the backing tree, root included
 * @param averageOwnersPerPrefix entries divided by distinct keys
 */
public record IndexStats(
    int distinctPrefixes,
    int entries,
    int owners,
    int radixNodes,
    double averageOwnersPerPrefix
) {}
