package com.taskforest.core.model;

/**
 * How a skeleton's current parent was established.
 */
public enum ResolutionMethod {
    PERSISTED,
    INSTRUCTION_MATCH,
    EXACT_PREFIX
}
