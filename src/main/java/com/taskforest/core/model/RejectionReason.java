package com.taskforest.core.model;

/**
 * Reasons a proposed parent edge can be rejected. Any one is sufficient.
 */
public enum RejectionReason {
    SELF_REFERENCE("task cannot be its own parent"),
    CYCLE("edge would create a cycle"),
    TEMPORAL("parent created after child"),
    WORKSPACE("parent and child belong to different workspaces");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
