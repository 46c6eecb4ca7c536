package com.taskforest.core.model;

/**
 * How instruction indexes are laid out across workspaces.
 * <p>
 * PER_WORKSPACE: one pass and one index per workspace; passes may run concurrently.
 * SHARED: a single pass over every task with one index whose entries are tagged by workspace.
 */
public enum IndexScope {
    PER_WORKSPACE,
    SHARED
}
