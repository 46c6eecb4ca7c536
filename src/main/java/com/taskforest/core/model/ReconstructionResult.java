package com.taskforest.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of a reconstruction run: the skeletons in input order with hierarchy fields
 * updated, plus the diagnostics and counters collected along the way.
 */
public record ReconstructionResult(
    List<TaskSkeleton> skeletons,
    List<HierarchyDiagnostic> diagnostics,
    ReconstructionStats stats
) {

    public ReconstructionResult {
        // null inputs are passed through in place
        skeletons = Collections.unmodifiableList(new ArrayList<>(skeletons));
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<TaskSkeleton> find(String taskId) {
        return skeletons.stream()
                .filter(s -> s != null && Objects.equals(s.taskId(), taskId))
                .findFirst();
    }

    public List<HierarchyDiagnostic> diagnosticsFor(String taskId) {
        return diagnostics.stream()
                .filter(d -> Objects.equals(d.taskId(), taskId))
                .toList();
    }

    /** The state given by the last decision recorded for the task. */
    public Optional<SkeletonState> stateOf(String taskId) {
        SkeletonState state = null;
        for (HierarchyDiagnostic d : diagnostics) {
            if (Objects.equals(d.taskId(), taskId)) {
                state = d.decision().state();
            }
        }
        return Optional.ofNullable(state);
    }

    /** Inputs the upstream loader produced in violation of the skeleton contract. */
    public List<HierarchyDiagnostic> contractViolations() {
        return diagnostics.stream()
                .filter(d -> d.decision() == HierarchyDiagnostic.Decision.MALFORMED)
                .toList();
    }

    public List<TaskSkeleton> roots() {
        return skeletons.stream()
                .filter(Objects::nonNull)
                .filter(s -> !s.hasParent())
                .toList();
    }

    public List<TaskSkeleton> childrenOf(String parentId) {
        return skeletons.stream()
                .filter(Objects::nonNull)
                .filter(s -> Objects.equals(s.parentTaskId(), parentId))
                .toList();
    }
}
