package com.taskforest.core.validation;

import com.taskforest.core.model.RejectionReason;
import com.taskforest.core.model.TaskSkeleton;
import com.taskforest.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a proposed parent edge may be accepted.
 * <p>
 * Every applicable rule is evaluated and all failures are reported together.
 * Rejection is an ordinary result, never an exception. Unparsable timestamps,
 * missing workspaces and a parent absent from the task set never block an edge.
 */
public class RelationValidator {

    private static final Logger log = LoggerFactory.getLogger(RelationValidator.class);

    public ValidationResult validate(String parentId, TaskSkeleton child, ParentGraph graph) {
        var reasons = new ArrayList<RejectionReason>();

        if (parentId.equals(child.taskId())) {
            reasons.add(RejectionReason.SELF_REFERENCE);
            return reject(parentId, child, reasons);
        }

        Optional<TaskSkeleton> parent = graph.skeleton(parentId);
        if (parent.isEmpty()) {
            // nothing to check against; the task set may simply not include it
            return ValidationResult.ok();
        }

        if (graph.wouldCreateCycle(child.taskId(), parentId)) {
            reasons.add(RejectionReason.CYCLE);
        }
        reasons.addAll(pairConflicts(parent.get(), child));

        return reasons.isEmpty() ? ValidationResult.ok() : reject(parentId, child, reasons);
    }

    /**
     * Rules that depend only on the two tasks themselves: creation order and workspace.
     */
    public List<RejectionReason> pairConflicts(TaskSkeleton parent, TaskSkeleton child) {
        var reasons = new ArrayList<RejectionReason>(2);
        if (createdAfter(parent, child)) {
            reasons.add(RejectionReason.TEMPORAL);
        }
        if (child.hasWorkspace() && parent.hasWorkspace() && !child.workspace().equals(parent.workspace())) {
            reasons.add(RejectionReason.WORKSPACE);
        }
        return reasons;
    }

    private static boolean createdAfter(TaskSkeleton parent, TaskSkeleton child) {
        Optional<Instant> parentCreated = parent.createdInstant();
        Optional<Instant> childCreated = child.createdInstant();
        return parentCreated.isPresent() && childCreated.isPresent()
                && parentCreated.get().isAfter(childCreated.get());
    }

    private static ValidationResult reject(String parentId, TaskSkeleton child, List<RejectionReason> reasons) {
        log.debug("Rejected parent {} for task {}: {}", parentId, child.taskId(), reasons);
        return ValidationResult.rejected(reasons);
    }
}
