package com.taskforest.core.model;

import java.util.List;

/**
 * Structured record of one hierarchy decision, returned to the caller for observability.
 *
 * @param taskId      the task the decision is about (null when the input had no id)
 * @param workspace   the task's workspace (nullable)
 * @param decision    what the engine decided
 * @param candidateId the parent that was kept, accepted or rejected (nullable)
 * @param reasons     failing validation rules, empty unless something was rejected
 * @param score       match score for matching decisions (nullable)
 * @param detail      free-form context for logs
 */
public record HierarchyDiagnostic(
    String taskId,
    String workspace,
    Decision decision,
    String candidateId,
    List<RejectionReason> reasons,
    Double score,
    String detail
) {

    public HierarchyDiagnostic {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public enum Decision {
        /** Persisted parent passed validation and was kept. */
        VALIDATED,
        /** Persisted parent failed validation and was cleared. */
        INVALIDATED,
        /** Parent inferred from a declared instruction and validated. */
        MATCHED,
        /** A ranked match candidate failed validation. */
        CANDIDATE_REJECTED,
        /** No valid parent established in this pass. */
        ORPHAN,
        /** Input skeleton violated the loader contract and was passed through. */
        MALFORMED,
        /** A cycle spanning passes was broken by clearing this task's parent. */
        CYCLE_BROKEN,
        /** The task's pass failed unexpectedly; the task was passed through unchanged. */
        PASS_FAILED;

        /** State a skeleton is in once this decision has been recorded for it. */
        public SkeletonState state() {
            return switch (this) {
                case VALIDATED -> SkeletonState.VALIDATED;
                case INVALIDATED -> SkeletonState.INVALIDATED;
                case CANDIDATE_REJECTED -> SkeletonState.ORPHAN_PENDING;
                case MATCHED -> SkeletonState.MATCHED_VALIDATED;
                case ORPHAN, CYCLE_BROKEN -> SkeletonState.ORPHAN_FINAL;
                case MALFORMED, PASS_FAILED -> SkeletonState.DECLARED;
            };
        }
    }

    public static HierarchyDiagnostic of(TaskSkeleton skeleton, Decision decision, String candidateId,
                                         List<RejectionReason> reasons, Double score, String detail) {
        return new HierarchyDiagnostic(skeleton.taskId(), skeleton.workspace(), decision, candidateId,
                reasons, score, detail);
    }
}
