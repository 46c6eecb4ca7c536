package com.taskforest.core.model;

import java.util.List;

/**
 * Outcome of validating one proposed parent edge.
 *
 * @param accepted true when no rule rejected the edge
 * @param reasons  every failing rule; empty when accepted
 */
public record ValidationResult(
    boolean accepted,
    List<RejectionReason> reasons
) {

    private static final ValidationResult ACCEPTED = new ValidationResult(true, List.of());

    public ValidationResult {
        reasons = List.copyOf(reasons);
    }

    public static ValidationResult ok() {
        return ACCEPTED;
    }

    public static ValidationResult rejected(List<RejectionReason> reasons) {
        if (reasons.isEmpty()) {
            throw new IllegalArgumentException("A rejection needs at least one reason");
        }
        return new ValidationResult(false, reasons);
    }

    public boolean rejectedFor(RejectionReason reason) {
        return reasons.contains(reason);
    }
}
