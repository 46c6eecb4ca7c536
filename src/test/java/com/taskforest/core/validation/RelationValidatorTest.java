package com.taskforest.core.validation;

import com.taskforest.core.model.RejectionReason;
import com.taskforest.core.model.TaskSkeleton;
import com.taskforest.core.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelationValidatorTest {

    private final RelationValidator validator = new RelationValidator();

    private static TaskSkeleton task(String id, String workspace, String createdAt, String parent) {
        return TaskSkeleton.of(id, workspace, createdAt, parent, null, null);
    }

    @Test
    @DisplayName("accepts an earlier parent in the same workspace")
    void accepts() {
        var parent = task("P", "/w", "2025-03-01T09:00:00Z", null);
        var child = task("C", "/w", "2025-03-01T10:00:00Z", null);
        ValidationResult r = validator.validate("P", child, ParentGraph.of(List.of(parent, child)));
        assertTrue(r.accepted());
        assertTrue(r.reasons().isEmpty());
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("self reference")
        void selfReference() {
            var child = task("C", "/w", null, null);
            ValidationResult r = validator.validate("C", child, ParentGraph.of(List.of(child)));
            assertEquals(List.of(RejectionReason.SELF_REFERENCE), r.reasons());
        }

        @Test
        @DisplayName("cycle through an existing ancestor chain")
        void cycle() {
            var a = task("A", "/w", null, "B");
            var b = task("B", "/w", null, null);
            ValidationResult r = validator.validate("A", b, ParentGraph.of(List.of(a, b)));
            assertEquals(List.of(RejectionReason.CYCLE), r.reasons());
        }

        @Test
        @DisplayName("parent created after child")
        void temporal() {
            var parent = task("P", "/w", "2025-03-01T12:00:00Z", null);
            var child = task("C", "/w", "2025-03-01T10:00:00Z", null);
            ValidationResult r = validator.validate("P", child, ParentGraph.of(List.of(parent, child)));
            assertEquals(List.of(RejectionReason.TEMPORAL), r.reasons());
        }

        @Test
        @DisplayName("different workspaces")
        void workspace() {
            var parent = task("P", "/w1", null, null);
            var child = task("C", "/w2", null, null);
            ValidationResult r = validator.validate("P", child, ParentGraph.of(List.of(parent, child)));
            assertEquals(List.of(RejectionReason.WORKSPACE), r.reasons());
        }

        @Test
        @DisplayName("all failing rules are reported together")
        void multipleReasons() {
            var parent = task("P", "/w1", "2025-03-01T12:00:00Z", "C");
            var child = task("C", "/w2", "2025-03-01T10:00:00Z", null);
            ValidationResult r = validator.validate("P", child, ParentGraph.of(List.of(parent, child)));
            assertEquals(List.of(RejectionReason.CYCLE, RejectionReason.TEMPORAL, RejectionReason.WORKSPACE),
                    r.reasons());
        }
    }

    @Nested
    @DisplayName("lenient inputs")
    class Lenient {

        @Test
        @DisplayName("a parent absent from the task set never blocks")
        void absentParent() {
            var child = task("C", "/w", "2025-03-01T10:00:00Z", "ghost");
            ValidationResult r = validator.validate("ghost", child, ParentGraph.of(List.of(child)));
            assertTrue(r.accepted());
            assertTrue(r.reasons().isEmpty());
        }

        @Test
        @DisplayName("unparsable timestamps never block")
        void unparsableTimestamps() {
            var parent = task("P", "/w", "not a date", null);
            var child = task("C", "/w", "2025-03-01T10:00:00Z", null);
            assertTrue(validator.validate("P", child, ParentGraph.of(List.of(parent, child))).accepted());
        }

        @Test
        @DisplayName("a missing workspace on either side never blocks")
        void missingWorkspace() {
            var parent = task("P", null, null, null);
            var child = task("C", "/w", null, null);
            assertTrue(validator.validate("P", child, ParentGraph.of(List.of(parent, child))).accepted());
        }
    }
}
