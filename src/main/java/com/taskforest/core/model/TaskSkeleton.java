package com.taskforest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Summary record for one task, independent of its full conversation content.
 * Produced by an upstream loader and annotated with hierarchy fields by the
 * reconstruction engine, which always returns copies.
 *
 * @param taskId                       unique task identifier (required)
 * @param workspace                    isolation boundary, path-like (nullable)
 * @param createdAt                    creation timestamp as stored by the loader (nullable)
 * @param parentTaskId                 parent reference, persisted or reconstructed (nullable)
 * @param reconstructedParentId        set only when the parent was inferred by matching
 * @param truncatedInstruction         the task's own opening instruction, bounded length
 * @param childTaskInstructionPrefixes instructions this task issued to children, in order
 * @param declaredText                 raw task text sub-instructions are extracted from (nullable)
 * @param parentConfidenceScore        match score behind {@code reconstructedParentId}
 * @param resolutionMethod             how the current parent was established
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskSkeleton(
    String taskId,
    String workspace,
    String createdAt,
    String parentTaskId,
    String reconstructedParentId,
    String truncatedInstruction,
    List<String> childTaskInstructionPrefixes,
    String declaredText,
    Double parentConfidenceScore,
    ResolutionMethod resolutionMethod
) implements Serializable {

    public TaskSkeleton {
        childTaskInstructionPrefixes = childTaskInstructionPrefixes == null
                ? List.of()
                : List.copyOf(childTaskInstructionPrefixes);
    }

    /** Loader-shaped factory: identity, placement, persisted parent and instructions. */
    public static TaskSkeleton of(String taskId, String workspace, String createdAt, String parentTaskId,
                                  String truncatedInstruction, List<String> childTaskInstructionPrefixes) {
        return new TaskSkeleton(taskId, workspace, createdAt, parentTaskId, null, truncatedInstruction,
                childTaskInstructionPrefixes, null, null, parentTaskId != null ? ResolutionMethod.PERSISTED : null);
    }

    @JsonIgnore
    public boolean hasParent() {
        return parentTaskId != null && !parentTaskId.isBlank();
    }

    @JsonIgnore
    public boolean hasWorkspace() {
        return workspace != null && !workspace.isBlank();
    }

    /** Whether the current parent came from matching rather than persisted metadata. */
    @JsonIgnore
    public boolean isReconstructed() {
        return reconstructedParentId != null && reconstructedParentId.equals(parentTaskId);
    }

    @JsonIgnore
    public Optional<Instant> createdInstant() {
        return SkeletonTimestamps.parse(createdAt);
    }

    /** Throws when the record lacks the identity fields every later step relies on. */
    public void requireIdentity() {
        if (taskId == null || taskId.isBlank()) {
            throw new MalformedSkeletonException("Skeleton has no taskId (workspace="
                    + workspace + ", createdAt=" + createdAt + ")");
        }
    }

    public TaskSkeleton withReconstructedParent(String parentId, double score) {
        return withReconstructedParent(parentId, score, ResolutionMethod.INSTRUCTION_MATCH);
    }

    public TaskSkeleton withReconstructedParent(String parentId, double score, ResolutionMethod method) {
        return new TaskSkeleton(taskId, workspace, createdAt, parentId, parentId, truncatedInstruction,
                childTaskInstructionPrefixes, declaredText, score, method);
    }

    public TaskSkeleton withoutParent() {
        return new TaskSkeleton(taskId, workspace, createdAt, null, null, truncatedInstruction,
                childTaskInstructionPrefixes, declaredText, null, null);
    }

    public TaskSkeleton withDeclaredText(String text) {
        return new TaskSkeleton(taskId, workspace, createdAt, parentTaskId, reconstructedParentId,
                truncatedInstruction, childTaskInstructionPrefixes, text, parentConfidenceScore, resolutionMethod);
    }
}
