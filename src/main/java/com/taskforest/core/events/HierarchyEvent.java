package com.taskforest.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted while reconstructing hierarchy.
 *
 * @param eventType event type (e.g. "pass.started", "edge.accepted", "edge.rejected")
 * @param workspace the workspace the pass covers (empty for a shared or global pass)
 * @param taskId    the task this event relates to (nullable for pass-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record HierarchyEvent(
    String eventType,
    String workspace,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PASS_STARTED = "pass.started";
    public static final String PASS_COMPLETED = "pass.completed";
    public static final String EDGE_ACCEPTED = "edge.accepted";
    public static final String EDGE_REJECTED = "edge.rejected";
    public static final String SKELETON_MALFORMED = "skeleton.malformed";
    public static final String CYCLE_BROKEN = "cycle.broken";

    public HierarchyEvent {
        workspace = workspace == null ? "" : workspace;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static HierarchyEvent of(String eventType, String workspace, String taskId, Map<String, Object> payload) {
        return new HierarchyEvent(eventType, workspace, taskId, payload, Instant.now());
    }
}
