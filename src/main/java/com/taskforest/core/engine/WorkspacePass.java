package com.taskforest.core.engine;

import com.taskforest.core.events.EventBus;
import com.taskforest.core.events.HierarchyEvent;
import com.taskforest.core.extract.SubInstructionExtractor;
import com.taskforest.core.index.InstructionIndex;
import com.taskforest.core.index.InstructionNormalizer;
import com.taskforest.core.logging.MdcContext;
import com.taskforest.core.matching.InstructionMatcher;
import com.taskforest.core.matching.SimilarityScorer;
import com.taskforest.core.metrics.HierarchyMetrics;
import com.taskforest.core.model.HierarchyDiagnostic;
import com.taskforest.core.model.HierarchyDiagnostic.Decision;
import com.taskforest.core.model.MatchCandidate;
import com.taskforest.core.model.ReconstructionMode;
import com.taskforest.core.model.ReconstructionStats;
import com.taskforest.core.model.RejectionReason;
import com.taskforest.core.model.ResolutionMethod;
import com.taskforest.core.model.TaskSkeleton;
import com.taskforest.core.model.ValidationResult;
import com.taskforest.core.validation.ParentGraph;
import com.taskforest.core.validation.RelationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One reconstruction pass over one partition of the task set.
 * <ol>
 *   <li>validate persisted parents, clearing rejected ones;</li>
 *   <li>index every declared sub-instruction (matching mode only);</li>
 *   <li>match each task still lacking a parent against the index (matching mode only);</li>
 *   <li>report whatever is left as an orphan.</li>
 * </ol>
 * The index is created here and dropped when the pass ends. A pass never mutates its
 * input skeletons and shares no mutable state with other passes.
 */
class WorkspacePass {

    private static final Logger log = LoggerFactory.getLogger(WorkspacePass.class);

    private final HierarchyProperties properties;
    private final SubInstructionExtractor extractor;
    private final InstructionNormalizer normalizer;
    private final SimilarityScorer scorer;
    private final RelationValidator validator;
    private final EventBus eventBus;
    private final HierarchyMetrics metrics;

    private final String workspace;
    private final String passId;
    private final List<TaskSkeleton> members;
    private final Map<String, TaskSkeleton> lookup;

    private final List<HierarchyDiagnostic> diagnostics = new ArrayList<>();

    WorkspacePass(HierarchyProperties properties, SubInstructionExtractor extractor,
                  InstructionNormalizer normalizer, SimilarityScorer scorer, RelationValidator validator,
                  EventBus eventBus, HierarchyMetrics metrics,
                  String workspace, String passId, List<TaskSkeleton> members, Map<String, TaskSkeleton> lookup) {
        this.properties = properties;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.validator = validator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.workspace = workspace;
        this.passId = passId;
        this.members = List.copyOf(members);
        this.lookup = lookup;
    }

    /**
     * Result of a pass: updated skeletons keyed by task id, in member order.
     */
    record Outcome(Map<String, TaskSkeleton> skeletons, List<HierarchyDiagnostic> diagnostics,
                   ReconstructionStats stats) {}

    Outcome run() {
        long start = System.currentTimeMillis();
        MdcContext.setPass(workspace, passId);
        try {
            publish(HierarchyEvent.PASS_STARTED, null, Map.of(
                    "passId", passId,
                    "tasks", members.size(),
                    "mode", properties.getMode().name()));
            log.info("Starting pass {} over {} task(s) in workspace '{}'", passId, members.size(), workspace);

            Map<String, TaskSkeleton> current = new LinkedHashMap<>();
            for (TaskSkeleton s : members) {
                current.put(s.taskId(), s);
            }
            ParentGraph graph = ParentGraph.of(members, externalAncestors(current));

            int[] persisted = validatePersisted(current, graph);

            int indexed = 0;
            int indexSize = 0;
            int matched = 0;
            double confidenceSum = 0.0;
            if (properties.isMatchingEnabled()) {
                var index = new InstructionIndex(normalizer, extractor,
                        properties.getMinSharedPrefix(), properties.getMaxCandidates());
                indexed = indexDeclarations(current, index);
                indexSize = index.size();
                if (metrics != null) {
                    metrics.recordIndexSize(indexSize);
                }
                var matcher = new InstructionMatcher(index, scorer,
                        properties.getMatchThreshold(), properties.getTieTolerance());
                for (TaskSkeleton s : new ArrayList<>(current.values())) {
                    if (s.hasParent()) {
                        continue;
                    }
                    TaskSkeleton resolved = matchOrphan(s, matcher, current, graph);
                    if (resolved != s) {
                        current.put(s.taskId(), resolved);
                        matched++;
                        confidenceSum += resolved.parentConfidenceScore();
                    }
                }
            }

            int orphans = 0;
            for (TaskSkeleton s : current.values()) {
                if (!s.hasParent()) {
                    orphans++;
                    diagnostics.add(HierarchyDiagnostic.of(s, Decision.ORPHAN, null, List.of(), null,
                            "no valid parent established"));
                }
            }

            long durationMs = System.currentTimeMillis() - start;
            var stats = new ReconstructionStats(members.size(), 0, persisted[0], persisted[1], indexed, indexSize,
                    matched, orphans, matched == 0 ? 0.0 : confidenceSum / matched, 0, durationMs);
            if (metrics != null) {
                metrics.recordOrphans(orphans);
                metrics.recordPassDuration(properties.getIndexScope().name().toLowerCase(Locale.ROOT),
                        durationMs);
            }
            publish(HierarchyEvent.PASS_COMPLETED, null, Map.of(
                    "passId", passId,
                    "persistedKept", stats.persistedKept(),
                    "persistedInvalidated", stats.persistedInvalidated(),
                    "resolvedByMatching", stats.resolvedByMatching(),
                    "orphans", stats.orphans(),
                    "durationMs", durationMs));
            log.info("Pass {} done in {} ms: kept={}, invalidated={}, matched={}, orphans={}, indexSize={}",
                    passId, durationMs, persisted[0], persisted[1], matched, orphans, indexSize);
            return new Outcome(current, diagnostics, stats);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Tasks outside this partition reachable by following parent ids up from the members,
     * so a loop that leaves the partition and comes back is still seen.
     */
    private List<TaskSkeleton> externalAncestors(Map<String, TaskSkeleton> current) {
        Map<String, TaskSkeleton> externals = new LinkedHashMap<>();
        for (TaskSkeleton s : current.values()) {
            String next = s.hasParent() ? s.parentTaskId() : null;
            while (next != null && !current.containsKey(next) && !externals.containsKey(next)) {
                TaskSkeleton parent = lookup.get(next);
                if (parent == null) {
                    break;
                }
                externals.put(next, parent);
                next = parent.hasParent() ? parent.parentTaskId() : null;
            }
        }
        return new ArrayList<>(externals.values());
    }

    /** @return {kept, invalidated} */
    private int[] validatePersisted(Map<String, TaskSkeleton> current, ParentGraph graph) {
        int kept = 0;
        int invalidated = 0;
        for (TaskSkeleton s : members) {
            if (!s.hasParent()) {
                continue;
            }
            MdcContext.setTask(s.taskId());
            ValidationResult result = validator.validate(s.parentTaskId(), s, graph);
            if (result.accepted()) {
                kept++;
                String detail = graph.contains(s.parentTaskId())
                        ? "persisted parent kept"
                        : "persisted parent not in task set, kept unverified";
                diagnostics.add(HierarchyDiagnostic.of(s, Decision.VALIDATED, s.parentTaskId(), List.of(),
                        s.parentConfidenceScore(), detail));
                if (metrics != null) {
                    metrics.recordEdgeAccepted("persisted");
                }
                publish(HierarchyEvent.EDGE_ACCEPTED, s.taskId(), Map.of(
                        "parentId", s.parentTaskId(), "source", "persisted"));
            } else {
                invalidated++;
                graph.clearParent(s.taskId());
                current.put(s.taskId(), s.withoutParent());
                log.info("Cleared persisted parent {} of task {}: {}", s.parentTaskId(), s.taskId(), result.reasons());
                diagnostics.add(HierarchyDiagnostic.of(s, Decision.INVALIDATED, s.parentTaskId(), result.reasons(),
                        null, "persisted parent rejected"));
                recordRejection(s, s.parentTaskId(), result, "persisted");
            }
        }
        MdcContext.clearTask();
        return new int[]{kept, invalidated};
    }

    private int indexDeclarations(Map<String, TaskSkeleton> current, InstructionIndex index) {
        int added = 0;
        for (TaskSkeleton s : current.values()) {
            for (String prefix : s.childTaskInstructionPrefixes()) {
                if (index.add(s.taskId(), prefix, s.workspace())) {
                    added++;
                }
            }
            if (s.declaredText() != null) {
                added += index.addAllFromParentText(s.taskId(), s.declaredText(), s.workspace());
            }
        }
        log.debug("Indexed {} declaration(s), {} distinct prefix(es)", added, index.size());
        return added;
    }

    private TaskSkeleton matchOrphan(TaskSkeleton s, InstructionMatcher matcher,
                                     Map<String, TaskSkeleton> current, ParentGraph graph) {
        MdcContext.setTask(s.taskId());
        try {
            boolean exact = properties.getMode() == ReconstructionMode.EXACT_PREFIX;
            List<MatchCandidate> candidates = exact
                    ? matcher.findExactMatches(s, current)
                    : matcher.findBestMatches(s, current);
            for (MatchCandidate candidate : candidates) {
                ValidationResult result = validator.validate(candidate.ownerTaskId(), s, graph);
                if (result.accepted()) {
                    graph.setParent(s.taskId(), candidate.ownerTaskId());
                    diagnostics.add(HierarchyDiagnostic.of(s, Decision.MATCHED, candidate.ownerTaskId(), List.of(),
                            candidate.score(), "matched on '" + candidate.matchedPrefix() + "'"));
                    if (metrics != null) {
                        metrics.recordEdgeAccepted("matched");
                    }
                    publish(HierarchyEvent.EDGE_ACCEPTED, s.taskId(), Map.of(
                            "parentId", candidate.ownerTaskId(),
                            "source", "matched",
                            "score", candidate.score()));
                    log.debug("Matched task {} to parent {} (score {})", s.taskId(), candidate.ownerTaskId(),
                            String.format("%.3f", candidate.score()));
                    return s.withReconstructedParent(candidate.ownerTaskId(), candidate.score(),
                            exact ? ResolutionMethod.EXACT_PREFIX : ResolutionMethod.INSTRUCTION_MATCH);
                }
                diagnostics.add(HierarchyDiagnostic.of(s, Decision.CANDIDATE_REJECTED, candidate.ownerTaskId(),
                        result.reasons(), candidate.score(), "match candidate rejected"));
                recordRejection(s, candidate.ownerTaskId(), result, "matched");
            }
            return s;
        } finally {
            MdcContext.clearTask();
        }
    }

    private void recordRejection(TaskSkeleton child, String parentId, ValidationResult result, String source) {
        if (metrics != null) {
            result.reasons().forEach(metrics::recordEdgeRejected);
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("parentId", parentId);
        payload.put("source", source);
        payload.put("reasons", result.reasons().stream().map(RejectionReason::name).toList());
        publish(HierarchyEvent.EDGE_REJECTED, child.taskId(), payload);
    }

    private void publish(String type, String taskId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(HierarchyEvent.of(type, workspace, taskId, payload));
        }
    }
}
