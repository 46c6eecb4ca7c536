package com.taskforest.core.engine;

import com.taskforest.core.events.EventBus;
import com.taskforest.core.events.HierarchyEvent;
import com.taskforest.core.extract.SubInstructionExtractor;
import com.taskforest.core.index.InstructionNormalizer;
import com.taskforest.core.matching.SimilarityScorer;
import com.taskforest.core.metrics.HierarchyMetrics;
import com.taskforest.core.model.HierarchyDiagnostic;
import com.taskforest.core.model.HierarchyDiagnostic.Decision;
import com.taskforest.core.model.IndexScope;
import com.taskforest.core.model.MalformedSkeletonException;
import com.taskforest.core.model.ReconstructionResult;
import com.taskforest.core.model.ReconstructionStats;
import com.taskforest.core.model.RejectionReason;
import com.taskforest.core.model.TaskSkeleton;
import com.taskforest.core.model.ValidationResult;
import com.taskforest.core.validation.ParentGraph;
import com.taskforest.core.validation.RelationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Predicate;

/**
 * Rebuilds the parent/child forest over a set of task skeletons.
 * <p>
 * Input is screened for loader contract violations, partitioned according to the
 * configured {@link IndexScope}, and each partition is handed to a {@link WorkspacePass}.
 * Persisted loops that span partitions are broken before any pass runs, so the freed
 * task can still be matched. The input list is never modified; the result holds new
 * skeletons in input order.
 */
@Service
public class HierarchyReconstructionEngine {

    private static final Logger log = LoggerFactory.getLogger(HierarchyReconstructionEngine.class);

    private final HierarchyProperties properties;
    private final SubInstructionExtractor extractor;
    private final InstructionNormalizer normalizer;
    private final SimilarityScorer scorer;
    private final RelationValidator validator;
    private final EventBus eventBus;
    private final HierarchyMetrics metrics;

    @Autowired
    public HierarchyReconstructionEngine(HierarchyProperties properties, SubInstructionExtractor extractor,
                                         InstructionNormalizer normalizer, SimilarityScorer scorer,
                                         RelationValidator validator, EventBus eventBus,
                                         @Autowired(required = false) HierarchyMetrics metrics) {
        this.properties = properties;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.validator = validator;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public HierarchyReconstructionEngine(HierarchyProperties properties) {
        this(properties, new EventBus(), null);
    }

    public HierarchyReconstructionEngine(HierarchyProperties properties, EventBus eventBus, HierarchyMetrics metrics) {
        this(properties,
                new SubInstructionExtractor(properties.getMinInstructionLength()),
                new InstructionNormalizer(properties.getMaxPrefixLength()),
                new SimilarityScorer(properties.getWeights().toScoringWeights()),
                new RelationValidator(),
                eventBus,
                metrics);
    }

    /**
     * Reconstructs hierarchy for the given skeletons.
     *
     * @param skeletons loader output; may contain nulls or malformed records, which are
     *                  reported and passed through unchanged
     * @return updated skeletons in input order with diagnostics and counters
     */
    public ReconstructionResult reconstruct(List<TaskSkeleton> skeletons) {
        long start = System.currentTimeMillis();
        int n = skeletons.size();
        TaskSkeleton[] output = new TaskSkeleton[n];
        boolean[] passThrough = new boolean[n];
        var diagnostics = new ArrayList<HierarchyDiagnostic>();

        Map<String, TaskSkeleton> current = new LinkedHashMap<>();
        int malformed = 0;
        for (int i = 0; i < n; i++) {
            TaskSkeleton s = skeletons.get(i);
            try {
                screen(s, i, current);
                current.put(s.taskId(), s);
            } catch (MalformedSkeletonException e) {
                malformed++;
                output[i] = s;
                passThrough[i] = true;
                log.warn("Passing through malformed skeleton at position {}: {}", i, e.getMessage());
                diagnostics.add(new HierarchyDiagnostic(s == null ? null : s.taskId(),
                        s == null ? null : s.workspace(), Decision.MALFORMED, null, List.of(), null, e.getMessage()));
                if (metrics != null) {
                    metrics.incrementMalformed();
                }
                publish(HierarchyEvent.SKELETON_MALFORMED, s == null ? null : s.workspace(),
                        s == null ? null : s.taskId(), Map.of("position", i, "error", e.getMessage()));
            }
        }

        Map<String, String> partitionOf = new HashMap<>();
        current.values().forEach(s -> partitionOf.put(s.taskId(), partitionKey(s)));
        Map<String, List<String>> partitions = new LinkedHashMap<>();
        for (TaskSkeleton s : current.values()) {
            partitions.computeIfAbsent(partitionOf.get(s.taskId()), k -> new ArrayList<>()).add(s.taskId());
        }

        // a persisted loop that leaves its partition and breaks no per-edge rule is
        // invisible to every single pass
        var cycleDiagnostics = new ArrayList<HierarchyDiagnostic>();
        breakCycles(current, cycle -> spansPartitions(cycle, partitionOf) && edgesClean(cycle, current),
                cycleDiagnostics);
        Map<String, TaskSkeleton> beforePasses = new LinkedHashMap<>(current);

        Map<String, WorkspacePass.Outcome> outcomes = runPasses(partitions, current);

        // concurrent passes can each accept an edge that together close a loop through
        // tasks without a workspace; those partitions are redone one at a time
        Set<String> freed = breakCycles(current, cycle -> true, cycleDiagnostics);
        if (!freed.isEmpty()) {
            Set<String> redo = new LinkedHashSet<>();
            freed.forEach(id -> redo.add(partitionOf.get(id)));
            for (String workspace : redo) {
                List<String> ids = partitions.get(workspace);
                for (String id : ids) {
                    TaskSkeleton before = beforePasses.get(id);
                    current.put(id, freed.contains(id) ? before.withoutParent() : before);
                }
                WorkspacePass.Outcome outcome = runPassSafely(workspace, membersOf(ids, current), current);
                current.putAll(outcome.skeletons());
                outcomes.put(workspace, outcome);
            }
        }

        diagnostics.addAll(cycleDiagnostics);
        ReconstructionStats stats = ReconstructionStats.empty();
        for (WorkspacePass.Outcome outcome : outcomes.values()) {
            diagnostics.addAll(outcome.diagnostics());
            stats = stats.plus(outcome.stats());
        }

        for (int i = 0; i < n; i++) {
            if (!passThrough[i]) {
                output[i] = current.get(skeletons.get(i).taskId());
            }
        }

        long durationMs = System.currentTimeMillis() - start;
        stats = stats.withRunTotals(malformed, cycleDiagnostics.size(), stats.orphans(), durationMs);
        log.info("Reconstructed {} task(s) in {} partition(s) in {} ms: kept={}, matched={}, orphans={}, malformed={}",
                stats.processed(), partitions.size(), durationMs, stats.persistedKept(),
                stats.resolvedByMatching(), stats.orphans(), malformed);
        return new ReconstructionResult(Arrays.asList(output), diagnostics, stats);
    }

    /**
     * Checks one proposed edge against the given task set without changing anything.
     */
    public ValidationResult validateRelation(String parentId, String childId, List<TaskSkeleton> skeletons) {
        ParentGraph graph = ParentGraph.of(skeletons);
        TaskSkeleton child = graph.skeleton(childId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown child task: " + childId));
        return validator.validate(parentId, child, graph);
    }

    private static void screen(TaskSkeleton s, int position, Map<String, TaskSkeleton> seen) {
        if (s == null) {
            throw new MalformedSkeletonException("Null skeleton at position " + position);
        }
        s.requireIdentity();
        if (seen.containsKey(s.taskId())) {
            throw new MalformedSkeletonException("Duplicate taskId " + s.taskId() + " at position " + position);
        }
    }

    private String partitionKey(TaskSkeleton s) {
        if (properties.getIndexScope() == IndexScope.SHARED) {
            return "";
        }
        return s.hasWorkspace() ? s.workspace() : "";
    }

    private static boolean spansPartitions(List<String> cycle, Map<String, String> partitionOf) {
        return cycle.stream().map(partitionOf::get).distinct().count() > 1;
    }

    private boolean edgesClean(List<String> cycle, Map<String, TaskSkeleton> current) {
        for (String id : cycle) {
            TaskSkeleton child = current.get(id);
            if (!validator.pairConflicts(current.get(child.parentTaskId()), child).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static List<TaskSkeleton> membersOf(List<String> ids, Map<String, TaskSkeleton> current) {
        var members = new ArrayList<TaskSkeleton>(ids.size());
        ids.forEach(id -> members.add(current.get(id)));
        return members;
    }

    /**
     * Runs one pass per partition and writes each outcome back into {@code current}.
     * Sequential passes see the results of earlier ones; parallel passes all see the
     * state from before the first one started.
     */
    private Map<String, WorkspacePass.Outcome> runPasses(Map<String, List<String>> partitions,
                                                         Map<String, TaskSkeleton> current) {
        Map<String, WorkspacePass.Outcome> outcomes = new LinkedHashMap<>();
        if (!properties.isParallelWorkspaces() || partitions.size() < 2) {
            partitions.forEach((workspace, ids) -> {
                WorkspacePass.Outcome outcome = runPassSafely(workspace, membersOf(ids, current), current);
                current.putAll(outcome.skeletons());
                outcomes.put(workspace, outcome);
            });
            return outcomes;
        }

        Map<String, TaskSkeleton> snapshot = new LinkedHashMap<>(current);
        int threads = Math.max(1, Math.min(properties.getMaxParallel(), partitions.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<String, Future<WorkspacePass.Outcome>> futures = new LinkedHashMap<>();
            partitions.forEach((workspace, ids) -> futures.put(workspace,
                    executor.submit(() -> runPassSafely(workspace, membersOf(ids, snapshot), snapshot))));
            for (Map.Entry<String, Future<WorkspacePass.Outcome>> entry : futures.entrySet()) {
                outcomes.put(entry.getKey(), entry.getValue().get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workspace passes", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Workspace pass failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
        outcomes.values().forEach(outcome -> current.putAll(outcome.skeletons()));
        return outcomes;
    }

    private WorkspacePass.Outcome runPassSafely(String workspace, List<TaskSkeleton> members,
                                                Map<String, TaskSkeleton> lookup) {
        String passId = UUID.randomUUID().toString().substring(0, 8);
        try {
            return new WorkspacePass(properties, extractor, normalizer, scorer, validator, eventBus, metrics,
                    workspace, passId, members, lookup).run();
        } catch (RuntimeException e) {
            log.error("Pass {} over workspace '{}' failed, returning its {} task(s) unchanged",
                    passId, workspace, members.size(), e);
            Map<String, TaskSkeleton> unchanged = new LinkedHashMap<>();
            var failures = new ArrayList<HierarchyDiagnostic>();
            for (TaskSkeleton s : members) {
                unchanged.put(s.taskId(), s);
                failures.add(HierarchyDiagnostic.of(s, Decision.PASS_FAILED, null, List.of(), null,
                        String.valueOf(e.getMessage())));
            }
            var stats = new ReconstructionStats(members.size(), 0, 0, 0, 0, 0, 0, 0, 0.0, 0, 0L);
            return new WorkspacePass.Outcome(unchanged, failures, stats);
        }
    }

    /**
     * Breaks every parent loop accepted by {@code filter} by clearing the edge of its most
     * recently created member.
     *
     * @return ids of the tasks whose parent was cleared
     */
    private Set<String> breakCycles(Map<String, TaskSkeleton> current, Predicate<List<String>> filter,
                                    List<HierarchyDiagnostic> diagnostics) {
        Set<String> freed = new LinkedHashSet<>();
        for (List<String> cycle : ParentGraph.of(current.values()).findCycles()) {
            if (!filter.test(cycle)) {
                continue;
            }
            TaskSkeleton newest = cycle.stream()
                    .map(current::get)
                    .max(Comparator.comparing((TaskSkeleton s) -> s.createdInstant().orElse(Instant.MIN))
                            .thenComparing(TaskSkeleton::taskId))
                    .orElseThrow();
            current.put(newest.taskId(), newest.withoutParent());
            freed.add(newest.taskId());
            log.warn("Broke cycle {} by clearing parent {} of task {}", cycle, newest.parentTaskId(), newest.taskId());
            diagnostics.add(HierarchyDiagnostic.of(newest, Decision.CYCLE_BROKEN, newest.parentTaskId(),
                    List.of(RejectionReason.CYCLE), null, "cycle " + cycle));
            if (metrics != null) {
                metrics.recordEdgeRejected(RejectionReason.CYCLE);
            }
            publish(HierarchyEvent.CYCLE_BROKEN, newest.workspace(), newest.taskId(),
                    Map.of("parentId", newest.parentTaskId(), "cycle", cycle));
        }
        return freed;
    }

    private void publish(String type, String workspace, String taskId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(HierarchyEvent.of(type, workspace, taskId, payload));
        }
    }
}
