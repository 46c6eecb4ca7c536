package com.taskforest.core.matching;

import com.taskforest.core.index.InstructionIndex;
import com.taskforest.core.model.IndexedInstruction;
import com.taskforest.core.model.MatchCandidate;
import com.taskforest.core.model.TaskSkeleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ranks the tasks whose declared instructions best explain a child's opening instruction.
 * <p>
 * Results depend only on the index contents at call time, so the same query against the
 * same index always ranks the same way.
 */
public class InstructionMatcher {

    private static final Logger log = LoggerFactory.getLogger(InstructionMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final double DEFAULT_TIE_TOLERANCE = 0.01;

    private final InstructionIndex index;
    private final SimilarityScorer scorer;
    private final double threshold;
    private final double tieTolerance;

    public InstructionMatcher(InstructionIndex index) {
        this(index, new SimilarityScorer(), DEFAULT_THRESHOLD, DEFAULT_TIE_TOLERANCE);
    }

    public InstructionMatcher(InstructionIndex index, SimilarityScorer scorer,
                              double threshold, double tieTolerance) {
        this.index = Objects.requireNonNull(index, "index");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.threshold = threshold;
        this.tieTolerance = Math.max(0.0, tieTolerance);
    }

    public List<MatchCandidate> findBestMatches(String childText) {
        return findBestMatches(childText, threshold);
    }

    /**
     * Scores every index candidate for {@code childText}, keeps the best score per
     * owner and drops anything under {@code threshold}.
     *
     * @return candidates sorted by descending score; empty when nothing qualifies
     */
    public List<MatchCandidate> findBestMatches(String childText, double threshold) {
        List<IndexedInstruction> entries = index.queryCandidates(childText);
        if (entries.isEmpty()) {
            return List.of();
        }
        String child = index.normalizer().normalize(childText);
        TermRarity rarity = TermRarity.of(index);

        Map<String, MatchCandidate> bestByOwner = new LinkedHashMap<>();
        for (IndexedInstruction entry : entries) {
            var components = scorer.components(entry.normalizedPrefix(), child, rarity);
            double score = scorer.combine(components);
            MatchCandidate current = bestByOwner.get(entry.ownerTaskId());
            if (current == null || score > current.score()) {
                bestByOwner.put(entry.ownerTaskId(), new MatchCandidate(entry.ownerTaskId(), score,
                        scorer.sharedTerms(entry.normalizedPrefix(), child), entry.normalizedPrefix(), components));
            }
        }

        var ranked = new ArrayList<MatchCandidate>();
        for (MatchCandidate c : bestByOwner.values()) {
            if (c.score() >= threshold) {
                ranked.add(c);
            }
        }
        ranked.sort(Comparator.comparingDouble(MatchCandidate::score).reversed());
        log.debug("{} of {} candidate owner(s) reached threshold {}", ranked.size(), bestByOwner.size(), threshold);
        return ranked;
    }

    /**
     * Ranks parents for a specific child. The child never matches itself, and candidates
     * scoring within the tie tolerance of the best are ordered by same workspace first,
     * then by a creation time not after the child's and closest to it.
     *
     * @param child  the task looking for a parent
     * @param owners the pass's tasks by id, used for workspace and timestamp lookups
     */
    public List<MatchCandidate> findBestMatches(TaskSkeleton child, Map<String, TaskSkeleton> owners) {
        if (child.truncatedInstruction() == null || child.truncatedInstruction().isBlank()) {
            return List.of();
        }
        var ranked = new ArrayList<MatchCandidate>();
        for (MatchCandidate c : findBestMatches(child.truncatedInstruction(), threshold)) {
            if (!c.ownerTaskId().equals(child.taskId())) {
                ranked.add(c);
            }
        }
        return orderTies(ranked, child, owners);
    }

    /**
     * Owners whose declared instruction equals the child's opening instruction at one of
     * the index cut lengths, each with confidence 1 and ordered by the same tie rules
     * as {@link #findBestMatches(TaskSkeleton, Map)}. The child never matches itself.
     */
    public List<MatchCandidate> findExactMatches(TaskSkeleton child, Map<String, TaskSkeleton> owners) {
        if (child.truncatedInstruction() == null || child.truncatedInstruction().isBlank()) {
            return List.of();
        }
        var exact = new ArrayList<MatchCandidate>();
        for (IndexedInstruction entry : index.searchExactPrefix(child.truncatedInstruction())) {
            if (entry.ownerTaskId().equals(child.taskId())) {
                continue;
            }
            String prefix = entry.normalizedPrefix();
            exact.add(new MatchCandidate(entry.ownerTaskId(), 1.0, scorer.sharedTerms(prefix, prefix), prefix,
                    new MatchCandidate.ScoreBreakdown(1.0, 1.0, 1.0, 1.0)));
        }
        log.debug("{} exact prefix owner(s) for task {}", exact.size(), child.taskId());
        return orderTies(exact, child, owners);
    }

    private List<MatchCandidate> orderTies(List<MatchCandidate> ranked, TaskSkeleton child,
                                           Map<String, TaskSkeleton> owners) {
        if (ranked.size() < 2) {
            return ranked;
        }
        double best = ranked.get(0).score();
        int tieEnd = 0;
        while (tieEnd < ranked.size() && best - ranked.get(tieEnd).score() <= tieTolerance) {
            tieEnd++;
        }
        if (tieEnd > 1) {
            List<MatchCandidate> tied = new ArrayList<>(ranked.subList(0, tieEnd));
            tied.sort(tieBreak(child, owners));
            for (int i = 0; i < tieEnd; i++) {
                ranked.set(i, tied.get(i));
            }
        }
        return ranked;
    }

    private static Comparator<MatchCandidate> tieBreak(TaskSkeleton child, Map<String, TaskSkeleton> owners) {
        Optional<Instant> childCreated = child.createdInstant();
        Comparator<MatchCandidate> sameWorkspaceFirst = Comparator.comparingInt(c -> {
            TaskSkeleton owner = owners.get(c.ownerTaskId());
            return owner != null && child.hasWorkspace() && child.workspace().equals(owner.workspace()) ? 0 : 1;
        });
        Comparator<MatchCandidate> closestEarlier = Comparator.comparingLong(c -> {
            TaskSkeleton owner = owners.get(c.ownerTaskId());
            if (owner == null || childCreated.isEmpty()) {
                return Long.MAX_VALUE;
            }
            Optional<Instant> created = owner.createdInstant();
            if (created.isEmpty() || created.get().isAfter(childCreated.get())) {
                return Long.MAX_VALUE;
            }
            return Duration.between(created.get(), childCreated.get()).toMillis();
        });
        return sameWorkspaceFirst.thenComparing(closestEarlier);
    }
}
