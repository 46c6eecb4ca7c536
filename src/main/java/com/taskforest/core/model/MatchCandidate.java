package com.taskforest.core.model;

import java.util.List;

/**
 * A scored parent candidate for one query. Never persisted.
 *
 * @param ownerTaskId   task that declared the matched instruction
 * @param score         weighted composite score in [0,1]
 * @param matchedTerms  tokens shared by the query and the declared instruction
 * @param matchedPrefix the normalized declared instruction that produced the score
 * @param components    the four component scores behind {@code score}
 */
public record MatchCandidate(
    String ownerTaskId,
    double score,
    List<String> matchedTerms,
    String matchedPrefix,
    ScoreBreakdown components
) {

    public MatchCandidate {
        matchedTerms = List.copyOf(matchedTerms);
    }

    /**
     * Component scores, each in [0,1].
     */
    public record ScoreBreakdown(
        double inclusion,
        double commonWords,
        double lexical,
        double editSimilarity
    ) {}
}
