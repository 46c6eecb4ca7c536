package com.taskforest.core.matching;

/**
 * Component weights of the composite match score.
 */
public record ScoringWeights(
    double inclusion,
    double commonWords,
    double lexical,
    double editSimilarity
) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.4, 0.3, 0.2, 0.1);

    public ScoringWeights {
        if (inclusion < 0 || commonWords < 0 || lexical < 0 || editSimilarity < 0) {
            throw new IllegalArgumentException("Scoring weights must not be negative");
        }
        if (inclusion + commonWords + lexical + editSimilarity == 0) {
            throw new IllegalArgumentException("At least one scoring weight must be positive");
        }
    }

    public double sum() {
        return inclusion + commonWords + lexical + editSimilarity;
    }

    /** Returns weights scaled to sum to 1; unchanged when they already do. */
    public ScoringWeights normalized() {
        double sum = sum();
        if (Math.abs(sum - 1.0) < 1e-9) {
            return this;
        }
        return new ScoringWeights(inclusion / sum, commonWords / sum, lexical / sum, editSimilarity / sum);
    }
}
