package com.taskforest.core.matching;

import com.taskforest.core.index.InstructionNormalizer;
import com.taskforest.core.model.MatchCandidate.ScoreBreakdown;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Composite similarity between a declared instruction and a child's opening instruction.
 * Inputs are expected to be normalized already; every component lands in [0,1].
 */
public class SimilarityScorer {

    private final ScoringWeights weights;

    public SimilarityScorer() {
        this(ScoringWeights.DEFAULT);
    }

    public SimilarityScorer(ScoringWeights weights) {
        this.weights = weights.normalized();
    }

    public ScoringWeights weights() {
        return weights;
    }

    public double score(String candidate, String child) {
        return score(candidate, child, TermRarity.uniform());
    }

    public double score(String candidate, String child, TermRarity rarity) {
        return combine(components(candidate, child, rarity));
    }

    public double combine(ScoreBreakdown c) {
        double total = weights.inclusion() * c.inclusion()
                + weights.commonWords() * c.commonWords()
                + weights.lexical() * c.lexical()
                + weights.editSimilarity() * c.editSimilarity();
        return Math.max(0.0, Math.min(1.0, total));
    }

    public ScoreBreakdown components(String candidate, String child, TermRarity rarity) {
        List<String> candidateTokens = InstructionNormalizer.tokens(candidate);
        List<String> childTokens = InstructionNormalizer.tokens(child);
        return new ScoreBreakdown(
                inclusion(candidateTokens, childTokens),
                commonWords(candidateTokens, childTokens),
                lexical(candidateTokens, childTokens, rarity),
                editSimilarity(candidate, child));
    }

    /** Distinct tokens present on both sides, in candidate order. */
    public List<String> sharedTerms(String candidate, String child) {
        Set<String> childSet = new LinkedHashSet<>(InstructionNormalizer.tokens(child));
        var shared = new ArrayList<String>();
        for (String t : new LinkedHashSet<>(InstructionNormalizer.tokens(candidate))) {
            if (childSet.contains(t)) {
                shared.add(t);
            }
        }
        return shared;
    }

    /** Longest ordered run of candidate tokens found in the child, over the candidate length. */
    static double inclusion(List<String> candidate, List<String> child) {
        if (candidate.isEmpty() || child.isEmpty()) {
            return 0.0;
        }
        int[] prev = new int[child.size() + 1];
        int[] curr = new int[child.size() + 1];
        for (String c : candidate) {
            for (int j = 1; j <= child.size(); j++) {
                curr[j] = c.equals(child.get(j - 1))
                        ? prev[j - 1] + 1
                        : Math.max(prev[j], curr[j - 1]);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return (double) prev[child.size()] / candidate.size();
    }

    static double commonWords(List<String> candidate, List<String> child) {
        Set<String> a = new LinkedHashSet<>(candidate);
        Set<String> b = new LinkedHashSet<>(child);
        int max = Math.max(a.size(), b.size());
        if (max == 0) {
            return 0.0;
        }
        a.retainAll(b);
        return (double) a.size() / max;
    }

    static double lexical(List<String> candidate, List<String> child, TermRarity rarity) {
        Set<String> a = new LinkedHashSet<>(candidate);
        Set<String> b = new LinkedHashSet<>(child);
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        double shared = 0.0;
        double total = 0.0;
        for (String t : union) {
            double w = rarity.weight(t);
            total += w;
            if (a.contains(t) && b.contains(t)) {
                shared += w;
            }
        }
        return total <= 0.0 ? 0.0 : shared / total;
    }

    static double editSimilarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int max = Math.max(a.length(), b.length());
        return 1.0 - (double) levenshtein(a, b) / max;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
