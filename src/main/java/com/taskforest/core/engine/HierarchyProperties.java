package com.taskforest.core.engine;

import com.taskforest.core.model.IndexScope;
import com.taskforest.core.model.ReconstructionMode;
import com.taskforest.core.matching.ScoringWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskforest.hierarchy")
public class HierarchyProperties {

    private ReconstructionMode mode = ReconstructionMode.MATCHING_ENABLED;
    private IndexScope indexScope = IndexScope.PER_WORKSPACE;
    private int maxPrefixLength = 192;
    private double matchThreshold = 0.7;
    private Weights weights = new Weights();
    private int minInstructionLength = 5;
    private int minSharedPrefix = 16;
    private int maxCandidates = 64;
    private double tieTolerance = 0.01;
    private boolean parallelWorkspaces = false;
    private int maxParallel = 4;

    public ReconstructionMode getMode() {
        return mode;
    }

    public void setMode(ReconstructionMode mode) {
        this.mode = mode;
    }

    public IndexScope getIndexScope() {
        return indexScope;
    }

    public void setIndexScope(IndexScope indexScope) {
        this.indexScope = indexScope;
    }

    public int getMaxPrefixLength() {
        return maxPrefixLength;
    }

    public void setMaxPrefixLength(int maxPrefixLength) {
        this.maxPrefixLength = maxPrefixLength;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public int getMinInstructionLength() {
        return minInstructionLength;
    }

    public void setMinInstructionLength(int minInstructionLength) {
        this.minInstructionLength = minInstructionLength;
    }

    public int getMinSharedPrefix() {
        return minSharedPrefix;
    }

    public void setMinSharedPrefix(int minSharedPrefix) {
        this.minSharedPrefix = minSharedPrefix;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public double getTieTolerance() {
        return tieTolerance;
    }

    public void setTieTolerance(double tieTolerance) {
        this.tieTolerance = tieTolerance;
    }

    public boolean isParallelWorkspaces() {
        return parallelWorkspaces;
    }

    public void setParallelWorkspaces(boolean parallelWorkspaces) {
        this.parallelWorkspaces = parallelWorkspaces;
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    /** Whether orphans are matched at all, by score or by exact prefix. */
    public boolean isMatchingEnabled() {
        return mode != ReconstructionMode.METADATA_ONLY;
    }

    /**
     * Composite score weights. Renormalised by the scorer when they do not sum to 1.
     */
    public static class Weights {

        private double inclusion = 0.4;
        private double commonWords = 0.3;
        private double lexical = 0.2;
        private double editDistance = 0.1;

        public double getInclusion() {
            return inclusion;
        }

        public void setInclusion(double inclusion) {
            this.inclusion = inclusion;
        }

        public double getCommonWords() {
            return commonWords;
        }

        public void setCommonWords(double commonWords) {
            this.commonWords = commonWords;
        }

        public double getLexical() {
            return lexical;
        }

        public void setLexical(double lexical) {
            this.lexical = lexical;
        }

        public double getEditDistance() {
            return editDistance;
        }

        public void setEditDistance(double editDistance) {
            this.editDistance = editDistance;
        }

        public ScoringWeights toScoringWeights() {
            return new ScoringWeights(inclusion, commonWords, lexical, editDistance);
        }
    }
}
