package com.resume.network.similarity;

/**
 * Configuration for feature weights in candidate similarity scoring.
 * Weights are non-negative and sum to 1.0, so the weighted score stays within [0, 1].
 */
public record SimilarityWeights(
        double skillWeight,
        double organizationWeight,
        double seniorityWeight,
        double titleWeight
) {
    public SimilarityWeights {
        if (skillWeight < 0 || organizationWeight < 0 || seniorityWeight < 0 || titleWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = skillWeight + organizationWeight + seniorityWeight + titleWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: skills dominate, titles next, shared employers and seniority as boosts.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.40, 0.20, 0.15, 0.25);
    }

    /**
     * Weights favoring the skill set (good for technical sourcing).
     */
    public static SimilarityWeights skillFocused() {
        return new SimilarityWeights(0.60, 0.10, 0.10, 0.20);
    }

    /**
     * Weights favoring career path: shared employers and role titles.
     */
    public static SimilarityWeights careerFocused() {
        return new SimilarityWeights(0.25, 0.30, 0.15, 0.30);
    }
}
