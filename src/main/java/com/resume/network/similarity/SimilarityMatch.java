package com.resume.network.similarity;

/**
 * One ranked candidate in a similarity result.
 */
public record SimilarityMatch(String candidateId, String name, double score, SimilarityBreakdown breakdown) {

    public int skillOverlap() {
        return breakdown.skillOverlap();
    }
}
