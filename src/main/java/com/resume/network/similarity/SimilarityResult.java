package com.resume.network.similarity;

import java.util.List;

/**
 * Ranked similarity matches for one reference candidate, computed against one pool snapshot.
 * When the reference is not in the pool the result is empty and {@code referenceFound} is false.
 */
public record SimilarityResult(
        String referenceId,
        boolean referenceFound,
        long snapshotVersion,
        List<SimilarityMatch> matches
) {
    public SimilarityResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static SimilarityResult notFound(String referenceId, long snapshotVersion) {
        return new SimilarityResult(referenceId, false, snapshotVersion, List.of());
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public int size() {
        return matches.size();
    }
}
