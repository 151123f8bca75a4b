package com.resume.network.network;

/**
 * Configuration for colleague edge computation.
 *
 * @param requireSameDepartment only link candidates whose roles share a department
 * @param minOverlapMonths      minimum whole months of overlap; 0 accepts any positive overlap
 * @param parallelThreshold     organization count from which groups are processed in parallel
 * @param includeMentions       also link candidates named as colleagues in a resume; such links
 *                              ignore the department and overlap requirements
 */
public record ColleagueEdgeOptions(
        boolean requireSameDepartment,
        int minOverlapMonths,
        int parallelThreshold,
        boolean includeMentions
) {
    public static final int DEFAULT_PARALLEL_THRESHOLD = 256;

    public ColleagueEdgeOptions {
        if (minOverlapMonths < 0) {
            throw new IllegalArgumentException("minOverlapMonths must be >= 0");
        }
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold must be >= 1");
        }
    }

    /**
     * Organization overlap alone creates an edge; departments are recorded but not required.
     */
    public static ColleagueEdgeOptions defaults() {
        return new ColleagueEdgeOptions(false, 0, DEFAULT_PARALLEL_THRESHOLD, true);
    }

    /**
     * Same department and at least three months together.
     */
    public static ColleagueEdgeOptions strict() {
        return new ColleagueEdgeOptions(true, 3, DEFAULT_PARALLEL_THRESHOLD, true);
    }
}
