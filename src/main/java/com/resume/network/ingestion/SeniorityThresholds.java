package com.resume.network.ingestion;

/**
 * Experience thresholds, in months, separating seniority tiers.
 *
 * @param midFromMonths    minimum months for {@code MID}
 * @param seniorFromMonths minimum months for {@code SENIOR}
 * @param leadFromMonths   minimum months for {@code LEAD}
 */
public record SeniorityThresholds(int midFromMonths, int seniorFromMonths, int leadFromMonths) {

    public SeniorityThresholds {
        if (midFromMonths < 0) {
            throw new IllegalArgumentException("midFromMonths must be >= 0");
        }
        if (seniorFromMonths < midFromMonths || leadFromMonths < seniorFromMonths) {
            throw new IllegalArgumentException("Thresholds must be non-decreasing: "
                    + midFromMonths + ", " + seniorFromMonths + ", " + leadFromMonths);
        }
    }

    /**
     * 2 years for mid-level, 5 for senior, 10 for lead.
     */
    public static SeniorityThresholds defaults() {
        return new SeniorityThresholds(24, 60, 120);
    }
}
