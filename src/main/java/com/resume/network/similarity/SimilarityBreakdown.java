package com.resume.network.similarity;

import java.util.List;

/**
 * Detailed breakdown of a candidate similarity score, feature by feature, together with the
 * reasons behind it.
 *
 * @param skillScore         skill-set Jaccard
 * @param organizationScore  1.0 when at least one organization is shared
 * @param seniorityScore     seniority proximity
 * @param titleScore         role-title token Jaccard
 * @param compositeScore     weighted sum of the feature scores
 * @param sharedSkills       skills held by both candidates, sorted
 * @param sharedOrganizations organizations both worked at, as written by the reference
 * @param sharedDepartments  department labels both worked in
 * @param similarExperience  whether total experience differs by at most two years
 * @param weights            weights used for the composite score
 */
public record SimilarityBreakdown(
        double skillScore,
        double organizationScore,
        double seniorityScore,
        double titleScore,
        double compositeScore,
        List<String> sharedSkills,
        List<String> sharedOrganizations,
        List<String> sharedDepartments,
        boolean similarExperience,
        SimilarityWeights weights
) {
    public SimilarityBreakdown {
        sharedSkills = sharedSkills != null ? List.copyOf(sharedSkills) : List.of();
        sharedOrganizations = sharedOrganizations != null ? List.copyOf(sharedOrganizations) : List.of();
        sharedDepartments = sharedDepartments != null ? List.copyOf(sharedDepartments) : List.of();
    }

    public int skillOverlap() {
        return sharedSkills.size();
    }

    @Override
    public String toString() {
        return String.format(
                "SimilarityBreakdown{skills=%.4f (w=%.2f), organization=%.4f (w=%.2f), seniority=%.4f (w=%.2f), title=%.4f (w=%.2f), composite=%.4f}",
                skillScore, weights.skillWeight(),
                organizationScore, weights.organizationWeight(),
                seniorityScore, weights.seniorityWeight(),
                titleScore, weights.titleWeight(),
                compositeScore
        );
    }
}
