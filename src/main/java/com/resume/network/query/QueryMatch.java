package com.resume.network.query;

import com.resume.network.core.model.Candidate;

import java.util.List;

/**
 * A candidate matching a structured query.
 *
 * @param candidate         the matching candidate
 * @param matchedDimensions filter dimensions the candidate satisfied, one entry per matched term
 *                          for free-text terms
 * @param matchedSkills     requested skills the candidate holds
 */
public record QueryMatch(Candidate candidate, List<QueryDimension> matchedDimensions, List<String> matchedSkills) {

    public QueryMatch {
        matchedDimensions = matchedDimensions != null ? List.copyOf(matchedDimensions) : List.of();
        matchedSkills = matchedSkills != null ? List.copyOf(matchedSkills) : List.of();
    }

    public String candidateId() {
        return candidate.getId();
    }

    public int matchedDimensionCount() {
        return matchedDimensions.size();
    }

    public int skillOverlap() {
        return matchedSkills.size();
    }
}
