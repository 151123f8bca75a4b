package com.resume.network.core.model;

import java.util.Objects;

/**
 * Colleague relationship between two candidates. Overlap edges come from roles at the same
 * organization during overlapping intervals; {@link RelationshipType#DIRECT_COLLEAGUE} edges
 * come from a colleague named in a resume and carry the naming role's organization and interval,
 * which is null when that role has no usable dates. The pair is unordered and stored canonically
 * with {@code candidateA < candidateB}.
 *
 * @param candidateA       lexicographically smaller candidate id
 * @param candidateB       lexicographically larger candidate id
 * @param organizationKey  shared canonical organization key
 * @param organization     organization display name
 * @param sharedDepartment normalized department both roles belong to, or null
 * @param overlap          shared half-open interval; null only for an undated direct colleague
 * @param relationshipType current, former or direct colleague
 */
public record ColleagueEdge(
        String candidateA,
        String candidateB,
        String organizationKey,
        String organization,
        String sharedDepartment,
        DateInterval overlap,
        RelationshipType relationshipType
) {
    public ColleagueEdge {
        Objects.requireNonNull(candidateA, "candidateA is required");
        Objects.requireNonNull(candidateB, "candidateB is required");
        Objects.requireNonNull(organizationKey, "organizationKey is required");
        Objects.requireNonNull(relationshipType, "relationshipType is required");
        if (overlap == null && relationshipType != RelationshipType.DIRECT_COLLEAGUE) {
            throw new IllegalArgumentException("overlap is required for " + relationshipType);
        }
        if (candidateA.equals(candidateB)) {
            throw new IllegalArgumentException("A colleague edge needs two distinct candidates: " + candidateA);
        }
        if (candidateA.compareTo(candidateB) > 0) {
            String swap = candidateA;
            candidateA = candidateB;
            candidateB = swap;
        }
    }

    public boolean involves(String candidateId) {
        return candidateA.equals(candidateId) || candidateB.equals(candidateId);
    }

    /**
     * Returns the candidate on the other side of the edge.
     */
    public String otherEnd(String candidateId) {
        if (candidateA.equals(candidateId)) {
            return candidateB;
        }
        if (candidateB.equals(candidateId)) {
            return candidateA;
        }
        throw new IllegalArgumentException("Candidate " + candidateId + " is not part of " + this);
    }

    public boolean hasOverlap() {
        return overlap != null;
    }

    public boolean hasSharedDepartment() {
        return sharedDepartment != null && !sharedDepartment.isBlank();
    }

    public long overlapDays() {
        return overlap != null ? overlap.days() : 0;
    }

    public long overlapMonths() {
        return overlap != null ? overlap.months() : 0;
    }
}
