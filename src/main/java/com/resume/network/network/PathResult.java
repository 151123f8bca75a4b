package com.resume.network.network;

import com.resume.network.core.model.ColleagueEdge;

import java.util.List;

/**
 * Outcome of a shortest-path lookup. A path is either complete or absent, never partial.
 *
 * @param status       FOUND, UNREACHABLE or UNKNOWN_CANDIDATE
 * @param fromId       source candidate
 * @param toId         target candidate
 * @param candidateIds candidates along the path, both ends included; empty unless FOUND
 * @param hops         one connecting edge per hop; empty unless FOUND
 */
public record PathResult(
        Status status,
        String fromId,
        String toId,
        List<String> candidateIds,
        List<ColleagueEdge> hops
) {
    public enum Status {
        FOUND,
        UNREACHABLE,
        UNKNOWN_CANDIDATE
    }

    public PathResult {
        candidateIds = candidateIds != null ? List.copyOf(candidateIds) : List.of();
        hops = hops != null ? List.copyOf(hops) : List.of();
    }

    public static PathResult found(String fromId, String toId, List<String> candidateIds, List<ColleagueEdge> hops) {
        return new PathResult(Status.FOUND, fromId, toId, candidateIds, hops);
    }

    public static PathResult unreachable(String fromId, String toId) {
        return new PathResult(Status.UNREACHABLE, fromId, toId, List.of(), List.of());
    }

    public static PathResult unknownCandidate(String fromId, String toId) {
        return new PathResult(Status.UNKNOWN_CANDIDATE, fromId, toId, List.of(), List.of());
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * Number of hops; 0 for a path from a candidate to itself, -1 when no path exists.
     */
    public int length() {
        return isFound() ? hops.size() : -1;
    }
}
