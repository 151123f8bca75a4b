package com.resume.network.api;

import com.resume.network.core.model.ColleagueEdge;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Colleagues of one candidate: the connecting edges, the distinct colleague ids and the
 * connected component the candidate belongs to.
 *
 * @param candidateId     the candidate looked up
 * @param found           false when the candidate is not in the snapshot
 * @param edges           edges involving the candidate, ordered by colleague id
 * @param colleagueIds    distinct colleague ids
 * @param component       every candidate reachable from this one, itself included
 * @param snapshotVersion version of the snapshot the lookup ran against
 */
public record ColleagueLookup(
        String candidateId,
        boolean found,
        List<ColleagueEdge> edges,
        SortedSet<String> colleagueIds,
        SortedSet<String> component,
        long snapshotVersion
) {
    public ColleagueLookup {
        edges = edges != null ? List.copyOf(edges) : List.of();
        colleagueIds = Collections.unmodifiableSortedSet(colleagueIds != null ? new TreeSet<>(colleagueIds) : new TreeSet<>());
        component = Collections.unmodifiableSortedSet(component != null ? new TreeSet<>(component) : new TreeSet<>());
    }

    public static ColleagueLookup notFound(String candidateId, long snapshotVersion) {
        return new ColleagueLookup(candidateId, false, List.of(), null, null, snapshotVersion);
    }

    public int colleagueCount() {
        return colleagueIds.size();
    }
}
