package com.resume.network.query;

import java.util.List;

/**
 * A page of structured query results.
 *
 * @param matches         the matches of this page
 * @param totalMatches    total number of matches across all pages
 * @param page            the current page number (0-based)
 * @param pageSize        the effective page size, after clamping
 * @param snapshotVersion version of the pool snapshot the query ran against
 */
public record QueryPage(List<QueryMatch> matches, long totalMatches, int page, int pageSize, long snapshotVersion) {

    public QueryPage {
        matches = matches != null ? List.copyOf(matches) : List.of();
        if (totalMatches < 0) {
            throw new IllegalArgumentException("totalMatches must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) (page + 1) * pageSize < totalMatches;
    }

    public boolean hasPrevious() {
        return page > 0;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalMatches / pageSize);
    }

    public int numberOfMatches() {
        return matches.size();
    }

    public boolean hasContent() {
        return !matches.isEmpty();
    }
}
