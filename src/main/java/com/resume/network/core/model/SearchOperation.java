package com.resume.network.core.model;

/**
 * Operations exposed to callers. Used for metrics tags, log context and cache keys.
 */
public enum SearchOperation {
    SIMILAR_CANDIDATES("similar"),
    STRUCTURED_SEARCH("structured"),
    NATURAL_LANGUAGE_SEARCH("natural_language"),
    COLLEAGUE_LOOKUP("colleagues"),
    SHORTEST_PATH("path"),
    NETWORK_STATISTICS("statistics");

    private final String tag;

    SearchOperation(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
