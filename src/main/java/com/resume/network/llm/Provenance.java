package com.resume.network.llm;

/**
 * Which path produced a translated query.
 */
public enum Provenance {
    /** The oracle answered in time and its response passed validation. */
    ORACLE,
    /** The deterministic keyword translator produced the query. */
    FALLBACK
}
