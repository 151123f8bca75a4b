package com.resume.network.llm;

import com.resume.network.query.StructuredQuery;

import java.util.Objects;

/**
 * A structured query produced from free text, with the path that produced it.
 *
 * @param query          the translated query
 * @param provenance     ORACLE or FALLBACK
 * @param fallbackReason why the oracle answer was not used; null for ORACLE
 * @param oracleName     the oracle that was consulted
 */
public record TranslatedQuery(StructuredQuery query, Provenance provenance, String fallbackReason, String oracleName) {

    public TranslatedQuery {
        Objects.requireNonNull(query, "query is required");
        Objects.requireNonNull(provenance, "provenance is required");
    }

    public static TranslatedQuery fromOracle(StructuredQuery query, String oracleName) {
        return new TranslatedQuery(query, Provenance.ORACLE, null, oracleName);
    }

    public static TranslatedQuery fallback(StructuredQuery query, String reason, String oracleName) {
        return new TranslatedQuery(query, Provenance.FALLBACK, reason, oracleName);
    }

    public boolean isFallback() {
        return provenance == Provenance.FALLBACK;
    }
}
