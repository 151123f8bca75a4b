package com.resume.network.llm;

import java.util.Objects;

/**
 * Raw, untrusted oracle answer: the JSON text the oracle produced.
 * Only {@link OracleResponseValidator} turns it into a query.
 */
public record OracleResponse(String content, String oracleName) {

    public OracleResponse {
        Objects.requireNonNull(content, "content is required");
    }
}
