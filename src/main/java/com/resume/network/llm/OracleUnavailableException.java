package com.resume.network.llm;

/**
 * Runtime exception thrown by a {@link QueryOracle} that cannot answer.
 * Never surfaces to callers: the translator falls back to keyword translation.
 */
public class OracleUnavailableException extends RuntimeException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
