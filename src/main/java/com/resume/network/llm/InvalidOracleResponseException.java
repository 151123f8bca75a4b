package com.resume.network.llm;

/**
 * Runtime exception thrown when an oracle response is malformed or fails validation.
 */
public class InvalidOracleResponseException extends RuntimeException {

    public InvalidOracleResponseException(String message) {
        super(message);
    }

    public InvalidOracleResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
