package com.resume.network.query;

/**
 * Runtime exception thrown when a structured query or page request is malformed.
 * Carries the name of the offending field.
 */
public class QueryValidationException extends RuntimeException {

    private final String field;
    private final String reason;

    public QueryValidationException(String field, String reason) {
        super(field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    /**
     * The message without the field prefix.
     */
    public String getReason() {
        return reason;
    }
}
