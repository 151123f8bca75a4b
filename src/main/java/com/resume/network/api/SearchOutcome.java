package com.resume.network.api;

import com.resume.network.network.InternalInconsistencyException;
import com.resume.network.query.QueryValidationException;

import java.util.Optional;

/**
 * Outcome of a {@link SearchRequest}. {@code OK} covers empty results too; failures carry the
 * offending field (validation) or a message (internal error) instead of a result.
 *
 * @param <R> the result type of the request
 */
public record SearchOutcome<R>(
        Status status,
        R result,
        String errorField,
        String errorMessage,
        long snapshotVersion,
        String correlationId
) {
    public enum Status {
        OK,
        VALIDATION_ERROR,
        INTERNAL_ERROR
    }

    public static <R> SearchOutcome<R> ok(R result, long snapshotVersion, String correlationId) {
        return new SearchOutcome<>(Status.OK, result, null, null, snapshotVersion, correlationId);
    }

    public static <R> SearchOutcome<R> validationError(String field, String message, long snapshotVersion,
                                                       String correlationId) {
        return new SearchOutcome<>(Status.VALIDATION_ERROR, null, field, message, snapshotVersion, correlationId);
    }

    public static <R> SearchOutcome<R> internalError(String message, long snapshotVersion, String correlationId) {
        return new SearchOutcome<>(Status.INTERNAL_ERROR, null, null, message, snapshotVersion, correlationId);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Optional<R> toOptional() {
        return Optional.ofNullable(result);
    }

    /**
     * Returns the result, or rethrows the failure as the matching exception.
     */
    public R getOrThrow() {
        switch (status) {
            case OK:
                return result;
            case VALIDATION_ERROR:
                throw new QueryValidationException(errorField, errorMessage);
            default:
                throw new InternalInconsistencyException(errorMessage);
        }
    }
}
