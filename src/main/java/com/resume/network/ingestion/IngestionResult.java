package com.resume.network.ingestion;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of an ingestion batch.
 *
 * @param totalRecords    number of resumes in the input
 * @param acceptedIds     ids of the candidates that were normalized and published
 * @param errors          one entry per rejected resume
 * @param snapshotVersion version of the pool snapshot published for this batch
 */
public record IngestionResult(
        long totalRecords,
        List<String> acceptedIds,
        List<IngestionError> errors,
        long snapshotVersion
) {
    public IngestionResult {
        acceptedIds = acceptedIds != null ? List.copyOf(acceptedIds) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static IngestionResult empty(long snapshotVersion) {
        return new IngestionResult(0, List.of(), List.of(), snapshotVersion);
    }

    public long successCount() {
        return acceptedIds.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Combines this result with the result of a later batch. Record numbers of the later batch
     * are shifted past this batch.
     */
    public IngestionResult merge(IngestionResult later) {
        List<String> ids = new ArrayList<>(acceptedIds);
        ids.addAll(later.acceptedIds);
        List<IngestionError> allErrors = new ArrayList<>(errors);
        for (IngestionError error : later.errors) {
            allErrors.add(new IngestionError(error.recordNumber() + totalRecords, error.resumeLabel(), error.message()));
        }
        return new IngestionResult(totalRecords + later.totalRecords, ids, allErrors,
                Math.max(snapshotVersion, later.snapshotVersion));
    }

    /**
     * Represents a resume that could not be ingested.
     *
     * @param recordNumber position in the input (1-based)
     * @param resumeLabel  id or source of the resume
     * @param message      the error message
     */
    public record IngestionError(long recordNumber, String resumeLabel, String message) {}

    @Override
    public String toString() {
        return "IngestionResult{total=" + totalRecords +
                ", accepted=" + acceptedIds.size() +
                ", errors=" + errors.size() +
                ", version=" + snapshotVersion + '}';
    }
}
