package com.resume.network.ingestion;

/**
 * Thrown when a raw resume has nothing usable to index: no name and no datable experience.
 */
public class NormalizationException extends RuntimeException {

    private final String resumeLabel;

    public NormalizationException(String resumeLabel, String message) {
        super(message);
        this.resumeLabel = resumeLabel;
    }

    public NormalizationException(String resumeLabel, String message, Throwable cause) {
        super(message, cause);
        this.resumeLabel = resumeLabel;
    }

    public String getResumeLabel() {
        return resumeLabel;
    }
}
