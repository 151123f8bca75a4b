package com.resume.network.network;

/**
 * Runtime exception thrown when a derived structure violates one of its own invariants,
 * such as a colleague graph whose adjacency is not symmetric.
 * Indicates a defect rather than bad input.
 */
public class InternalInconsistencyException extends RuntimeException {

    public InternalInconsistencyException(String message) {
        super(message);
    }

    public InternalInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
