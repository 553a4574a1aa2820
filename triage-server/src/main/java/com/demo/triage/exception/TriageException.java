package com.demo.triage.exception;

/**
 * Base type for failures raised by the triage pipeline.
 */
public class TriageException extends RuntimeException {

    public TriageException(String message) {
        super(message);
    }

    public TriageException(String message, Throwable cause) {
        super(message, cause);
    }
}
