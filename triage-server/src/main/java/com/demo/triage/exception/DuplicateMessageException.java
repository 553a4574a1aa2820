package com.demo.triage.exception;

/**
 * A message with the same source reference is already stored.
 */
public class DuplicateMessageException extends TriageException {

    public DuplicateMessageException(String sourceRef, Throwable cause) {
        super("Message already stored: sourceRef=" + sourceRef, cause);
    }
}
