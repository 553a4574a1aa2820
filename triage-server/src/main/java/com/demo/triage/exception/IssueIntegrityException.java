package com.demo.triage.exception;

/**
 * Issue store invariant was broken, e.g. a message joining a second issue or an
 * embedding of the wrong dimension. Not recoverable automatically.
 */
public class IssueIntegrityException extends TriageException {

    public IssueIntegrityException(String message) {
        super(message);
    }
}
