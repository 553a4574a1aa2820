package com.demo.triage.exception;

/**
 * The match lock could not be acquired in time. Retryable.
 */
public class MatchLockTimeoutException extends TriageException {

    public MatchLockTimeoutException(String message) {
        super(message);
    }

    public MatchLockTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
