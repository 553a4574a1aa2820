package com.demo.triage.exception;

/**
 * Classifier or embedder call failed (timeout, unreachable node, malformed response).
 * Always retryable: the message stays pending.
 */
public class CollaboratorException extends TriageException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(collaborator + ": " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
