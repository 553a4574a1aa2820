package com.demo.triage.exception;

public class MessageNotFoundException extends TriageException {

    public MessageNotFoundException(Long messageId) {
        super("Message not found: " + messageId);
    }
}
