package com.demo.triage.exception;

public class IssueNotFoundException extends TriageException {

    private final Long issueId;

    public IssueNotFoundException(Long issueId) {
        super("Issue not found: " + issueId);
        this.issueId = issueId;
    }

    public Long getIssueId() {
        return issueId;
    }
}
