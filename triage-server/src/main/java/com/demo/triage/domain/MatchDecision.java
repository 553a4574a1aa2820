package com.demo.triage.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Committed outcome of matching one message against the issue set.
 */
@Value
@Builder
public class MatchDecision {

    Outcome outcome;
    Issue issue;
    Message message;
    // Similarity to the chosen issue; NaN when no candidate existed
    double similarity;

    public enum Outcome {
        CREATED,
        ATTACHED,
        REOPENED
    }

    public boolean isNewIssue() {
        return outcome == Outcome.CREATED;
    }
}
