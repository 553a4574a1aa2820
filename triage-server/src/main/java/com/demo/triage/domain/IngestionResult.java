package com.demo.triage.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResult {

    Outcome outcome;

    @JsonProperty("source_ref")
    String sourceRef;

    @JsonProperty("message_id")
    Long messageId;

    @JsonProperty("issue_id")
    Long issueId;

    @JsonProperty("match_outcome")
    MatchDecision.Outcome matchOutcome;

    String error;

    public enum Outcome {
        /** source_ref already stored; nothing was done. */
        DUPLICATE,
        /** Bot-authored record; not stored. */
        IGNORED,
        IRRELEVANT,
        CLUSTERED,
        /** A collaborator failed; the message waits for a retry. */
        PENDING,
        PARKED
    }

    public static IngestionResult of(Outcome outcome, Message message) {
        return IngestionResult.builder()
                .outcome(outcome)
                .sourceRef(message.getSourceRef())
                .messageId(message.getId())
                .issueId(message.getIssueId())
                .error(message.getLastError())
                .build();
    }
}
