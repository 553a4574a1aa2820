package com.demo.triage.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Push notification naming the issue that changed. Viewers re-fetch the issue by id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IssueEvent {

    private Type type;

    @JsonProperty("issue_id")
    private Long issueId;

    @JsonProperty("message_id")
    private Long messageId;

    // Delivery order on the node the viewer is connected to, assigned by its broadcaster
    private Long sequence;

    private Instant timestamp;

    public enum Type {
        @JsonProperty("new_message")
        NEW_MESSAGE,
        @JsonProperty("issue_resolved")
        ISSUE_RESOLVED
    }

    public static IssueEvent newMessage(Long issueId, Long messageId) {
        return IssueEvent.builder()
                .type(Type.NEW_MESSAGE)
                .issueId(issueId)
                .messageId(messageId)
                .build();
    }

    public static IssueEvent issueResolved(Long issueId) {
        return IssueEvent.builder()
                .type(Type.ISSUE_RESOLVED)
                .issueId(issueId)
                .build();
    }
}
