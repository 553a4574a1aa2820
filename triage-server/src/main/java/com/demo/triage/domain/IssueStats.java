package com.demo.triage.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Store-wide counters for the operator dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueStats {

    @JsonProperty("total_issues")
    private long totalIssues;

    @JsonProperty("open_issues")
    private long openIssues;

    @JsonProperty("resolved_issues")
    private long resolvedIssues;

    @JsonProperty("total_messages")
    private long totalMessages;

    @JsonProperty("relevant_messages")
    private long relevantMessages;

    @JsonProperty("pending_messages")
    private long pendingMessages;

    // message count per classification label
    private Map<String, Long> classifications;
}
