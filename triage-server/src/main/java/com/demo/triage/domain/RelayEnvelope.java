package com.demo.triage.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Issue event as relayed between nodes over Redis pub/sub.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayEnvelope {
    private String originNode;
    private IssueEvent event;
}
