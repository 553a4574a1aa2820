package com.demo.triage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Clustering settings, bound from {@code triage.matcher.*}.
 */
@Data
@ConfigurationProperties(prefix = "triage.matcher")
public class MatcherProperties {

    /**
     * Minimum cosine similarity for a message to join an existing issue.
     */
    private double similarityThreshold = 0.75;

    /**
     * Similarities closer than this are ties, broken by recency.
     */
    private double tieEpsilon = 1e-9;

    private ResolvedPolicy resolvedPolicy = ResolvedPolicy.SPAWN_NEW;

    private int titleMaxLength = 60;

    private int summaryMaxLength = 240;

    public enum ResolvedPolicy {
        /** Resolved issues are never candidates; the topic starts a fresh issue. */
        SPAWN_NEW,
        /** Resolved issues stay candidates; a match reopens them. */
        REOPEN
    }
}
