package com.demo.triage.service;

import com.demo.triage.config.MatcherProperties;
import com.demo.triage.domain.Message;
import org.springframework.stereotype.Component;

/**
 * Derives issue titles and summaries from a member message.
 * Prefers the classifier's summary, falls back to the message text.
 */
@Component
public class IssueTextDeriver {

    private static final String ELLIPSIS = "...";

    private final MatcherProperties properties;

    public IssueTextDeriver(MatcherProperties properties) {
        this.properties = properties;
    }

    public String title(Message message) {
        return abbreviate(source(message), properties.getTitleMaxLength());
    }

    public String summary(Message message) {
        return abbreviate(source(message), properties.getSummaryMaxLength());
    }

    private static String source(Message message) {
        String summary = message.getSummary();
        if (summary != null && !summary.isBlank()) {
            return summary;
        }
        return message.getText();
    }

    /**
     * Collapses whitespace and cuts at a word boundary when the text is too long.
     */
    static String abbreviate(String text, int maxLength) {
        String collapsed = text == null ? "" : text.strip().replaceAll("\\s+", " ");
        if (collapsed.length() <= maxLength) {
            return collapsed;
        }
        int limit = Math.max(maxLength - ELLIPSIS.length(), 1);
        int cut = collapsed.lastIndexOf(' ', limit);
        if (cut < limit / 2) {
            cut = limit;
        }
        return collapsed.substring(0, cut).stripTrailing() + ELLIPSIS;
    }
}
