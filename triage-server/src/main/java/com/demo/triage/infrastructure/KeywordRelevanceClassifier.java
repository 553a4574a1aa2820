package com.demo.triage.infrastructure;

import com.demo.triage.domain.ClassificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Offline keyword classifier for development and demos, used when no model service is configured.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.classifier.mode", havingValue = "keyword", matchIfMissing = true)
public class KeywordRelevanceClassifier implements RelevanceClassifier {

    private static final int SUMMARY_PREFIX_LENGTH = 30;

    private final List<Rule> rules = List.of(
            new Rule("bug_report", "Bug", 0.9, "bug", "crash", "error"),
            new Rule("support_question", "Support", 0.8, "help", "how"),
            new Rule("feature_request", "Feature", 0.8, "feature", "add")
    );

    public KeywordRelevanceClassifier() {
        log.info("KeywordRelevanceClassifier active (offline mode)");
    }

    @Override
    public ClassificationResult classify(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Rule rule : rules) {
            if (rule.matches(lower)) {
                return ClassificationResult.builder()
                        .label(rule.label)
                        .confidence(rule.confidence)
                        .relevant(true)
                        .summary(rule.summaryPrefix + ": " + prefix(text))
                        .build();
            }
        }
        return ClassificationResult.irrelevant();
    }

    private static String prefix(String text) {
        String trimmed = text.strip();
        if (trimmed.length() <= SUMMARY_PREFIX_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, SUMMARY_PREFIX_LENGTH) + "...";
    }

    private static final class Rule {
        private final String label;
        private final String summaryPrefix;
        private final double confidence;
        private final List<String> keywords;

        private Rule(String label, String summaryPrefix, double confidence, String... keywords) {
            this.label = label;
            this.summaryPrefix = summaryPrefix;
            this.confidence = confidence;
            this.keywords = List.of(keywords);
        }

        private boolean matches(String lowerText) {
            return keywords.stream().anyMatch(lowerText::contains);
        }
    }
}
