package com.demo.triage.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relevance verdict returned by the classifier collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassificationResult {

    public static final String IRRELEVANT_LABEL = "irrelevant";

    private String label;

    private Double confidence;

    @JsonProperty("is_relevant")
    private Boolean relevant;

    // Optional short description of the problem, when the model offers one
    private String summary;

    /**
     * A response missing any required field, or with confidence outside [0, 1], is malformed
     * and must never be taken as relevant.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return label != null && !label.isBlank()
                && relevant != null
                && confidence != null
                && !confidence.isNaN()
                && confidence >= 0.0 && confidence <= 1.0;
    }

    public static ClassificationResult irrelevant() {
        return ClassificationResult.builder()
                .label(IRRELEVANT_LABEL)
                .confidence(0.0)
                .relevant(false)
                .build();
    }
}
