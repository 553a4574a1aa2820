package com.demo.triage.domain;

import lombok.Value;

import java.util.List;

/**
 * Outcome of validating an inbound record before it enters the pipeline.
 */
@Value
public class ValidationResult {

    boolean valid;
    List<String> errors;

    public static ValidationResult success() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(String error) {
        return new ValidationResult(false, List.of(error));
    }

    public static ValidationResult failure(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    public String getErrorMessage() {
        return valid ? null : String.join("; ", errors);
    }
}
