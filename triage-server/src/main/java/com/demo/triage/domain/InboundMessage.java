package com.demo.triage.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalized, already verified chat record handed to the ingestion pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {

    @JsonProperty("source_ref")
    private String sourceRef;

    @JsonProperty("channel_id")
    private String channelId;

    // Platform timestamp, epoch seconds with a fractional part ("1700000000.000100")
    @JsonProperty("ts")
    private String timestamp;

    @JsonProperty("author_ref")
    private String authorRef;

    private String text;

    private boolean bot;

    /**
     * Idempotency key: explicit source reference, else channel plus platform timestamp.
     */
    @JsonIgnore
    public String resolveSourceRef() {
        if (sourceRef != null && !sourceRef.isBlank()) {
            return sourceRef;
        }
        return channelId + ":" + timestamp;
    }

    /**
     * Platform send time, or null when the timestamp is not in epoch-seconds form.
     */
    @JsonIgnore
    public Instant resolveSentAt() {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }
        try {
            BigDecimal seconds = new BigDecimal(timestamp.trim());
            long whole = seconds.setScale(0, RoundingMode.FLOOR).longValueExact();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            return null;
        }
    }

    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (text == null || text.isBlank()) {
            errors.add("text is required");
        }
        if (authorRef == null || authorRef.isBlank()) {
            errors.add("author_ref is required");
        }
        boolean hasSourceRef = sourceRef != null && !sourceRef.isBlank();
        boolean hasChannelAndTs = channelId != null && !channelId.isBlank()
                && timestamp != null && !timestamp.isBlank();
        if (!hasSourceRef && !hasChannelAndTs) {
            errors.add("source_ref or channel_id and ts are required");
        }
        if (hasSourceRef && sourceRef.length() > 200) {
            errors.add("source_ref exceeds 200 characters");
        }
        if (text != null && text.length() > 40000) {
            errors.add("text exceeds 40000 characters");
        }
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }
}
