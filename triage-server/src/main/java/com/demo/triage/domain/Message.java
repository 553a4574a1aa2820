package com.demo.triage.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Chat message persisted at ingestion.
 *
 * Content fields are written once. Processing fields (classification, embedding,
 * issue membership) are only ever filled in, never reverted.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_message_issue_id", columnList = "issue_id"),
    @Index(name = "idx_message_status", columnList = "status")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonProperty("source_ref")
    @Column(name = "source_ref", nullable = false, unique = true, updatable = false, length = 200)
    private String sourceRef;

    @JsonProperty("channel_id")
    @Column(name = "channel_id", updatable = false, length = 100)
    private String channelId;

    @JsonProperty("author_ref")
    @Column(name = "author_ref", nullable = false, updatable = false, length = 100)
    private String authorRef;

    @Column(nullable = false, updatable = false, length = 40000)
    private String text;

    @JsonProperty("sent_at")
    @Column(name = "sent_at", updatable = false)
    private Instant sentAt;

    @Column(length = 50)
    private String classification;

    private Double confidence;

    @JsonProperty("is_relevant")
    @Column(name = "is_relevant")
    private Boolean relevant;

    // Summary suggested by the classifier, used to title a new issue
    @Column(length = 1000)
    private String summary;

    @JsonIgnore
    @Convert(converter = EmbeddingConverter.class)
    @Column(length = 100000)
    private double[] embedding;

    @JsonProperty("issue_id")
    @Column(name = "issue_id")
    private Long issueId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ProcessingStatus status;

    private int attempts;

    @JsonProperty("last_error")
    @Column(name = "last_error", length = 500)
    private String lastError;

    @JsonProperty("created_at")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum ProcessingStatus {
        /** Waiting for a collaborator that has not succeeded yet. */
        PENDING,
        /** Pending message that used up its automatic retries. */
        PARKED,
        IRRELEVANT,
        CLUSTERED
    }

    @JsonIgnore
    public boolean isAwaitingProcessing() {
        return status == ProcessingStatus.PENDING || status == ProcessingStatus.PARKED;
    }

    @JsonIgnore
    public boolean isClassified() {
        return classification != null && relevant != null;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = ProcessingStatus.PENDING;
        }
    }
}
