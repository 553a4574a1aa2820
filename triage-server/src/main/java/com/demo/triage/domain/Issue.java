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
 * Tracked conversation thread clustered from one or more relevant messages.
 */
@Entity
@Table(name = "issues", indexes = {
    @Index(name = "idx_issue_status", columnList = "status"),
    @Index(name = "idx_issue_updated_at", columnList = "updated_at")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Issue implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(length = 1000)
    private String summary;

    @Column(length = 50)
    private String classification;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private IssueStatus status;

    @JsonIgnore
    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "representative_embedding", nullable = false, length = 100000)
    private double[] representativeEmbedding;

    @JsonProperty("member_count")
    @Column(name = "member_count", nullable = false)
    private int memberCount;

    // Confidence of the member the current title and summary were taken from
    @JsonIgnore
    @Column(name = "title_confidence")
    private Double titleConfidence;

    @JsonProperty("created_at")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @JsonProperty("updated_at")
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @JsonProperty("resolved_at")
    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @JsonIgnore
    @Version
    private Long version;

    public enum IssueStatus {
        @JsonProperty("open")
        OPEN,
        @JsonProperty("resolved")
        RESOLVED
    }

    /**
     * New open issue seeded from its first member.
     */
    public static Issue seed(Message first, String title, String summary, Instant now) {
        return Issue.builder()
                .title(title)
                .summary(summary)
                .classification(first.getClassification())
                .status(IssueStatus.OPEN)
                .representativeEmbedding(first.getEmbedding().clone())
                .memberCount(1)
                .titleConfidence(first.getConfidence())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Folds a new member into the running-mean centroid and bumps the activity time.
     * The centroid depends only on the ordered sequence of member embeddings.
     */
    public void absorb(Message member, Instant now) {
        memberCount = memberCount + 1;
        representativeEmbedding = VectorMath.runningMean(representativeEmbedding, member.getEmbedding(), memberCount);
        if (member.getClassification() != null) {
            classification = member.getClassification();
        }
        touch(now);
    }

    /**
     * Replaces title and summary when the member is a more confident description of the issue.
     *
     * @return true if the text was refreshed
     */
    public boolean offerDescription(String candidateTitle, String candidateSummary, Double confidence) {
        if (confidence == null) {
            return false;
        }
        if (titleConfidence != null && confidence <= titleConfidence) {
            return false;
        }
        title = candidateTitle;
        summary = candidateSummary;
        titleConfidence = confidence;
        return true;
    }

    public void resolve(Instant now) {
        status = IssueStatus.RESOLVED;
        resolvedAt = now;
        touch(now);
    }

    public void reopen(Instant now) {
        status = IssueStatus.OPEN;
        resolvedAt = null;
        touch(now);
    }

    @JsonIgnore
    public boolean isOpen() {
        return status == IssueStatus.OPEN;
    }

    @JsonIgnore
    public int getDimension() {
        return representativeEmbedding == null ? 0 : representativeEmbedding.length;
    }

    // updated_at never moves backwards, even if the clock does
    private void touch(Instant now) {
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = IssueStatus.OPEN;
        }
    }
}
