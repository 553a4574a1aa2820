package com.demo.triage.service;

import com.demo.triage.domain.ClassificationResult;
import com.demo.triage.domain.InboundMessage;
import com.demo.triage.domain.IngestionResult;
import com.demo.triage.domain.Issue;
import com.demo.triage.domain.IssueEvent;
import com.demo.triage.domain.MatchDecision;
import com.demo.triage.domain.Message;
import com.demo.triage.domain.ValidationResult;
import com.demo.triage.exception.CollaboratorException;
import com.demo.triage.exception.DuplicateMessageException;
import com.demo.triage.exception.IssueIntegrityException;
import com.demo.triage.exception.IssueNotFoundException;
import com.demo.triage.exception.MatchLockTimeoutException;
import com.demo.triage.exception.MessageNotFoundException;
import com.demo.triage.exception.TriageException;
import com.demo.triage.infrastructure.Embedder;
import com.demo.triage.infrastructure.IssueEventBroadcaster;
import com.demo.triage.infrastructure.IssueStore;
import com.demo.triage.infrastructure.MatchLock;
import com.demo.triage.infrastructure.RelevanceClassifier;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Drives a chat record through dedup, classification, embedding and matching,
 * and owns the resolve command.
 *
 * <p>A message is advanced by at most one thread at a time. Collaborator failures
 * leave it {@code PENDING} with the error recorded; the retry sweep or an explicit
 * retry picks it up again from the first missing step.
 */
@Service
@Slf4j
public class IngestionCoordinator {

    private static final int MAX_ERROR_LENGTH = 500;

    private final IssueStore issueStore;
    private final RelevanceClassifier classifier;
    private final Embedder embedder;
    private final IssueMatcher matcher;
    private final MatchLock matchLock;
    private final IssueEventBroadcaster broadcaster;
    private final MetricsService metricsService;
    private final ExecutorService ingestionExecutor;
    private final Clock clock;
    private final int maxAttempts;

    // Message ids currently being advanced on this node
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public IngestionCoordinator(IssueStore issueStore,
                                RelevanceClassifier classifier,
                                Embedder embedder,
                                IssueMatcher matcher,
                                MatchLock matchLock,
                                IssueEventBroadcaster broadcaster,
                                MetricsService metricsService,
                                @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor,
                                Clock clock,
                                @Value("${triage.ingestion.max-attempts:5}") int maxAttempts) {
        this.issueStore = issueStore;
        this.classifier = classifier;
        this.embedder = embedder;
        this.matcher = matcher;
        this.matchLock = matchLock;
        this.broadcaster = broadcaster;
        this.metricsService = metricsService;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Runs {@link #ingest} on the ingestion workers.
     */
    public CompletableFuture<IngestionResult> submit(InboundMessage inbound) {
        return CompletableFuture.supplyAsync(() -> ingest(inbound), ingestionExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Async ingestion failed: sourceRef={}", inbound.resolveSourceRef(), error);
                    }
                });
    }

    /**
     * Stores and processes one inbound record. Ingesting the same source reference
     * again has no effect beyond the first call.
     *
     * @throws IllegalArgumentException if the record is invalid
     * @throws IssueIntegrityException on a store integrity violation
     */
    public IngestionResult ingest(InboundMessage inbound) {
        ValidationResult validation = inbound.validate();
        if (!validation.isValid()) {
            throw new IllegalArgumentException(validation.getErrorMessage());
        }

        String sourceRef = inbound.resolveSourceRef();
        if (inbound.isBot()) {
            log.debug("Ignoring bot message: sourceRef={}", sourceRef);
            return record(IngestionResult.builder()
                    .outcome(IngestionResult.Outcome.IGNORED)
                    .sourceRef(sourceRef)
                    .build());
        }

        Optional<Message> existing = issueStore.findMessageBySourceRef(sourceRef);
        if (existing.isPresent()) {
            log.debug("Duplicate message skipped: sourceRef={}, messageId={}", sourceRef, existing.get().getId());
            return record(IngestionResult.of(IngestionResult.Outcome.DUPLICATE, existing.get()));
        }

        Message message;
        try {
            message = issueStore.insertMessage(Message.builder()
                    .sourceRef(sourceRef)
                    .channelId(inbound.getChannelId())
                    .authorRef(inbound.getAuthorRef())
                    .text(inbound.getText())
                    .sentAt(inbound.resolveSentAt())
                    .status(Message.ProcessingStatus.PENDING)
                    .createdAt(clock.instant())
                    .build());
        } catch (DuplicateMessageException e) {
            log.debug("Duplicate message lost insert race: sourceRef={}", sourceRef);
            return record(IngestionResult.builder()
                    .outcome(IngestionResult.Outcome.DUPLICATE)
                    .sourceRef(sourceRef)
                    .build());
        }

        log.info("Message stored: messageId={}, sourceRef={}, author={}",
                message.getId(), sourceRef, message.getAuthorRef());
        return record(advance(message));
    }

    /**
     * Re-advances one pending or parked message.
     *
     * @throws MessageNotFoundException if no such message exists
     */
    public IngestionResult retry(Long messageId) {
        Message message = issueStore.findMessage(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        if (!message.isAwaitingProcessing()) {
            return IngestionResult.of(outcomeOf(message), message);
        }
        log.info("Retrying message: messageId={}, status={}, attempts={}",
                messageId, message.getStatus(), message.getAttempts());
        return record(advance(message));
    }

    /**
     * Re-advances every {@code PENDING} message, oldest first.
     *
     * @return number of messages that left the pending state
     */
    public int retryPending() {
        List<Message> pending = issueStore.findMessagesByStatus(Message.ProcessingStatus.PENDING);
        if (pending.isEmpty()) {
            return 0;
        }
        log.info("Retry sweep started: pending={}", pending.size());

        int advanced = 0;
        for (Message message : pending) {
            try {
                IngestionResult result = record(advance(message));
                if (result.getOutcome() == IngestionResult.Outcome.CLUSTERED
                        || result.getOutcome() == IngestionResult.Outcome.IRRELEVANT) {
                    advanced++;
                }
            } catch (TriageException e) {
                log.error("Retry failed: messageId={}, error={}", message.getId(), e.getMessage(), e);
            }
        }
        log.info("Retry sweep finished: pending={}, advanced={}", pending.size(), advanced);
        return advanced;
    }

    /**
     * Marks an issue resolved and notifies viewers. Resolving a resolved issue
     * returns it unchanged and emits nothing.
     *
     * @throws IssueNotFoundException if no such issue exists
     */
    public Issue resolve(Long issueId) {
        return matchLock.execute(() -> {
            Issue issue = issueStore.getIssue(issueId)
                    .orElseThrow(() -> new IssueNotFoundException(issueId));
            if (!issue.isOpen()) {
                log.debug("Issue already resolved: issueId={}", issueId);
                return issue;
            }
            Issue resolved = issueStore.updateIssueStatus(issueId, Issue.IssueStatus.RESOLVED, clock.instant());
            IssueEvent event = broadcaster.publish(IssueEvent.issueResolved(issueId));
            metricsService.recordEventPublished(event.getType().name());
            log.info("Issue resolved: issueId={}, members={}", issueId, resolved.getMemberCount());
            return resolved;
        });
    }

    private IngestionResult advance(Message snapshot) {
        Long messageId = snapshot.getId();
        if (!inFlight.add(messageId)) {
            log.debug("Message already being processed: messageId={}", messageId);
            return IngestionResult.of(IngestionResult.Outcome.PENDING, snapshot);
        }
        Message message = snapshot;
        MetricsService.TimerSample sample = metricsService.startTimer();
        try {
            // The caller's copy may predate a concurrent finish
            message = issueStore.findMessage(messageId)
                    .orElseThrow(() -> new MessageNotFoundException(messageId));
            if (!message.isAwaitingProcessing()) {
                log.debug("Message already finished: messageId={}, status={}", messageId, message.getStatus());
                return IngestionResult.of(outcomeOf(message), message);
            }

            if (!message.isClassified()) {
                ClassificationResult verdict = classifier.classify(message.getText());
                message.setClassification(verdict.getLabel());
                message.setConfidence(verdict.getConfidence());
                message.setRelevant(verdict.getRelevant());
                message.setSummary(verdict.getSummary());

                if (!Boolean.TRUE.equals(verdict.getRelevant())) {
                    message.setStatus(Message.ProcessingStatus.IRRELEVANT);
                    message.setLastError(null);
                    Message saved = issueStore.saveMessage(message);
                    log.info("Message irrelevant: messageId={}, label={}", saved.getId(), saved.getClassification());
                    return IngestionResult.of(IngestionResult.Outcome.IRRELEVANT, saved);
                }
                message = issueStore.saveMessage(message);
            }

            if (message.getEmbedding() == null) {
                message.setEmbedding(embedder.embed(message.getText()));
            }

            MatchDecision decision = matcher.match(message, this::publishNewMessage);
            metricsService.recordMatch(decision.getOutcome().name(), decision.getSimilarity());

            return IngestionResult.builder()
                    .outcome(IngestionResult.Outcome.CLUSTERED)
                    .sourceRef(message.getSourceRef())
                    .messageId(message.getId())
                    .issueId(decision.getIssue().getId())
                    .matchOutcome(decision.getOutcome())
                    .build();

        } catch (CollaboratorException e) {
            metricsService.recordCollaboratorFailure(e.getCollaborator());
            return markFailed(message, e);
        } catch (MatchLockTimeoutException e) {
            return markFailed(message, e);
        } catch (IssueIntegrityException e) {
            log.error("Issue integrity violation: messageId={}, error={}", message.getId(), e.getMessage(), e);
            throw e;
        } finally {
            metricsService.stopTimer(sample, "ingestion.advance", Tags.of("status", String.valueOf(message.getStatus())));
            inFlight.remove(messageId);
        }
    }

    private void publishNewMessage(MatchDecision decision) {
        IssueEvent event = broadcaster.publish(
                IssueEvent.newMessage(decision.getIssue().getId(), decision.getMessage().getId()));
        metricsService.recordEventPublished(event.getType().name());
    }

    private IngestionResult markFailed(Message message, TriageException cause) {
        int attempts = message.getAttempts() + 1;
        boolean parked = attempts >= maxAttempts;
        message.setAttempts(attempts);
        message.setLastError(truncate(cause.getMessage()));
        message.setStatus(parked ? Message.ProcessingStatus.PARKED : Message.ProcessingStatus.PENDING);
        Message saved = issueStore.saveMessage(message);

        if (parked) {
            log.error("Message parked after {} attempts: messageId={}, error={}",
                    attempts, saved.getId(), cause.getMessage());
            return IngestionResult.of(IngestionResult.Outcome.PARKED, saved);
        }
        log.warn("Message pending: messageId={}, attempts={}/{}, error={}",
                saved.getId(), attempts, maxAttempts, cause.getMessage());
        return IngestionResult.of(IngestionResult.Outcome.PENDING, saved);
    }

    private IngestionResult record(IngestionResult result) {
        metricsService.recordIngestion(result.getOutcome().name());
        return result;
    }

    private static IngestionResult.Outcome outcomeOf(Message message) {
        switch (message.getStatus()) {
            case CLUSTERED:
                return IngestionResult.Outcome.CLUSTERED;
            case IRRELEVANT:
                return IngestionResult.Outcome.IRRELEVANT;
            case PARKED:
                return IngestionResult.Outcome.PARKED;
            default:
                return IngestionResult.Outcome.PENDING;
        }
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
