package com.demo.triage.service;

import com.demo.triage.config.MatcherProperties;
import com.demo.triage.domain.InboundMessage;
import com.demo.triage.domain.IngestionResult;
import com.demo.triage.domain.Issue;
import com.demo.triage.domain.IssueEvent;
import com.demo.triage.domain.MatchDecision;
import com.demo.triage.domain.Message;
import com.demo.triage.exception.CollaboratorException;
import com.demo.triage.exception.IssueIntegrityException;
import com.demo.triage.exception.IssueNotFoundException;
import com.demo.triage.exception.MessageNotFoundException;
import com.demo.triage.infrastructure.HashingEmbedder;
import com.demo.triage.infrastructure.InMemoryIssueStore;
import com.demo.triage.infrastructure.IssueEventBroadcaster;
import com.demo.triage.infrastructure.KeywordRelevanceClassifier;
import com.demo.triage.infrastructure.LocalMatchLock;
import com.demo.triage.infrastructure.MatchLock;
import io.micrometer.core.instrument.Tags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionCoordinatorTest {

    private InMemoryIssueStore store;
    private KeywordRelevanceClassifier classifier;
    private HashingEmbedder embedder;
    private IssueEventBroadcaster broadcaster;
    private MetricsService metricsService;
    private ExecutorService executor;
    private IngestionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        store = new InMemoryIssueStore();
        classifier = spy(new KeywordRelevanceClassifier());
        embedder = spy(new HashingEmbedder(256));
        broadcaster = mock(IssueEventBroadcaster.class);
        when(broadcaster.publish(any(IssueEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        metricsService = new MetricsService();
        executor = Executors.newSingleThreadExecutor();
        coordinator = newCoordinator(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private IngestionCoordinator newCoordinator(int maxAttempts) {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        MatchLock lock = new LocalMatchLock(5);
        MatcherProperties properties = new MatcherProperties();
        IssueMatcher matcher = new IssueMatcher(store, lock, properties, new IssueTextDeriver(properties), clock);
        return new IngestionCoordinator(store, classifier, embedder, matcher, lock, broadcaster,
                metricsService, executor, clock, maxAttempts);
    }

    private static InboundMessage inbound(String ts, String text) {
        return InboundMessage.builder()
                .channelId("C042")
                .timestamp(ts)
                .authorRef("U7")
                .text(text)
                .build();
    }

    private List<IssueEvent> publishedEvents(int expected) {
        ArgumentCaptor<IssueEvent> captor = ArgumentCaptor.forClass(IssueEvent.class);
        verify(broadcaster, times(expected)).publish(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("relevant message is stored, clustered and announced")
    void relevantMessageClustered() {
        IngestionResult result = coordinator.ingest(inbound("1700000000.000100", "error: login page crashes on submit"));

        assertThat(result.getOutcome()).isEqualTo(IngestionResult.Outcome.CLUSTERED);
        assertThat(result.getSourceRef()).isEqualTo("C042:1700000000.000100");
        assertThat(result.getMatchOutcome()).isEqualTo(MatchDecision.Outcome.CREATED);

        Message stored = store.findMessage(result.getMessageId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(Message.ProcessingStatus.CLUSTERED);
        assertThat(stored.getClassification()).isEqualTo("bug_report");
        assertThat(stored.getIssueId()).isEqualTo(result.getIssueId());
        assertThat(stored.getSentAt()).isEqualTo(Instant.ofEpochSecond(1700000000L, 100000L));

        List<IssueEvent> events = publishedEvents(1);
        assertThat(events.get(0).getType()).isEqualTo(IssueEvent.Type.NEW_MESSAGE);
        assertThat(events.get(0).getIssueId()).isEqualTo(result.getIssueId());
        assertThat(events.get(0).getMessageId()).isEqualTo(result.getMessageId());
    }

    @Test
    @DisplayName("ingesting the same source reference twice has no further effect")
    void idempotentIngestion() {
        InboundMessage message = inbound("1700000001.000200", "error: checkout button crashes");

        IngestionResult first = coordinator.ingest(message);
        IngestionResult second = coordinator.ingest(message);

        assertThat(first.getOutcome()).isEqualTo(IngestionResult.Outcome.CLUSTERED);
        assertThat(second.getOutcome()).isEqualTo(IngestionResult.Outcome.DUPLICATE);
        assertThat(second.getMessageId()).isEqualTo(first.getMessageId());
        assertThat(store.messageCount()).isEqualTo(1);
        assertThat(store.issueCount()).isEqualTo(1);
        verify(classifier, times(1)).classify(anyString());
        publishedEvents(1);
    }

    @Test
    @DisplayName("'anyone want lunch?' yields no issue and no event")
    void irrelevantMessage() {
        IngestionResult result = coordinator.ingest(inbound("1700000002.000300", "anyone want lunch?"));

        assertThat(result.getOutcome()).isEqualTo(IngestionResult.Outcome.IRRELEVANT);
        Message stored = store.findMessage(result.getMessageId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(Message.ProcessingStatus.IRRELEVANT);
        assertThat(stored.getRelevant()).isFalse();
        assertThat(stored.getIssueId()).isNull();
        assertThat(stored.getEmbedding()).isNull();
        assertThat(store.issueCount()).isZero();
        verify(embedder, never()).embed(anyString());
        verify(broadcaster, never()).publish(any());
    }

    @Test
    @DisplayName("login, dark mode, login again end up in two issues")
    void loginDarkModeScenario() {
        IngestionResult login = coordinator.ingest(inbound("1700000010.0001", "error: login page crashes on submit"));
        IngestionResult darkMode = coordinator.ingest(inbound("1700000011.0001", "feature request: add dark mode toggle"));
        IngestionResult loginAgain = coordinator.ingest(inbound("1700000012.0001", "error: login page crashes on submit again"));

        assertThat(store.issueCount()).isEqualTo(2);
        assertThat(darkMode.getIssueId()).isNotEqualTo(login.getIssueId());
        assertThat(loginAgain.getIssueId()).isEqualTo(login.getIssueId());
        assertThat(loginAgain.getMatchOutcome()).isEqualTo(MatchDecision.Outcome.ATTACHED);
        publishedEvents(3);
    }

    @Test
    @DisplayName("bot messages are ignored without being stored")
    void botMessageIgnored() {
        InboundMessage message = inbound("1700000003.0001", "error: deploy bot crashed");
        message.setBot(true);

        IngestionResult result = coordinator.ingest(message);

        assertThat(result.getOutcome()).isEqualTo(IngestionResult.Outcome.IGNORED);
        assertThat(store.messageCount()).isZero();
        verify(classifier, never()).classify(anyString());
    }

    @Test
    @DisplayName("invalid records are rejected before anything is stored")
    void invalidRecordRejected() {
        InboundMessage message = inbound("1700000004.0001", " ");

        assertThatThrownBy(() -> coordinator.ingest(message))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("text is required");
        assertThat(store.messageCount()).isZero();
    }

    @Test
    @DisplayName("classifier failure leaves the message pending, retry completes it")
    void classifierFailureThenRetry() {
        doThrow(new CollaboratorException("classifier", "timeout"))
                .doCallRealMethod()
                .when(classifier).classify(anyString());

        IngestionResult failed = coordinator.ingest(inbound("1700000005.0001", "error: search returns nothing"));

        assertThat(failed.getOutcome()).isEqualTo(IngestionResult.Outcome.PENDING);
        Message pending = store.findMessage(failed.getMessageId()).orElseThrow();
        assertThat(pending.getStatus()).isEqualTo(Message.ProcessingStatus.PENDING);
        assertThat(pending.getAttempts()).isEqualTo(1);
        assertThat(pending.getLastError()).contains("timeout");
        assertThat(pending.getRelevant()).isNull();
        assertThat(store.issueCount()).isZero();
        verify(broadcaster, never()).publish(any());

        IngestionResult retried = coordinator.retry(failed.getMessageId());

        assertThat(retried.getOutcome()).isEqualTo(IngestionResult.Outcome.CLUSTERED);
        Message clustered = store.findMessage(failed.getMessageId()).orElseThrow();
        assertThat(clustered.getStatus()).isEqualTo(Message.ProcessingStatus.CLUSTERED);
        assertThat(clustered.getLastError()).isNull();
        publishedEvents(1);
    }

    @Test
    @DisplayName("embedder failure keeps the classification so the retry does not classify again")
    void embedderFailureKeepsClassification() {
        doThrow(new CollaboratorException("embedder", "connection refused"))
                .doCallRealMethod()
                .when(embedder).embed(anyString());

        IngestionResult failed = coordinator.ingest(inbound("1700000006.0001", "error: export crashes"));
        Message pending = store.findMessage(failed.getMessageId()).orElseThrow();
        assertThat(pending.getClassification()).isEqualTo("bug_report");
        assertThat(pending.getStatus()).isEqualTo(Message.ProcessingStatus.PENDING);

        int advanced = coordinator.retryPending();

        assertThat(advanced).isEqualTo(1);
        verify(classifier, times(1)).classify(anyString());
        assertThat(store.findMessage(failed.getMessageId()).orElseThrow().getStatus())
                .isEqualTo(Message.ProcessingStatus.CLUSTERED);
    }

    @Test
    @DisplayName("sweep skips a message finished after the pending list was read")
    void sweepSkipsMessageFinishedMeanwhile() {
        // given
        doThrow(new CollaboratorException("classifier", "timeout")).when(classifier).classify(anyString());
        IngestionResult login = coordinator.ingest(inbound("1700000020.0001", "error: login page crashes on submit"));
        IngestionResult billing = coordinator.ingest(inbound("1700000021.0001", "error: billing export crashes on load"));
        assertThat(login.getOutcome()).isEqualTo(IngestionResult.Outcome.PENDING);
        assertThat(billing.getOutcome()).isEqualTo(IngestionResult.Outcome.PENDING);

        AtomicBoolean interleaved = new AtomicBoolean();
        doAnswer(invocation -> {
            if (interleaved.compareAndSet(false, true)) {
                assertThat(coordinator.retry(billing.getMessageId()).getOutcome())
                        .isEqualTo(IngestionResult.Outcome.CLUSTERED);
            }
            return invocation.callRealMethod();
        }).when(classifier).classify(anyString());

        // when
        coordinator.retryPending();

        // then
        verify(classifier, times(2)).classify("error: billing export crashes on load");
        Message billingMessage = store.findMessage(billing.getMessageId()).orElseThrow();
        assertThat(billingMessage.getStatus()).isEqualTo(Message.ProcessingStatus.CLUSTERED);
        assertThat(billingMessage.getIssueId()).isNotNull();
        for (Issue issue : store.listIssues(null)) {
            assertThat(issue.getMemberCount()).isEqualTo(store.listMessages(issue.getId()).size());
        }
        assertThat(store.findMessagesByStatus(Message.ProcessingStatus.CLUSTERED)).hasSize(2);
        publishedEvents(2);
    }

    @Test
    @DisplayName("a stale copy cannot overwrite a finished message")
    void staleWriteRefused() {
        IngestionResult done = coordinator.ingest(inbound("1700000022.0001", "error: login page crashes on submit"));
        Message stale = store.findMessage(done.getMessageId()).orElseThrow().toBuilder()
                .issueId(null)
                .status(Message.ProcessingStatus.PENDING)
                .build();

        assertThatThrownBy(() -> store.saveMessage(stale)).isInstanceOf(IssueIntegrityException.class);
        assertThat(store.findMessage(done.getMessageId()).orElseThrow().getIssueId()).isEqualTo(done.getIssueId());
    }

    @Test
    @DisplayName("a platform timestamp beyond the Instant range is ingested without a send time")
    void outOfRangeTimestampIngested() {
        IngestionResult result = coordinator.ingest(inbound("99999999999999999", "error: upload crashes"));

        assertThat(result.getOutcome()).isEqualTo(IngestionResult.Outcome.CLUSTERED);
        assertThat(store.findMessage(result.getMessageId()).orElseThrow().getSentAt()).isNull();
    }

    @Test
    @DisplayName("a message that keeps failing is parked and left out of the sweep")
    void parkedAfterMaxAttempts() {
        coordinator = newCoordinator(2);
        doThrow(new CollaboratorException("classifier", "503"))
                .doThrow(new CollaboratorException("classifier", "503"))
                .doCallRealMethod()
                .when(classifier).classify(anyString());

        IngestionResult first = coordinator.ingest(inbound("1700000007.0001", "how do I reset my password?"));
        assertThat(first.getOutcome()).isEqualTo(IngestionResult.Outcome.PENDING);

        assertThat(coordinator.retryPending()).isZero();
        Message parked = store.findMessage(first.getMessageId()).orElseThrow();
        assertThat(parked.getStatus()).isEqualTo(Message.ProcessingStatus.PARKED);
        assertThat(parked.getAttempts()).isEqualTo(2);

        assertThat(coordinator.retryPending()).isZero();
        verify(classifier, times(2)).classify(anyString());

        IngestionResult manual = coordinator.retry(first.getMessageId());
        assertThat(manual.getOutcome()).isEqualTo(IngestionResult.Outcome.CLUSTERED);
    }

    @Test
    @DisplayName("retrying a finished message changes nothing")
    void retryFinishedMessage() {
        IngestionResult done = coordinator.ingest(inbound("1700000008.0001", "anyone want lunch?"));

        IngestionResult again = coordinator.retry(done.getMessageId());

        assertThat(again.getOutcome()).isEqualTo(IngestionResult.Outcome.IRRELEVANT);
        verify(classifier, times(1)).classify(anyString());
    }

    @Test
    @DisplayName("retrying an unknown message fails")
    void retryUnknownMessage() {
        assertThatThrownBy(() -> coordinator.retry(404L)).isInstanceOf(MessageNotFoundException.class);
    }

    @Test
    @DisplayName("resolve emits issue_resolved once; resolving again is a silent no-op")
    void resolveEmitsOnce() {
        IngestionResult result = coordinator.ingest(inbound("1700000009.0001", "error: emails not sending"));

        Issue resolved = coordinator.resolve(result.getIssueId());
        Issue again = coordinator.resolve(result.getIssueId());

        assertThat(resolved.getStatus()).isEqualTo(Issue.IssueStatus.RESOLVED);
        assertThat(resolved.getResolvedAt()).isNotNull();
        assertThat(again.getStatus()).isEqualTo(Issue.IssueStatus.RESOLVED);
        List<IssueEvent> events = publishedEvents(2);
        assertThat(events).extracting(IssueEvent::getType)
                .containsExactly(IssueEvent.Type.NEW_MESSAGE, IssueEvent.Type.ISSUE_RESOLVED);
        assertThat(events.get(1).getIssueId()).isEqualTo(result.getIssueId());
    }

    @Test
    @DisplayName("resolving an unknown issue fails without an event")
    void resolveUnknownIssue() {
        assertThatThrownBy(() -> coordinator.resolve(99L)).isInstanceOf(IssueNotFoundException.class);
        verify(broadcaster, never()).publish(any());
    }

    @Test
    @DisplayName("store outage during dedup propagates and persists nothing")
    void storeUnavailable() {
        store.setUnavailable(true);

        assertThatThrownBy(() -> coordinator.ingest(inbound("1700000013.0001", "error: timeout")))
                .isInstanceOf(DataAccessException.class);

        store.setUnavailable(false);
        assertThat(store.messageCount()).isZero();
        verify(classifier, never()).classify(anyString());
    }

    @Test
    @DisplayName("submit runs ingestion on the worker pool")
    void asyncSubmit() throws Exception {
        IngestionResult result = coordinator.submit(inbound("1700000014.0001", "error: upload crashes"))
                .get(5, TimeUnit.SECONDS);

        assertThat(result.getOutcome()).isEqualTo(IngestionResult.Outcome.CLUSTERED);
        assertThat(metricsService.getCounterValue("ingestion.messages",
                Tags.of("outcome", "CLUSTERED"))).isEqualTo(1);
    }
}
