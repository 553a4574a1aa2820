package com.demo.triage.infrastructure;

import com.demo.triage.domain.IssueEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One-to-many push hub for issue events.
 *
 * <p>Publishing only stamps the event and appends it to every connection's bounded
 * queue, so it never blocks on a viewer. Each connection is drained by at most one
 * delivery task at a time, which keeps per-connection order equal to publish order.
 * A connection whose backlog overflows is torn down; the viewer reconnects and
 * re-fetches state.
 */
@Component
@Slf4j
public class IssueEventBroadcaster {

    private final Map<String, ViewerConnection> connections = new ConcurrentHashMap<>();
    private final List<Consumer<IssueEvent>> publishListeners = new CopyOnWriteArrayList<>();
    // Orders publishes against each other and against subscribe/unsubscribe
    private final ReentrantLock fanOutLock = new ReentrantLock();
    // Shared by local and relayed events, so each viewer sees one gap-free numbering
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final ExecutorService deliveryExecutor;
    private final int queueCapacity;
    private final Clock clock;

    @Autowired
    public IssueEventBroadcaster(@Value("${triage.broadcast.queue-capacity:256}") int queueCapacity,
                                 Clock clock) {
        this(queueCapacity, clock,
                Executors.newCachedThreadPool(new CustomizableThreadFactory("viewer-delivery-")));
    }

    public IssueEventBroadcaster(int queueCapacity, Clock clock, ExecutorService deliveryExecutor) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.clock = clock;
        this.deliveryExecutor = deliveryExecutor;
    }

    /**
     * Registers a viewer. The connection receives every event published after this call returns.
     */
    public ViewerConnection subscribe(ViewerSink sink) {
        ViewerConnection connection = new ViewerConnection(UUID.randomUUID().toString(), sink, queueCapacity);
        fanOutLock.lock();
        try {
            connections.put(connection.getId(), connection);
            connection.markOpen();
        } finally {
            fanOutLock.unlock();
        }
        log.info("Viewer subscribed: connectionId={}, sink={}, total={}",
                connection.getId(), sink.describe(), connections.size());
        return connection;
    }

    /**
     * Deregisters a viewer. Safe to call repeatedly and on broken connections.
     */
    public void unsubscribe(ViewerConnection connection) {
        if (connection == null) {
            return;
        }
        remove(connection, ViewerConnection.State.CLOSED);
    }

    /**
     * Publishes a committed state change to every connected viewer and to publish listeners.
     *
     * @return the event as delivered, with sequence number and timestamp
     */
    public IssueEvent publish(IssueEvent event) {
        IssueEvent stamped;
        fanOutLock.lock();
        try {
            stamped = event.toBuilder()
                    .sequence(sequence.incrementAndGet())
                    .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
                    .build();
            fanOut(stamped);
        } finally {
            fanOutLock.unlock();
        }
        published.incrementAndGet();

        log.debug("Published event: type={}, issueId={}, sequence={}, viewers={}",
                stamped.getType(), stamped.getIssueId(), stamped.getSequence(), connections.size());

        for (Consumer<IssueEvent> listener : publishListeners) {
            try {
                listener.accept(stamped);
            } catch (Exception e) {
                log.error("Publish listener failed: type={}, issueId={}",
                        stamped.getType(), stamped.getIssueId(), e);
            }
        }
        return stamped;
    }

    /**
     * Delivers an event that was published on another node to local viewers only.
     * The origin's sequence number is replaced with this node's; the origin timestamp is kept.
     */
    public IssueEvent deliverRelayed(IssueEvent event) {
        IssueEvent stamped;
        fanOutLock.lock();
        try {
            stamped = event.toBuilder()
                    .sequence(sequence.incrementAndGet())
                    .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
                    .build();
            fanOut(stamped);
        } finally {
            fanOutLock.unlock();
        }
        log.debug("Delivered relayed event: type={}, issueId={}, originSequence={}, sequence={}",
                stamped.getType(), stamped.getIssueId(), event.getSequence(), stamped.getSequence());
        return stamped;
    }

    public void addPublishListener(Consumer<IssueEvent> listener) {
        publishListeners.add(listener);
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public long getPublishedCount() {
        return published.get();
    }

    private void fanOut(IssueEvent event) {
        for (ViewerConnection connection : connections.values()) {
            if (!connection.isActive()) {
                continue;
            }
            if (!connection.enqueue(event)) {
                log.warn("Viewer backlog full, disconnecting: connectionId={}, capacity={}",
                        connection.getId(), queueCapacity);
                remove(connection, ViewerConnection.State.ERRORED);
                continue;
            }
            scheduleDrain(connection);
        }
    }

    private void scheduleDrain(ViewerConnection connection) {
        if (!connection.claimDrain()) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> {
                if (!connection.drain()) {
                    remove(connection, ViewerConnection.State.ERRORED);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected drain: connectionId={}", connection.getId());
            remove(connection, ViewerConnection.State.ERRORED);
        }
    }

    private void remove(ViewerConnection connection, ViewerConnection.State terminal) {
        connections.remove(connection.getId(), connection);
        if (connection.terminate(terminal)) {
            log.info("Viewer disconnected: connectionId={}, state={}, delivered={}, total={}",
                    connection.getId(), terminal, connection.getDeliveredCount(), connections.size());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down IssueEventBroadcaster: viewers={}", connections.size());
        connections.values().forEach(connection -> remove(connection, ViewerConnection.State.CLOSED));
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
