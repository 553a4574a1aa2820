package com.demo.triage.infrastructure;

import com.demo.triage.domain.IssueEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for one subscribed viewer: a bounded FIFO of pending events plus a
 * connection state machine {@code CONNECTING -> OPEN -> (CLOSED | ERRORED)}.
 */
@Slf4j
public class ViewerConnection {

    public enum State {
        CONNECTING,
        OPEN,
        CLOSED,
        ERRORED
    }

    private final String id;
    private final ViewerSink sink;
    private final BlockingQueue<IssueEvent> queue;
    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private final Instant connectedAt;

    ViewerConnection(String id, ViewerSink sink, int queueCapacity) {
        this.id = id;
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.connectedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public State getState() {
        return state.get();
    }

    public boolean isActive() {
        State current = state.get();
        return current == State.CONNECTING || current == State.OPEN;
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public int getBacklog() {
        return queue.size();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    boolean markOpen() {
        return state.compareAndSet(State.CONNECTING, State.OPEN);
    }

    /**
     * @return false when the backlog is full
     */
    boolean enqueue(IssueEvent event) {
        return queue.offer(event);
    }

    /**
     * Claims the right to drain; at most one drainer runs per connection.
     */
    boolean claimDrain() {
        return draining.compareAndSet(false, true);
    }

    /**
     * Sends queued events in FIFO order until the queue is empty.
     *
     * @return true if the queue was emptied, false if the sink failed
     */
    boolean drain() {
        while (true) {
            IssueEvent event;
            while (isActive() && (event = queue.poll()) != null) {
                try {
                    sink.send(event);
                    delivered.incrementAndGet();
                } catch (Exception e) {
                    log.warn("Delivery failed: connectionId={}, sink={}, sequence={}, error={}",
                            id, sink.describe(), event.getSequence(), e.getMessage());
                    draining.set(false);
                    return false;
                }
            }
            draining.set(false);
            // an event enqueued after the last poll but before the flag was cleared
            if (!isActive() || queue.isEmpty() || !draining.compareAndSet(false, true)) {
                return true;
            }
        }
    }

    /**
     * Moves to a terminal state. Only the first call has any effect.
     *
     * @return true if this call closed the connection
     */
    boolean terminate(State terminal) {
        while (true) {
            State current = state.get();
            if (current == State.CLOSED || current == State.ERRORED) {
                return false;
            }
            if (state.compareAndSet(current, terminal)) {
                queue.clear();
                try {
                    sink.close();
                } catch (Exception e) {
                    log.debug("Sink close failed: connectionId={}, error={}", id, e.getMessage());
                }
                return true;
            }
        }
    }
}
