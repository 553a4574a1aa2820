package com.demo.triage.infrastructure;

import com.demo.triage.domain.IssueEvent;

import java.io.IOException;

/**
 * Transport end of one viewer connection (WebSocket session, SSE emitter).
 */
public interface ViewerSink {

    /**
     * Writes one event. Called from a single delivery thread at a time per connection.
     */
    void send(IssueEvent event) throws IOException;

    /**
     * Releases the transport. Must tolerate an already closed transport.
     */
    void close();

    default String describe() {
        return getClass().getSimpleName();
    }
}
