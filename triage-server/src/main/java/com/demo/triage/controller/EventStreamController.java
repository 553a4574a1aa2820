package com.demo.triage.controller;

import com.demo.triage.domain.IssueEvent;
import com.demo.triage.infrastructure.IssueEventBroadcaster;
import com.demo.triage.infrastructure.ViewerConnection;
import com.demo.triage.infrastructure.ViewerSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Locale;

/**
 * Server-Sent Events variant of the issue push channel, for viewers that cannot use WebSocket.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class EventStreamController {

    private final IssueEventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    public EventStreamController(IssueEventBroadcaster broadcaster, ObjectMapper objectMapper) {
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /api/events
     */
    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        // No timeout: the stream lives until the client goes away or falls behind
        SseEmitter emitter = new SseEmitter(0L);
        ViewerConnection connection = broadcaster.subscribe(new SseViewerSink(emitter));

        emitter.onCompletion(() -> broadcaster.unsubscribe(connection));
        emitter.onTimeout(() -> broadcaster.unsubscribe(connection));
        emitter.onError(e -> {
            log.debug("SSE viewer error: connectionId={}, error={}", connection.getId(), e.getMessage());
            broadcaster.unsubscribe(connection);
        });

        log.info("SSE viewer connected: connectionId={}", connection.getId());
        return emitter;
    }

    private class SseViewerSink implements ViewerSink {

        private final SseEmitter emitter;

        SseViewerSink(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void send(IssueEvent event) throws IOException {
            SseEmitter.SseEventBuilder frame = SseEmitter.event()
                    .name(event.getType().name().toLowerCase(Locale.ROOT))
                    .data(objectMapper.writeValueAsString(event), MediaType.APPLICATION_JSON);
            if (event.getSequence() != null) {
                frame.id(String.valueOf(event.getSequence()));
            }
            emitter.send(frame);
        }

        @Override
        public void close() {
            emitter.complete();
        }

        @Override
        public String describe() {
            return "sse";
        }
    }
}
