package com.demo.triage.handler;

import com.demo.triage.domain.IssueEvent;
import com.demo.triage.infrastructure.IssueEventBroadcaster;
import com.demo.triage.infrastructure.ViewerConnection;
import com.demo.triage.infrastructure.ViewerSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Push endpoint for the live issue view. Server to client only, apart from ping.
 */
@Slf4j
@Component
public class IssueWebSocketHandler extends TextWebSocketHandler {

    private static final String CONNECTION_ATTRIBUTE = "viewerConnection";

    private final IssueEventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public IssueWebSocketHandler(IssueEventBroadcaster broadcaster,
                                 ObjectMapper objectMapper,
                                 @Value("${triage.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                 @Value("${triage.websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(wsSession, sendTimeLimitMs, bufferSizeLimit);
        try {
            sendWelcomeMessage(session);
            ViewerConnection connection = broadcaster.subscribe(new WebSocketViewerSink(session));
            wsSession.getAttributes().put(CONNECTION_ATTRIBUTE, connection);

            log.info("WebSocket viewer connected: wsId={}, connectionId={}, remote={}",
                    wsSession.getId(), connection.getId(), wsSession.getRemoteAddress());
        } catch (Exception e) {
            log.error("Error establishing viewer connection: wsId={}", wsSession.getId(), e);
            wsSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) throws IOException {
        String payload = message.getPayload();
        log.debug("Received message from {}: {}", wsSession.getId(), payload);

        if ("ping".equals(payload)) {
            wsSession.sendMessage(new TextMessage("pong"));
            return;
        }
        try {
            Map<?, ?> json = objectMapper.readValue(payload, Map.class);
            if ("ping".equals(json.get("type"))) {
                wsSession.sendMessage(new TextMessage("{\"type\":\"pong\"}"));
                return;
            }
            log.warn("Unknown message type from viewer: wsId={}, type={}", wsSession.getId(), json.get("type"));
        } catch (IOException e) {
            log.warn("Unparseable message from viewer: wsId={}, error={}", wsSession.getId(), e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        ViewerConnection connection = (ViewerConnection) wsSession.getAttributes().remove(CONNECTION_ATTRIBUTE);
        log.info("WebSocket viewer closed: wsId={}, status={}", wsSession.getId(), status);
        broadcaster.unsubscribe(connection);
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("WebSocket transport error: wsId={}", wsSession.getId(), exception);
        ViewerConnection connection = (ViewerConnection) wsSession.getAttributes().remove(CONNECTION_ATTRIBUTE);
        broadcaster.unsubscribe(connection);
    }

    private void sendWelcomeMessage(WebSocketSession session) throws IOException {
        String payload = objectMapper.writeValueAsString(Map.of(
                "type", "welcome",
                "timestamp", Instant.now().toString()
        ));
        session.sendMessage(new TextMessage(payload));
    }

    private class WebSocketViewerSink implements ViewerSink {

        private final WebSocketSession session;

        WebSocketViewerSink(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(IssueEvent event) throws IOException {
            if (!session.isOpen()) {
                throw new IOException("WebSocket session closed: " + session.getId());
            }
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        }

        @Override
        public void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.SESSION_NOT_RELIABLE);
            } catch (IOException e) {
                log.debug("Error closing WebSocket session: wsId={}, error={}", session.getId(), e.getMessage());
            }
        }

        @Override
        public String describe() {
            return "websocket:" + session.getId();
        }
    }
}
