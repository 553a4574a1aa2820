package com.demo.triage.config;

import com.demo.triage.handler.IssueWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final IssueWebSocketHandler issueWebSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(IssueWebSocketHandler issueWebSocketHandler,
                           @Value("${triage.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.issueWebSocketHandler = issueWebSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(issueWebSocketHandler, "/ws/issues")
                .setAllowedOrigins(allowedOrigins);
    }
}
