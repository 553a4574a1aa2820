package com.demo.triage.controller;

import com.demo.triage.domain.IssueStats;
import com.demo.triage.infrastructure.HttpEmbedder;
import com.demo.triage.infrastructure.HttpRelevanceClassifier;
import com.demo.triage.infrastructure.IssueEventBroadcaster;
import com.demo.triage.infrastructure.IssueStore;
import com.demo.triage.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final IssueStore issueStore;
    private final IssueEventBroadcaster broadcaster;
    private final MetricsService metricsService;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;
    private final ObjectProvider<HttpRelevanceClassifier> httpClassifier;
    private final ObjectProvider<HttpEmbedder> httpEmbedder;
    private final boolean redisEnabled;
    private final String classifierMode;
    private final String embedderMode;

    public HealthController(IssueStore issueStore,
                            IssueEventBroadcaster broadcaster,
                            MetricsService metricsService,
                            ObjectProvider<StringRedisTemplate> redisTemplate,
                            ObjectProvider<HttpRelevanceClassifier> httpClassifier,
                            ObjectProvider<HttpEmbedder> httpEmbedder,
                            @Value("${triage.redis.enabled:false}") boolean redisEnabled,
                            @Value("${triage.classifier.mode:keyword}") String classifierMode,
                            @Value("${triage.embedder.mode:hashing}") String embedderMode) {
        this.issueStore = issueStore;
        this.broadcaster = broadcaster;
        this.metricsService = metricsService;
        this.redisTemplate = redisTemplate;
        this.httpClassifier = httpClassifier;
        this.httpEmbedder = httpEmbedder;
        this.redisEnabled = redisEnabled;
        this.classifierMode = classifierMode;
        this.embedderMode = embedderMode;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");

        try {
            IssueStats stats = issueStore.stats();
            response.put("database", "connected");
            response.put("open_issues", stats.getOpenIssues());
            response.put("pending_messages", stats.getPendingMessages());
        } catch (DataAccessException e) {
            log.warn("Health check: database unavailable: {}", e.getMessage());
            response.put("database", "disconnected");
            response.put("status", "degraded");
        }

        if (redisEnabled) {
            try {
                redisTemplate.getObject().getConnectionFactory().getConnection().ping();
                response.put("redis", "connected");
            } catch (Exception e) {
                response.put("redis", "disconnected");
                response.put("status", "degraded");
            }
        } else {
            response.put("redis", "disabled");
        }

        Map<String, Object> classifier = new HashMap<>();
        classifier.put("mode", classifierMode);
        HttpRelevanceClassifier remoteClassifier = httpClassifier.getIfAvailable();
        if (remoteClassifier != null) {
            classifier.putAll(remoteClassifier.checkHealth());
        }
        response.put("classifier", classifier);

        Map<String, Object> embedder = new HashMap<>();
        embedder.put("mode", embedderMode);
        HttpEmbedder remoteEmbedder = httpEmbedder.getIfAvailable();
        if (remoteEmbedder != null) {
            embedder.putAll(remoteEmbedder.checkHealth());
        }
        response.put("embedder", embedder);

        response.put("viewers", broadcaster.getConnectionCount());
        response.put("events_published", broadcaster.getPublishedCount());
        response.put("metrics", metricsService.snapshot());
        return response;
    }
}
