package com.demo.triage.infrastructure;

import com.demo.triage.domain.IssueEvent;
import com.demo.triage.domain.RelayEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Forwards locally published issue events to the other nodes and hands theirs
 * to local viewers, so a viewer sees every commit whichever node made it.
 *
 * Outgoing events are sent from a single relay thread in publish order. The publishing
 * thread only enqueues, so a slow Redis never stalls the match lock.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.redis.enabled", havingValue = "true")
public class RedisEventRelay implements MessageListener {

    static final String CHANNEL = "triage:issue-events";

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final IssueEventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final String nodeId;
    private final ExecutorService relayExecutor;

    @Autowired
    public RedisEventRelay(StringRedisTemplate redisTemplate,
                           RedisMessageListenerContainer listenerContainer,
                           IssueEventBroadcaster broadcaster,
                           ObjectMapper objectMapper,
                           @Value("${triage.node-id:}") String nodeId,
                           @Value("${triage.redis.relay-queue-capacity:10000}") int queueCapacity) {
        this(redisTemplate, listenerContainer, broadcaster, objectMapper, nodeId,
                new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                        new LinkedBlockingQueue<>(queueCapacity),
                        new CustomizableThreadFactory("redis-relay-")));
    }

    public RedisEventRelay(StringRedisTemplate redisTemplate,
                           RedisMessageListenerContainer listenerContainer,
                           IssueEventBroadcaster broadcaster,
                           ObjectMapper objectMapper,
                           String nodeId,
                           ExecutorService relayExecutor) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.nodeId = nodeId == null || nodeId.isBlank() ? UUID.randomUUID().toString() : nodeId;
        this.relayExecutor = relayExecutor;
    }

    @PostConstruct
    public void start() {
        listenerContainer.addMessageListener(this, new ChannelTopic(CHANNEL));
        broadcaster.addPublishListener(this::enqueue);
        log.info("Redis event relay started: channel={}, nodeId={}", CHANNEL, nodeId);
    }

    void enqueue(IssueEvent event) {
        try {
            relayExecutor.execute(() -> relay(event));
        } catch (RejectedExecutionException e) {
            // Remote viewers miss this event; the sequence gap tells them to re-fetch
            log.warn("Relay backlog full, dropping event: type={}, issueId={}, sequence={}",
                    event.getType(), event.getIssueId(), event.getSequence());
        }
    }

    void relay(IssueEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(RelayEnvelope.builder()
                    .originNode(nodeId)
                    .event(event)
                    .build());
            Long receivers = redisTemplate.convertAndSend(CHANNEL, payload);
            log.debug("Relayed event: type={}, issueId={}, receivers={}",
                    event.getType(), event.getIssueId(), receivers);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize relayed event: type={}, issueId={}",
                    event.getType(), event.getIssueId(), e);
        } catch (RuntimeException e) {
            log.error("Failed to relay event: type={}, issueId={}, error={}",
                    event.getType(), event.getIssueId(), e.getMessage());
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            RelayEnvelope envelope = objectMapper.readValue(payload, RelayEnvelope.class);
            if (nodeId.equals(envelope.getOriginNode()) || envelope.getEvent() == null) {
                return;
            }
            broadcaster.deliverRelayed(envelope.getEvent());
        } catch (IOException e) {
            log.error("Unparseable relayed event: payload={}", payload, e);
        }
    }

    public String getNodeId() {
        return nodeId;
    }

    @PreDestroy
    public void shutdown() {
        relayExecutor.shutdown();
        try {
            if (!relayExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                relayExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            relayExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Redis event relay stopped: nodeId={}", nodeId);
    }
}
