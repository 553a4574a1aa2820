package com.demo.triage.consumer;

import com.demo.triage.domain.InboundMessage;
import com.demo.triage.domain.IngestionResult;
import com.demo.triage.domain.ValidationResult;
import com.demo.triage.service.IngestionCoordinator;
import com.demo.triage.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Kafka consumer feeding normalized chat records into the ingestion pipeline.
 *
 * A record is acknowledged once ingest returns, including when it ends up pending
 * on a collaborator. Records that can never be ingested are acknowledged and skipped.
 * Any other failure leaves the record unacknowledged for redelivery.
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class InboundMessageConsumer {

    private final ObjectMapper objectMapper;
    private final IngestionCoordinator coordinator;
    private final MetricsService metricsService;

    public InboundMessageConsumer(ObjectMapper objectMapper,
                                  IngestionCoordinator coordinator,
                                  MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.coordinator = coordinator;
        this.metricsService = metricsService;
        log.info("InboundMessageConsumer initialized - Kafka intake enabled");
    }

    @KafkaListener(
        topics = "${triage.kafka.inbound-topic:chat-messages}",
        groupId = "${spring.kafka.consumer.group-id:issue-triage}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(String recordJson, Acknowledgment acknowledgment) {
        InboundMessage inbound;
        try {
            inbound = objectMapper.readValue(recordJson, InboundMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unparseable inbound record: error={}", e.getOriginalMessage());
            metricsService.incrementCounter("kafka.inbound.skipped", "reason", "parse");
            acknowledgment.acknowledge();
            return;
        }

        ValidationResult validation = inbound.validate();
        if (!validation.isValid()) {
            log.warn("Skipping invalid inbound record: errors={}", validation.getErrorMessage());
            metricsService.incrementCounter("kafka.inbound.skipped", "reason", "invalid");
            acknowledgment.acknowledge();
            return;
        }

        try {
            IngestionResult result = coordinator.ingest(inbound);
            acknowledgment.acknowledge();
            log.debug("Inbound record ingested: sourceRef={}, outcome={}",
                    result.getSourceRef(), result.getOutcome());

        } catch (Exception e) {
            log.error("Failed to ingest inbound record: sourceRef={}", inbound.resolveSourceRef(), e);
            throw new IllegalStateException("Inbound ingestion failed: " + inbound.resolveSourceRef(), e);
        }
    }
}
