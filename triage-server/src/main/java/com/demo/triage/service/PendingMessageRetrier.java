package com.demo.triage.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically re-advances messages left pending by a collaborator failure.
 * Enable on a single node when several share one store.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.ingestion.retry-enabled", havingValue = "true", matchIfMissing = true)
public class PendingMessageRetrier {

    private final IngestionCoordinator coordinator;
    private final ScheduledExecutorService retryExecutor;

    public PendingMessageRetrier(IngestionCoordinator coordinator,
                                 @Value("${triage.ingestion.retry-interval-seconds:30}") long intervalSeconds) {
        this.coordinator = coordinator;
        this.retryExecutor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("pending-retry-"));

        retryExecutor.scheduleWithFixedDelay(this::sweep, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("PendingMessageRetrier scheduled: interval={}s", intervalSeconds);
    }

    void sweep() {
        try {
            coordinator.retryPending();
        } catch (Exception e) {
            // An escaping exception would cancel the schedule
            log.error("Error during pending message sweep", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down PendingMessageRetrier...");
        retryExecutor.shutdown();
        try {
            if (!retryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                retryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            retryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
