package com.demo.triage.service;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based pipeline metrics.
 *
 * Counters are kept in memory, keyed by name plus tags, so the health and stats
 * endpoints can report them without a metrics backend.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counters =====

    public void incrementCounter(String name) {
        incrementCounter(name, Tags.empty());
    }

    public void incrementCounter(String name, Tags tags) {
        String key = key(name, tags);
        long count = counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", key, count);
    }

    public void incrementCounter(String name, String... tags) {
        incrementCounter(name, Tags.of(tags));
    }

    public long getCounterValue(String name) {
        return getCounterValue(name, Tags.empty());
    }

    public long getCounterValue(String name, Tags tags) {
        AtomicLong counter = counters.get(key(name, tags));
        return counter != null ? counter.get() : 0;
    }

    // ===== Timers =====

    public TimerSample startTimer() {
        return new TimerSample();
    }

    public void stopTimer(TimerSample sample, String name, Tags tags) {
        Duration duration = sample.stop();
        log.debug("[METRIC] Timer: {} = {}ms", key(name, tags), duration.toMillis());
    }

    // ===== Pipeline events =====

    public void recordIngestion(String outcome) {
        incrementCounter("ingestion.messages", "outcome", outcome);
    }

    public void recordMatch(String outcome, double similarity) {
        incrementCounter("matcher.decisions", "outcome", outcome);
        log.debug("[METRIC] Match: outcome={}, similarity={}", outcome, similarity);
    }

    public void recordCollaboratorFailure(String collaborator) {
        incrementCounter("collaborator.failures", "collaborator", collaborator);
    }

    public void recordEventPublished(String type) {
        incrementCounter("broadcast.events", "type", type);
    }

    /**
     * Snapshot of every counter, sorted by key.
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((key, value) -> snapshot.put(key, value.get()));
        return snapshot;
    }

    private static String key(String name, Tags tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append(',').append(tag.getKey()).append('=').append(tag.getValue());
        }
        return key.toString();
    }

    public static class TimerSample {
        private final long startNanos = System.nanoTime();

        public Duration stop() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }
}
