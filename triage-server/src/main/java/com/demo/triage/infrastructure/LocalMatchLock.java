package com.demo.triage.infrastructure;

import com.demo.triage.exception.MatchLockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process fair lock, sufficient for a single node.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.redis.enabled", havingValue = "false", matchIfMissing = true)
public class LocalMatchLock implements MatchLock {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration waitTimeout;

    public LocalMatchLock(@Value("${triage.matcher.lock-wait-seconds:30}") long waitSeconds) {
        this.waitTimeout = Duration.ofSeconds(waitSeconds);
    }

    @Override
    public <T> T execute(LockOperation<T> operation) {
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatchLockTimeoutException("Interrupted while waiting for match lock", e);
        }
        if (!acquired) {
            log.warn("Match lock not acquired within {}ms, queued={}",
                    waitTimeout.toMillis(), lock.getQueueLength());
            throw new MatchLockTimeoutException("Match lock not acquired within " + waitTimeout);
        }
        try {
            return operation.execute();
        } finally {
            lock.unlock();
        }
    }
}
