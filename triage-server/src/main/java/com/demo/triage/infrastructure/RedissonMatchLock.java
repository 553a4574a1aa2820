package com.demo.triage.infrastructure;

import com.demo.triage.exception.MatchLockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Cluster-wide match lock for multi-node deployments.
 *
 * Uses a Redisson fair lock; the lock watchdog keeps the lease alive while the
 * holder is running, so a crashed node releases it after the watchdog timeout.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.redis.enabled", havingValue = "true")
public class RedissonMatchLock implements MatchLock {

    private static final String LOCK_KEY = "triage:lock:issue-matcher";

    private final RedissonClient redissonClient;
    private final long waitSeconds;

    public RedissonMatchLock(RedissonClient redissonClient,
                             @Value("${triage.matcher.lock-wait-seconds:30}") long waitSeconds) {
        this.redissonClient = redissonClient;
        this.waitSeconds = waitSeconds;
    }

    @Override
    public <T> T execute(LockOperation<T> operation) {
        RLock lock = redissonClient.getFairLock(LOCK_KEY);
        boolean acquired;
        try {
            acquired = lock.tryLock(waitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatchLockTimeoutException("Interrupted while waiting for match lock", e);
        }
        if (!acquired) {
            log.warn("Distributed match lock not acquired: key={}, wait={}s", LOCK_KEY, waitSeconds);
            throw new MatchLockTimeoutException("Distributed match lock not acquired within " + waitSeconds + "s");
        }
        log.debug("Lock acquired: key={}", LOCK_KEY);
        try {
            return operation.execute();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Lock released: key={}", LOCK_KEY);
            } else {
                log.warn("Match lock lease expired before release: key={}", LOCK_KEY);
            }
        }
    }
}
