package com.demo.triage.infrastructure;

/**
 * Mutual exclusion around the issue store's write paths: the matcher's
 * read-candidates, decide, commit, publish sequence and issue resolution.
 */
public interface MatchLock {

    /**
     * Runs the operation while holding the lock.
     *
     * @throws com.demo.triage.exception.MatchLockTimeoutException if the lock could not be acquired in time
     */
    <T> T execute(LockOperation<T> operation);

    @FunctionalInterface
    interface LockOperation<T> {
        T execute();
    }
}
