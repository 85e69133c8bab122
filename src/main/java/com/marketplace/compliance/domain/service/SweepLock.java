package com.marketplace.compliance.domain.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Cross-instance mutual exclusion for scheduler ticks.
 */
public interface SweepLock {

    /**
     * @return the owner token when the lock was acquired, empty when another owner holds it
     */
    Optional<String> tryAcquire(String key, Duration ttl);

    /**
     * Releases the lock only if {@code ownerToken} still owns it.
     */
    void release(String key, String ownerToken);
}
