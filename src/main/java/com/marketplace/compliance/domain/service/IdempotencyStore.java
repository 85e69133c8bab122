package com.marketplace.compliance.domain.service;

import java.time.Duration;

/**
 * Shared key/expiry store used for deduplication.
 */
public interface IdempotencyStore {

    /**
     * Atomically sets {@code key} with the given time-to-live if and only if it is absent.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, Duration ttl);

    void delete(String key);
}
