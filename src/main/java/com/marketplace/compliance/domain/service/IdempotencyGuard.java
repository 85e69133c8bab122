package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.error.ComplianceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Deduplicates externally delivered event ids within a TTL window.
 *
 * How It Works:
 * 1. {@link #checkAndMark} claims {@code prefix:scope:eventId} with SET-if-absent
 * 2. A claimed key means the event was already seen; the caller skips it
 * 3. When processing fails the caller {@link #delete}s the key so redelivery is processed
 *
 * Keys expire after the TTL, after which a redelivered id counts as new again.
 */
@Slf4j
public class IdempotencyGuard {

    private final IdempotencyStore store;
    private final String keyPrefix;
    private final String scope;
    private final Duration ttl;

    public IdempotencyGuard(IdempotencyStore store, String keyPrefix, String scope, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("idempotency ttl must be positive");
        }
        this.store = store;
        this.keyPrefix = keyPrefix;
        this.scope = scope;
        this.ttl = ttl;
    }

    /**
     * @return true when the event id was already seen (duplicate), false when this call claimed it
     */
    public boolean checkAndMark(String eventId) {
        String key = key(eventId);
        boolean claimed;
        try {
            claimed = store.setIfAbsent(key, ttl);
        } catch (RuntimeException e) {
            throw ComplianceException.dependency("idempotency check", e);
        }
        if (!claimed) {
            log.debug("Event {} already seen in scope {}", eventId, scope);
        }
        return !claimed;
    }

    public void delete(String eventId) {
        String key = key(eventId);
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            throw ComplianceException.dependency("idempotency release", e);
        }
    }

    String key(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw ComplianceException.validation("event id is required");
        }
        return keyPrefix + ":" + scope + ":" + eventId.trim();
    }
}
