package com.marketplace.compliance.infrastructure.redis;

import com.marketplace.compliance.domain.service.IdempotencyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed dedupe keys. SET NX with a TTL makes check-and-mark a single atomic step
 * shared by every instance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisIdempotencyStore implements IdempotencyStore {

    private static final String MARKER = "processed";

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean setIfAbsent(String key, Duration ttl) {
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(key, MARKER, ttl.toMillis(), TimeUnit.MILLISECONDS);
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public void delete(String key) {
        Boolean deleted = redisTemplate.delete(key);
        log.debug("Idempotency key {} released (existed: {})", key, deleted);
    }
}
