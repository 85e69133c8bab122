package com.marketplace.compliance.infrastructure.redis;

import com.marketplace.compliance.domain.service.SweepLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSweepLock implements SweepLock {

    // Compare-and-delete so an expired holder cannot release a lock taken over by another instance
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> tryAcquire(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(key, token, ttl.toMillis(), TimeUnit.MILLISECONDS);
        if (Boolean.TRUE.equals(acquired)) {
            return Optional.of(token);
        }
        return Optional.empty();
    }

    @Override
    public void release(String key, String ownerToken) {
        Long released = redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), ownerToken);
        if (released == null || released == 0L) {
            log.warn("Sweep lock {} was no longer held by this instance", key);
        }
    }
}
