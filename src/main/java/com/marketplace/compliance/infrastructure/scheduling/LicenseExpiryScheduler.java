package com.marketplace.compliance.infrastructure.scheduling;

import com.marketplace.compliance.domain.service.LicenseExpirySweeper;
import com.marketplace.compliance.domain.service.SweepLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Background task driving the license sweeps.
 *
 * Runs one tick immediately on start, then once per interval. Each tick takes the
 * cross-instance sweep lock first and is skipped when another instance holds it.
 * A failing tick is logged and the schedule continues. Stopping lets an in-flight
 * tick finish before the worker thread exits.
 */
@Slf4j
@Component
public class LicenseExpiryScheduler implements SmartLifecycle {

    private static final int SHUTDOWN_GRACE_SECONDS = 30;

    private final LicenseExpirySweeper sweeper;
    private final SweepLock sweepLock;
    private final boolean enabled;
    private final Duration interval;
    private final String lockKey;
    private final Duration lockTtl;

    private ThreadPoolTaskScheduler taskScheduler;
    private volatile boolean running;

    public LicenseExpiryScheduler(LicenseExpirySweeper sweeper,
                                  SweepLock sweepLock,
                                  @Value("${app.scheduler.enabled:true}") boolean enabled,
                                  @Value("${app.scheduler.interval:PT24H}") Duration interval,
                                  @Value("${app.scheduler.lock-key:compliance:lock:license-sweep}") String lockKey,
                                  @Value("${app.scheduler.lock-ttl:PT25H}") Duration lockTtl) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("scheduler interval must be positive");
        }
        this.sweeper = sweeper;
        this.sweepLock = sweepLock;
        this.enabled = enabled;
        this.interval = interval;
        this.lockKey = lockKey;
        this.lockTtl = lockTtl;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!enabled) {
            log.info("License expiry scheduler disabled");
            return;
        }
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("license-expiry-");
        taskScheduler.setDaemon(true);
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setAwaitTerminationSeconds(SHUTDOWN_GRACE_SECONDS);
        taskScheduler.initialize();
        taskScheduler.scheduleAtFixedRate(this::tick, Instant.now(), interval);
        running = true;
        log.info("License expiry scheduler started (interval: {})", interval);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        // waits up to the grace period for an in-flight tick
        taskScheduler.shutdown();
        taskScheduler = null;
        log.info("License expiry scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * One scheduler tick. Never throws, so the fixed-rate schedule keeps going.
     */
    void tick() {
        Optional<String> token;
        try {
            token = sweepLock.tryAcquire(lockKey, lockTtl);
        } catch (RuntimeException e) {
            log.error("Could not acquire license sweep lock {}: {}", lockKey, e.getMessage(), e);
            return;
        }
        if (token.isEmpty()) {
            log.debug("License sweep lock {} held by another instance, skipping tick", lockKey);
            return;
        }

        try {
            sweeper.runAll();
        } catch (RuntimeException e) {
            log.error("License sweep failed: {}", e.getMessage(), e);
        } finally {
            try {
                sweepLock.release(lockKey, token.get());
            } catch (RuntimeException e) {
                log.warn("Could not release license sweep lock {}: {}", lockKey, e.getMessage());
            }
        }
    }
}
