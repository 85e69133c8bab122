package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.LicenseStatus;
import com.marketplace.compliance.infrastructure.persistence.entity.LicenseEntity;
import com.marketplace.compliance.infrastructure.persistence.entity.MediaAttachmentEntity;
import com.marketplace.compliance.infrastructure.persistence.repository.LicenseRepository;
import com.marketplace.compliance.infrastructure.tx.TransactionRunner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Time-driven license sweeps.
 *
 * Sweep Types:
 * - warn: one notification per license expiring exactly {@code warningDays} from today (UTC)
 * - expire: licenses whose expiration date is today or earlier become EXPIRED
 * - purge: EXPIRED licenses past the retention window are removed
 *
 * Failure Handling:
 * - Each license runs in its own transaction
 * - The first failure aborts the sweep and is rethrown; the remaining candidates
 *   are picked up by the next run
 * - Re-running a sweep on the same day is a no-op for licenses already handled
 */
@Slf4j
@Service
public class LicenseExpirySweeper {

    static final String EXPIRED_REASON = "expired by scheduler";

    private static final Set<LicenseStatus> EXPIRABLE = Collections.unmodifiableSet(
            EnumSet.of(LicenseStatus.PENDING, LicenseStatus.VERIFIED));

    private final LicenseRepository licenseRepository;
    private final KycReconciler kycReconciler;
    private final OutboxEmitter outboxEmitter;
    private final MediaAttachmentService attachmentService;
    private final TransactionRunner transactionRunner;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int warningDays;
    private final int retentionDays;

    public LicenseExpirySweeper(LicenseRepository licenseRepository,
                                KycReconciler kycReconciler,
                                OutboxEmitter outboxEmitter,
                                MediaAttachmentService attachmentService,
                                TransactionRunner transactionRunner,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Value("${app.scheduler.warning-days:14}") int warningDays,
                                @Value("${app.scheduler.retention-days:30}") int retentionDays) {
        this.licenseRepository = licenseRepository;
        this.kycReconciler = kycReconciler;
        this.outboxEmitter = outboxEmitter;
        this.attachmentService = attachmentService;
        this.transactionRunner = transactionRunner;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.warningDays = warningDays;
        this.retentionDays = retentionDays;
    }

    /**
     * Runs every sweep once. A failing sweep does not prevent the next one from
     * running; the first failure is rethrown with the others attached as suppressed.
     */
    public void runAll() {
        ComplianceException failure = null;
        failure = collect(failure, this::warnExpiring);
        failure = collect(failure, this::expireLicenses);
        failure = collect(failure, this::purgeExpired);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * @return number of warning events emitted
     */
    public int warnExpiring() {
        return measure("warn", () -> {
            LocalDate target = today().plusDays(warningDays);
            List<LicenseEntity> candidates =
                    licenseRepository.findByExpirationDateAndStatusInOrderByIdAsc(target, EXPIRABLE);

            String reason = "expires on " + target;
            int warned = 0;
            for (LicenseEntity license : candidates) {
                inTransaction("warn license expiry " + license.getId(), () -> {
                    outboxEmitter.emit(LicenseEvents.expiryWarning(license, reason, clock.instant()));
                    return null;
                });
                warned++;
            }
            if (warned > 0) {
                log.info("Emitted {} expiry warnings for licenses expiring on {}", warned, target);
            }
            return warned;
        });
    }

    /**
     * @return number of licenses moved to EXPIRED
     */
    public int expireLicenses() {
        return measure("expire", () -> {
            LocalDate today = today();
            List<LicenseEntity> candidates = licenseRepository
                    .findByExpirationDateLessThanEqualAndStatusInOrderByExpirationDateAscIdAsc(today, EXPIRABLE);

            int expired = 0;
            for (LicenseEntity candidate : candidates) {
                UUID licenseId = candidate.getId();
                boolean changed = inTransaction("expire license " + licenseId, () -> expireOne(licenseId));
                if (changed) {
                    expired++;
                }
            }
            return expired;
        });
    }

    /**
     * @return number of expired licenses deleted
     */
    public int purgeExpired() {
        return measure("purge", () -> {
            LocalDate cutoff = today().minusDays(retentionDays);
            List<LicenseEntity> candidates = licenseRepository
                    .findByStatusAndExpirationDateBeforeOrderByExpirationDateAscIdAsc(LicenseStatus.EXPIRED, cutoff);

            int purged = 0;
            for (LicenseEntity candidate : candidates) {
                UUID licenseId = candidate.getId();
                boolean removed = inTransaction("purge license " + licenseId, () -> purgeOne(licenseId));
                if (removed) {
                    purged++;
                }
            }
            return purged;
        });
    }

    private boolean expireOne(UUID licenseId) {
        LicenseEntity license = licenseRepository.findByIdForUpdate(licenseId).orElse(null);
        if (license == null || !license.getStatus().isExpirable()) {
            // Deleted, expired or finalized since the candidate query ran
            log.debug("Skipping expiry of license {}: no longer expirable", licenseId);
            return false;
        }

        LicenseStatus previous = license.getStatus();
        license.setStatus(LicenseStatus.EXPIRED);
        license.setUpdatedAt(clock.instant());
        LicenseEntity saved = licenseRepository.save(license);

        kycReconciler.reconcile(saved.getStoreId());
        outboxEmitter.emit(LicenseEvents.statusChanged(saved, EXPIRED_REASON, null, clock.instant()));

        Counter.builder("license.transitions")
                .tag("status", LicenseStatus.EXPIRED.name())
                .register(meterRegistry)
                .increment();
        log.info("License {} expired by scheduler (was {}, store: {}, expiration: {})",
                licenseId, previous, saved.getStoreId(), saved.getExpirationDate());
        return true;
    }

    private boolean purgeOne(UUID licenseId) {
        LicenseEntity license = licenseRepository.findByIdForUpdate(licenseId).orElse(null);
        if (license == null || license.getStatus() != LicenseStatus.EXPIRED) {
            return false;
        }

        attachmentService.reconcile(MediaAttachmentEntity.ENTITY_LICENSE, license.getId(), license.getStoreId(),
                List.of(license.getMediaId()), Collections.emptyList());
        licenseRepository.delete(license);
        kycReconciler.reconcile(license.getStoreId());

        log.info("Purged expired license {} (store: {}, expiration: {})",
                licenseId, license.getStoreId(), license.getExpirationDate());
        return true;
    }

    private int measure(String sweep, Supplier<Integer> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String result = "success";
        try {
            int processed = body.get();
            Counter.builder("license.sweep.processed")
                    .tag("sweep", sweep)
                    .register(meterRegistry)
                    .increment(processed);
            return processed;
        } catch (RuntimeException e) {
            result = "failure";
            throw e;
        } finally {
            sample.stop(Timer.builder("license.sweep.latency")
                    .tag("sweep", sweep)
                    .register(meterRegistry));
            Counter.builder("license.sweep.runs")
                    .tag("sweep", sweep)
                    .tag("result", result)
                    .register(meterRegistry)
                    .increment();
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionRunner.inTransaction(work);
        } catch (RuntimeException e) {
            throw ComplianceException.wrap(operation, e);
        }
    }

    private ComplianceException collect(ComplianceException failure, Supplier<Integer> sweep) {
        try {
            sweep.get();
            return failure;
        } catch (RuntimeException e) {
            ComplianceException wrapped = ComplianceException.wrap("license sweep", e);
            if (failure == null) {
                return wrapped;
            }
            failure.addSuppressed(wrapped);
            return failure;
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
