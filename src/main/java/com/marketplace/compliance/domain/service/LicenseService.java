package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.ActorRef;
import com.marketplace.compliance.domain.model.CreateLicenseInput;
import com.marketplace.compliance.domain.model.KycStatus;
import com.marketplace.compliance.domain.model.LicenseCursor;
import com.marketplace.compliance.domain.model.LicenseListItem;
import com.marketplace.compliance.domain.model.LicensePage;
import com.marketplace.compliance.domain.model.LicenseRolePolicy;
import com.marketplace.compliance.domain.model.LicenseStatus;
import com.marketplace.compliance.domain.model.LicenseType;
import com.marketplace.compliance.domain.model.MediaKind;
import com.marketplace.compliance.domain.model.MemberRole;
import com.marketplace.compliance.infrastructure.persistence.entity.LicenseEntity;
import com.marketplace.compliance.infrastructure.persistence.entity.MediaAttachmentEntity;
import com.marketplace.compliance.infrastructure.persistence.entity.MediaEntity;
import com.marketplace.compliance.infrastructure.persistence.repository.LicenseRepository;
import com.marketplace.compliance.infrastructure.persistence.repository.MediaRepository;
import com.marketplace.compliance.infrastructure.persistence.repository.StoreMembershipRepository;
import com.marketplace.compliance.infrastructure.persistence.repository.StoreRepository;
import com.marketplace.compliance.infrastructure.tx.TransactionRunner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * License lifecycle: create, verify or reject, delete, and list.
 *
 * Every status transition runs as one transaction together with the store KYC
 * re-derivation and the outbox event that describes it. Validation, authorization
 * and state-machine failures are raised before anything is written.
 */
@Slf4j
@Service
public class LicenseService {

    private final LicenseRepository licenseRepository;
    private final StoreRepository storeRepository;
    private final StoreMembershipRepository membershipRepository;
    private final MediaRepository mediaRepository;
    private final MediaAttachmentService attachmentService;
    private final KycReconciler kycReconciler;
    private final OutboxEmitter outboxEmitter;
    private final DocumentUrlSigner urlSigner;
    private final TransactionRunner transactionRunner;
    private final LicenseRolePolicy rolePolicy;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration downloadUrlTtl;
    private final int defaultPageSize;
    private final int maxPageSize;

    public LicenseService(LicenseRepository licenseRepository,
                          StoreRepository storeRepository,
                          StoreMembershipRepository membershipRepository,
                          MediaRepository mediaRepository,
                          MediaAttachmentService attachmentService,
                          KycReconciler kycReconciler,
                          OutboxEmitter outboxEmitter,
                          DocumentUrlSigner urlSigner,
                          TransactionRunner transactionRunner,
                          LicenseRolePolicy rolePolicy,
                          MeterRegistry meterRegistry,
                          Clock clock,
                          @Value("${app.licenses.download-url-ttl:PT15M}") Duration downloadUrlTtl,
                          @Value("${app.licenses.page-size:25}") int defaultPageSize,
                          @Value("${app.licenses.max-page-size:100}") int maxPageSize) {
        this.licenseRepository = licenseRepository;
        this.storeRepository = storeRepository;
        this.membershipRepository = membershipRepository;
        this.mediaRepository = mediaRepository;
        this.attachmentService = attachmentService;
        this.kycReconciler = kycReconciler;
        this.outboxEmitter = outboxEmitter;
        this.urlSigner = urlSigner;
        this.transactionRunner = transactionRunner;
        this.rolePolicy = rolePolicy;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.downloadUrlTtl = downloadUrlTtl;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Creates a PENDING license backed by a ready license document of the store.
     *
     * Store KYC is not reconciled: a new PENDING license cannot move it anywhere
     * but towards PENDING_VERIFICATION.
     */
    public LicenseEntity createLicense(UUID userId, UUID storeId, CreateLicenseInput input) {
        if (userId == null || storeId == null) {
            throw ComplianceException.validation("user and store are required");
        }
        if (input == null) {
            throw ComplianceException.validation("license input is required");
        }
        if (input.getMediaId() == null) {
            throw ComplianceException.validation("media_id is required");
        }
        if (isBlank(input.getIssuingState())) {
            throw ComplianceException.validation("issuing_state is required");
        }
        if (isBlank(input.getNumber())) {
            throw ComplianceException.validation("number is required");
        }
        LicenseType type = LicenseType.parse(input.getType())
                .orElseThrow(() -> ComplianceException.validation("invalid license type"));

        requireRole(userId, storeId, rolePolicy.getCreateRoles());

        MediaEntity media = loadMedia(input.getMediaId());
        if (!storeId.equals(media.getStoreId())) {
            throw ComplianceException.forbidden("media does not belong to active store");
        }
        if (media.getKind() != MediaKind.LICENSE_DOC) {
            throw ComplianceException.validation("media must be a license document");
        }
        if (media.getStatus() == null || !media.getStatus().isAttachable()) {
            throw ComplianceException.conflict("media not ready");
        }
        if (!media.hasDocumentMimeType()) {
            throw ComplianceException.validation("media mime_type must be pdf or image");
        }

        Instant now = clock.instant();
        LicenseEntity license = LicenseEntity.builder()
                .id(UUID.randomUUID())
                .storeId(storeId)
                .userId(userId)
                .status(LicenseStatus.PENDING)
                .mediaId(media.getId())
                .storageKey(media.getStorageKey())
                .issuingState(input.getIssuingState().trim())
                .issueDate(input.getIssueDate())
                .expirationDate(input.getExpirationDate())
                .type(type)
                .number(input.getNumber().trim())
                .createdAt(now)
                .updatedAt(now)
                .build();

        LicenseEntity created;
        try {
            created = inTransaction("create license", () -> {
                LicenseEntity saved = licenseRepository.save(license);
                attachmentService.reconcile(MediaAttachmentEntity.ENTITY_LICENSE, saved.getId(), storeId,
                        Collections.emptyList(), List.of(media.getId()));
                outboxEmitter.emit(LicenseEvents.statusChanged(saved, null,
                        ActorRef.builder().userId(userId).storeId(storeId).build(), clock.instant()));
                return saved;
            });
        } catch (ComplianceException e) {
            if (e.getCause() instanceof DataIntegrityViolationException) {
                throw ComplianceException.conflict("license number already registered");
            }
            throw e;
        }

        countTransition(LicenseStatus.PENDING);
        log.info("License created: {} (store: {}, type: {}, user: {})",
                created.getId(), storeId, type, userId);
        return created;
    }

    /**
     * Finalizes a PENDING license as VERIFIED or REJECTED. Single-shot: a finalized
     * license yields CONFLICT, whatever the decision.
     */
    public LicenseEntity verifyLicense(UUID licenseId, LicenseStatus decision, String reason) {
        if (decision != LicenseStatus.VERIFIED && decision != LicenseStatus.REJECTED) {
            throw ComplianceException.validation("invalid decision");
        }
        if (licenseId == null) {
            throw ComplianceException.validation("license id is required");
        }

        LicenseEntity verified = inTransaction("verify license", () -> {
            LicenseEntity license = licenseRepository.findByIdForUpdate(licenseId)
                    .orElseThrow(() -> ComplianceException.notFound("license not found"));
            if (license.getStatus() != LicenseStatus.PENDING) {
                throw ComplianceException.conflict("license already finalized");
            }

            license.setStatus(decision);
            license.setUpdatedAt(clock.instant());
            LicenseEntity saved = licenseRepository.save(license);

            kycReconciler.reconcile(saved.getStoreId());
            outboxEmitter.emit(LicenseEvents.statusChanged(saved, trimToNull(reason), null, clock.instant()));
            return saved;
        });

        countTransition(decision);
        log.info("License {} finalized as {} (store: {})", licenseId, decision, verified.getStoreId());
        return verified;
    }

    /**
     * Deletes a REJECTED or EXPIRED license and its attachment link.
     *
     * Afterwards, outside the delete transaction, the store is put back to
     * PENDING_VERIFICATION when it has no VERIFIED license left. That step is
     * best-effort and never fails the delete.
     */
    public void deleteLicense(UUID userId, UUID storeId, UUID licenseId) {
        if (userId == null || storeId == null || licenseId == null) {
            throw ComplianceException.validation("user, store and license are required");
        }

        requireRole(userId, storeId, rolePolicy.getDeleteRoles());

        inTransaction("delete license", () -> {
            LicenseEntity license = licenseRepository.findByIdForUpdate(licenseId)
                    .orElseThrow(() -> ComplianceException.notFound("license not found"));
            if (!storeId.equals(license.getStoreId())) {
                throw ComplianceException.forbidden("license does not belong to active store");
            }
            if (!license.getStatus().isTerminal()) {
                throw ComplianceException.conflict("only rejected or expired licenses can be deleted");
            }

            attachmentService.reconcile(MediaAttachmentEntity.ENTITY_LICENSE, license.getId(), storeId,
                    List.of(license.getMediaId()), Collections.emptyList());
            licenseRepository.delete(license);
            return license;
        });

        log.info("License deleted: {} (store: {}, user: {})", licenseId, storeId, userId);
        resetKycWhenNoVerifiedLicenses(storeId);
    }

    public LicensePage listLicenses(UUID storeId, String cursor, Integer limit) {
        if (storeId == null) {
            throw ComplianceException.validation("store is required");
        }
        int pageSize = limit == null || limit <= 0 ? defaultPageSize : Math.min(limit, maxPageSize);
        LicenseCursor position = LicenseCursor.decode(cursor);

        List<LicenseEntity> rows;
        try {
            PageRequest page = PageRequest.of(0, pageSize + 1);
            rows = position == null
                    ? licenseRepository.findFirstPage(storeId, page)
                    : licenseRepository.findPageAfter(storeId, position.getCreatedAt(), position.getId(), page);
        } catch (RuntimeException e) {
            throw ComplianceException.dependency("list licenses", e);
        }

        boolean hasMore = rows.size() > pageSize;
        List<LicenseEntity> visible = hasMore ? rows.subList(0, pageSize) : rows;

        List<LicenseListItem> items = new ArrayList<>(visible.size());
        for (LicenseEntity license : visible) {
            items.add(toListItem(license));
        }

        String nextCursor = null;
        if (hasMore) {
            LicenseEntity last = visible.get(visible.size() - 1);
            nextCursor = new LicenseCursor(last.getCreatedAt(), last.getId()).encode();
        }
        return LicensePage.builder()
                .items(items)
                .cursor(nextCursor)
                .build();
    }

    private LicenseListItem toListItem(LicenseEntity license) {
        return LicenseListItem.builder()
                .id(license.getId())
                .storeId(license.getStoreId())
                .userId(license.getUserId())
                .status(license.getStatus())
                .mediaId(license.getMediaId())
                .issuingState(license.getIssuingState())
                .issueDate(license.getIssueDate())
                .expirationDate(license.getExpirationDate())
                .type(license.getType())
                .number(license.getNumber())
                .createdAt(license.getCreatedAt())
                .updatedAt(license.getUpdatedAt())
                .signedUrl(signedUrl(license))
                .build();
    }

    private String signedUrl(LicenseEntity license) {
        if (isBlank(license.getStorageKey())) {
            return "";
        }
        try {
            return urlSigner.sign(license.getStorageKey(), downloadUrlTtl);
        } catch (RuntimeException e) {
            throw ComplianceException.dependency("sign license document url", e);
        }
    }

    private void resetKycWhenNoVerifiedLicenses(UUID storeId) {
        try {
            long verified = licenseRepository.countByStoreIdAndStatus(storeId, LicenseStatus.VERIFIED);
            if (verified > 0) {
                return;
            }
            transactionRunner.run(() -> storeRepository.findByIdForUpdate(storeId)
                    .filter(store -> store.getKycStatus() != KycStatus.PENDING_VERIFICATION)
                    // re-count under the store lock; a verify may have committed meanwhile
                    .filter(store -> licenseRepository.countByStoreIdAndStatus(storeId, LicenseStatus.VERIFIED) == 0)
                    .ifPresent(store -> {
                        store.setKycStatus(KycStatus.PENDING_VERIFICATION);
                        store.setUpdatedAt(clock.instant());
                        storeRepository.save(store);
                        log.info("Store {} KYC reset to {} after license delete",
                                storeId, KycStatus.PENDING_VERIFICATION);
                    }));
        } catch (RuntimeException e) {
            log.warn("Post-delete KYC reset failed for store {}: {}", storeId, e.getMessage(), e);
        }
    }

    private void requireRole(UUID userId, UUID storeId, Set<MemberRole> roles) {
        boolean allowed;
        try {
            allowed = membershipRepository.existsByStoreIdAndUserIdAndRoleIn(storeId, userId, roles);
        } catch (RuntimeException e) {
            throw ComplianceException.dependency("check store membership", e);
        }
        if (!allowed) {
            log.warn("User {} lacks a required role {} on store {}", userId, roles, storeId);
            throw ComplianceException.forbidden("insufficient store role");
        }
    }

    private MediaEntity loadMedia(UUID mediaId) {
        try {
            return mediaRepository.findById(mediaId)
                    .orElseThrow(() -> ComplianceException.notFound("media not found"));
        } catch (ComplianceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ComplianceException.dependency("load media", e);
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionRunner.inTransaction(work);
        } catch (RuntimeException e) {
            throw ComplianceException.wrap(operation, e);
        }
    }

    private void countTransition(LicenseStatus status) {
        Counter.builder("license.transitions")
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
