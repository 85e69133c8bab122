package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.infrastructure.persistence.entity.MediaAttachmentEntity;
import com.marketplace.compliance.infrastructure.persistence.entity.MediaEntity;
import com.marketplace.compliance.infrastructure.persistence.repository.MediaAttachmentRepository;
import com.marketplace.compliance.infrastructure.persistence.repository.MediaRepository;
import com.marketplace.compliance.infrastructure.tx.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps media attachment rows in line with the media an aggregate references.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaAttachmentService {

    private final MediaAttachmentRepository attachmentRepository;
    private final MediaRepository mediaRepository;
    private final TransactionRunner transactionRunner;
    private final Clock clock;

    /**
     * Links media present only in {@code newMediaIds} and unlinks media present only in
     * {@code oldMediaIds}. Must run inside the caller's transaction.
     */
    public void reconcile(String entityType, UUID entityId, UUID storeId,
                          Collection<UUID> oldMediaIds, Collection<UUID> newMediaIds) {
        if (!transactionRunner.isTransactionActive()) {
            throw ComplianceException.internal("attachment reconcile requires an active transaction");
        }

        Set<UUID> removed = new LinkedHashSet<>(oldMediaIds);
        removed.removeAll(newMediaIds);
        Set<UUID> added = new LinkedHashSet<>(newMediaIds);
        added.removeAll(oldMediaIds);

        if (!removed.isEmpty()) {
            int deleted = attachmentRepository.deleteLinks(entityType, entityId, removed);
            log.debug("Unlinked {} media from {} {}", deleted, entityType, entityId);
        }

        for (UUID mediaId : added) {
            MediaEntity media = mediaRepository.findById(mediaId)
                    .orElseThrow(() -> ComplianceException.notFound("media not found"));
            if (!storeId.equals(media.getStoreId())) {
                throw ComplianceException.forbidden("media does not belong to active store");
            }
            attachmentRepository.save(MediaAttachmentEntity.builder()
                    .mediaId(mediaId)
                    .entityType(entityType)
                    .entityId(entityId)
                    .storeId(storeId)
                    .storageKey(media.getStorageKey())
                    .createdAt(clock.instant())
                    .build());
        }
    }
}
