package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.KycStatus;
import com.marketplace.compliance.domain.model.LicenseStatus;
import com.marketplace.compliance.infrastructure.persistence.entity.StoreEntity;
import com.marketplace.compliance.infrastructure.persistence.repository.LicenseRepository;
import com.marketplace.compliance.infrastructure.persistence.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StoreKycReconciler implements KycReconciler {

    private final LicenseRepository licenseRepository;
    private final StoreRepository storeRepository;
    private final Clock clock;

    /**
     * Must run inside the caller's transaction; the store row stays locked until it ends.
     * Writes the store row only when the derived status differs from the stored one.
     * No event is emitted for the KYC change itself.
     */
    @Override
    public KycStatus reconcile(UUID storeId) {
        // Store lock first: statuses read below must include every committed transition
        StoreEntity store = storeRepository.findByIdForUpdate(storeId)
                .orElseThrow(() -> ComplianceException.notFound("store not found"));

        List<LicenseStatus> statuses = licenseRepository.findStatusesByStoreId(storeId);
        KycStatus derived = KycStatusRules.derive(statuses);

        if (store.getKycStatus() == derived) {
            log.debug("Store {} KYC status unchanged: {}", storeId, derived);
            return derived;
        }

        KycStatus previous = store.getKycStatus();
        store.setKycStatus(derived);
        store.setUpdatedAt(clock.instant());
        storeRepository.save(store);

        log.info("Store {} KYC status changed: {} -> {}", storeId, previous, derived);
        return derived;
    }
}
