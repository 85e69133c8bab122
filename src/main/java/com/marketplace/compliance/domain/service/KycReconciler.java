package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.model.KycStatus;

import java.util.UUID;

/**
 * Re-derives and persists a store's KYC status. Must run inside the caller's transaction.
 */
public interface KycReconciler {

    KycStatus reconcile(UUID storeId);
}
