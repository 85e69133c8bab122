package com.marketplace.compliance.domain.model;

/**
 * Store-level compliance state. Derived from the store's licenses, never set directly.
 */
public enum KycStatus {
    PENDING_VERIFICATION,
    VERIFIED,
    EXPIRED,
    REJECTED
}
