package com.marketplace.compliance.domain.model;

/**
 * Lifecycle state of a compliance license.
 *
 * Allowed transitions: PENDING -> VERIFIED, PENDING -> REJECTED,
 * PENDING/VERIFIED -> EXPIRED. EXPIRED and REJECTED are terminal.
 */
public enum LicenseStatus {
    PENDING,
    VERIFIED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == REJECTED || this == EXPIRED;
    }

    public boolean isExpirable() {
        return this == PENDING || this == VERIFIED;
    }
}
