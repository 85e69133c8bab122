package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.model.KycStatus;
import com.marketplace.compliance.domain.model.LicenseStatus;

import java.util.Collection;

/**
 * Derives a store's KYC status from the statuses of all of its current licenses.
 *
 * Precedence, first match wins:
 * 1. any VERIFIED license: VERIFIED
 * 2. at least one EXPIRED and no REJECTED: EXPIRED
 * 3. at least one REJECTED: REJECTED
 * 4. otherwise: PENDING_VERIFICATION
 */
public final class KycStatusRules {

    private KycStatusRules() {
    }

    public static KycStatus derive(Collection<LicenseStatus> licenseStatuses) {
        boolean expired = false;
        boolean rejected = false;
        for (LicenseStatus status : licenseStatuses) {
            if (status == LicenseStatus.VERIFIED) {
                return KycStatus.VERIFIED;
            }
            if (status == LicenseStatus.EXPIRED) {
                expired = true;
            } else if (status == LicenseStatus.REJECTED) {
                rejected = true;
            }
        }
        if (expired && !rejected) {
            return KycStatus.EXPIRED;
        }
        if (rejected) {
            return KycStatus.REJECTED;
        }
        return KycStatus.PENDING_VERIFICATION;
    }
}
