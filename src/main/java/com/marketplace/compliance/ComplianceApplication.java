package com.marketplace.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Vendor compliance service.
 *
 * Features:
 * - License lifecycle with store KYC derivation
 * - Transactional outbox for license status events
 * - Daily expiry, warning and retention sweeps
 * - Idempotent Stripe subscription reconciliation
 */
@SpringBootApplication
@EnableTransactionManagement
public class ComplianceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceApplication.class, args);
    }
}
