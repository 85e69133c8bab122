package com.marketplace.compliance.config;

import com.marketplace.compliance.domain.model.LicenseRolePolicy;
import com.marketplace.compliance.domain.model.MemberRole;
import com.marketplace.compliance.domain.service.DocumentUrlSigner;
import com.marketplace.compliance.domain.service.IdempotencyGuard;
import com.marketplace.compliance.domain.service.IdempotencyStore;
import com.marketplace.compliance.infrastructure.storage.HmacDocumentUrlSigner;
import com.marketplace.compliance.infrastructure.tx.SpringTransactionRunner;
import com.marketplace.compliance.infrastructure.tx.TransactionRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Configuration
public class ComplianceConfig {

    static final String PAYMENT_WEBHOOK_SCOPE = "stripe:webhook";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionRunner transactionRunner(PlatformTransactionManager transactionManager) {
        return new SpringTransactionRunner(transactionManager);
    }

    @Bean
    public LicenseRolePolicy licenseRolePolicy(
            @Value("${app.licenses.create-roles:owner,admin,manager,staff,ops}") String[] createRoles,
            @Value("${app.licenses.delete-roles:owner,manager}") String[] deleteRoles) {
        return new LicenseRolePolicy(parseRoles(createRoles), parseRoles(deleteRoles));
    }

    @Bean
    public IdempotencyGuard paymentEventGuard(
            IdempotencyStore idempotencyStore,
            @Value("${app.idempotency.key-prefix:compliance:idempotency}") String keyPrefix,
            @Value("${app.idempotency.ttl:PT72H}") Duration ttl) {
        return new IdempotencyGuard(idempotencyStore, keyPrefix, PAYMENT_WEBHOOK_SCOPE, ttl);
    }

    @Bean
    public DocumentUrlSigner documentUrlSigner(
            @Value("${app.storage.base-url}") String baseUrl,
            @Value("${app.storage.signing-secret}") String signingSecret,
            Clock clock) {
        return new HmacDocumentUrlSigner(baseUrl, signingSecret, clock);
    }

    private static List<MemberRole> parseRoles(String[] roles) {
        return Arrays.stream(roles)
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .map(role -> MemberRole.valueOf(role.toUpperCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }
}
