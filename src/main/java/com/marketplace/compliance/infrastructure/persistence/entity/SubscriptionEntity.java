package com.marketplace.compliance.infrastructure.persistence.entity;

import com.marketplace.compliance.domain.model.SubscriptionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Local mirror of a payment provider subscription.
 *
 * One row per external subscription id; the row is bound to a single store.
 */
@Entity
@Table(name = "subscriptions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_subscriptions_external_id", columnNames = "external_subscription_id")
    },
    indexes = {
        @Index(name = "idx_subscriptions_store", columnList = "store_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionEntity {

    @Id
    private UUID id;

    @Column(name = "store_id", nullable = false)
    private UUID storeId;

    @Column(name = "external_subscription_id", nullable = false, length = 255)
    private String externalSubscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SubscriptionStatus status;

    @Column(length = 255)
    private String priceId;

    @Column
    private Instant currentPeriodStart;

    @Column
    private Instant currentPeriodEnd;

    @Column(nullable = false)
    private boolean cancelAtPeriodEnd;

    @Column
    private Instant canceledAt;

    @Column(length = 255)
    private String customerId;

    @Column(length = 255)
    private String paymentMethodId;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
