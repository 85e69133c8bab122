package com.marketplace.compliance.infrastructure.persistence.entity;

import com.marketplace.compliance.domain.model.KycStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Compliance view of a vendor store.
 *
 * {@code kycStatus} and {@code subscriptionActive} are derived fields: the former from
 * the store's licenses, the latter from its synced subscription.
 */
@Entity
@Table(name = "stores")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreEntity {

    @Id
    private UUID id;

    @Column(nullable = false, length = 200)
    private String companyName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private KycStatus kycStatus;

    @Column(nullable = false)
    private boolean subscriptionActive;

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
        if (kycStatus == null) {
            kycStatus = KycStatus.PENDING_VERIFICATION;
        }
    }
}
