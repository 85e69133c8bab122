package com.marketplace.compliance.infrastructure.persistence.entity;

import com.marketplace.compliance.domain.model.LicenseStatus;
import com.marketplace.compliance.domain.model.LicenseType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Compliance license backed by an uploaded document.
 *
 * Status only moves along the lifecycle edges in {@link LicenseStatus}; the owning
 * store's KYC status is re-derived whenever it changes.
 */
@Entity
@Table(name = "licenses", indexes = {
    @Index(name = "idx_licenses_store_created", columnList = "store_id,created_at"),
    @Index(name = "idx_licenses_expiration", columnList = "expiration_date,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LicenseEntity {

    @Id
    private UUID id;

    @Column(name = "store_id", nullable = false)
    private UUID storeId;

    @Column(nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private LicenseStatus status;

    @Column(nullable = false)
    private UUID mediaId;

    @Column(length = 512)
    private String storageKey;

    @Column(nullable = false, length = 64)
    private String issuingState;

    @Column
    private LocalDate issueDate;

    @Column(name = "expiration_date")
    private LocalDate expirationDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LicenseType type;

    @Column(nullable = false, unique = true, length = 128)
    private String number;

    @Column(name = "created_at", nullable = false)
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
        if (status == null) {
            status = LicenseStatus.PENDING;
        }
    }
}
