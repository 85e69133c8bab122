package com.marketplace.compliance.infrastructure.persistence.entity;

import com.marketplace.compliance.domain.model.MemberRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "store_memberships",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_store_memberships_store_user", columnNames = {"store_id", "user_id"})
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreMembershipEntity {

    @Id
    private UUID id;

    @Column(name = "store_id", nullable = false)
    private UUID storeId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MemberRole role;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
