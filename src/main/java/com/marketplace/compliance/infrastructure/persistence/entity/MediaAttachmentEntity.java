package com.marketplace.compliance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Link between a media object and the aggregate that references it.
 */
@Entity
@Table(name = "media_attachments",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_media_attachments_entity_media",
            columnNames = {"entity_type", "entity_id", "media_id"})
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaAttachmentEntity {

    public static final String ENTITY_LICENSE = "license";

    @Id
    private UUID id;

    @Column(name = "media_id", nullable = false)
    private UUID mediaId;

    @Column(name = "entity_type", nullable = false, length = 50)
    private String entityType;

    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(nullable = false)
    private UUID storeId;

    @Column(length = 512)
    private String storageKey;

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
