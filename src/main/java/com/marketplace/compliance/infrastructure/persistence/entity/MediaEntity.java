package com.marketplace.compliance.infrastructure.persistence.entity;

import com.marketplace.compliance.domain.model.MediaKind;
import com.marketplace.compliance.domain.model.MediaStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Uploaded object owned by a store. Read-only here; uploads are handled elsewhere.
 */
@Entity
@Table(name = "media")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaEntity {

    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID storeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MediaKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MediaStatus status;

    @Column(length = 128)
    private String mimeType;

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

    /**
     * PDFs and images are the only accepted license documents.
     */
    public boolean hasDocumentMimeType() {
        if (mimeType == null || mimeType.isBlank()) {
            return false;
        }
        String lowered = mimeType.trim().toLowerCase(Locale.ROOT);
        return lowered.equals("application/pdf") || lowered.startsWith("image/");
    }
}
