package com.marketplace.compliance.infrastructure.persistence.entity;

import com.marketplace.compliance.domain.model.AggregateType;
import com.marketplace.compliance.domain.model.OutboxEventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only outbox row.
 *
 * Written in the same transaction as the state change it describes. This service
 * never updates or deletes rows; {@code status}, {@code publishedAt},
 * {@code attemptCount} and {@code lastError} belong to the relay that ships them.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_status_created", columnList = "status,created_at"),
    @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type,aggregate_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    @Id
    private UUID eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private OutboxEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "aggregate_type", nullable = false, length = 30)
    private AggregateType aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column
    private Instant publishedAt;

    @Column(nullable = false)
    private Integer attemptCount;

    @Column(length = 1024)
    private String lastError;

    public enum EventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (attemptCount == null) {
            attemptCount = 0;
        }
    }
}
