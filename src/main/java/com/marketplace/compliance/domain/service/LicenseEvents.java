package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.model.ActorRef;
import com.marketplace.compliance.domain.model.AggregateType;
import com.marketplace.compliance.domain.model.DomainEvent;
import com.marketplace.compliance.domain.model.LicenseStatusChangedEvent;
import com.marketplace.compliance.domain.model.OutboxEventType;
import com.marketplace.compliance.infrastructure.persistence.entity.LicenseEntity;

import java.time.Instant;

final class LicenseEvents {

    private LicenseEvents() {
    }

    static DomainEvent statusChanged(LicenseEntity license, String reason, ActorRef actor, Instant occurredAt) {
        return build(license, reason, null, actor, occurredAt);
    }

    /**
     * Notification that leaves the license status untouched.
     */
    static DomainEvent expiryWarning(LicenseEntity license, String reason, Instant occurredAt) {
        return build(license, reason, LicenseStatusChangedEvent.EXPIRY_WARNING, null, occurredAt);
    }

    private static DomainEvent build(LicenseEntity license, String reason, String warningType,
                                     ActorRef actor, Instant occurredAt) {
        return DomainEvent.builder()
                .eventType(OutboxEventType.LICENSE_STATUS_CHANGED)
                .aggregateType(AggregateType.LICENSE)
                .aggregateId(license.getId())
                .actor(actor)
                .data(LicenseStatusChangedEvent.builder()
                        .licenseId(license.getId())
                        .storeId(license.getStoreId())
                        .status(license.getStatus())
                        .reason(reason)
                        .warningType(warningType)
                        .build())
                .occurredAt(occurredAt)
                .build();
    }
}
