package com.marketplace.compliance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event appended to the outbox in the same transaction as the state change it describes.
 */
@Value
@Builder
public class DomainEvent {

    OutboxEventType eventType;
    AggregateType aggregateType;
    UUID aggregateId;
    ActorRef actor;
    Object data;

    @Builder.Default
    int version = 1;

    Instant occurredAt;
}
