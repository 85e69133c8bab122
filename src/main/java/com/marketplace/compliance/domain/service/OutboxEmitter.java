package com.marketplace.compliance.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.error.ErrorKind;
import com.marketplace.compliance.domain.model.DomainEvent;
import com.marketplace.compliance.infrastructure.persistence.entity.OutboxEventEntity;
import com.marketplace.compliance.infrastructure.persistence.repository.OutboxEventRepository;
import com.marketplace.compliance.infrastructure.tx.TransactionRunner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Appends domain events to the outbox table.
 *
 * The row is written with the caller's transaction, so it commits or rolls back
 * together with the state change it describes. There is no batching and no retry
 * here; delivery of committed rows is the relay's job.
 *
 * Payload envelope:
 * <pre>
 * {"version":1,"eventId":"...","occurredAt":"...","actor":{"userId":"...","storeId":"..."},"data":{...}}
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEmitter {

    private final OutboxEventRepository outboxEventRepository;
    private final TransactionRunner transactionRunner;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public OutboxEventEntity emit(DomainEvent event) {
        if (!transactionRunner.isTransactionActive()) {
            throw ComplianceException.internal("outbox emit requires an active transaction");
        }

        UUID eventId = UUID.randomUUID();
        Instant occurredAt = event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant();

        OutboxEventEntity outboxEvent = OutboxEventEntity.builder()
                .eventId(eventId)
                .eventType(event.getEventType())
                .aggregateType(event.getAggregateType())
                .aggregateId(event.getAggregateId())
                .payload(encode(eventId, occurredAt, event))
                .createdAt(occurredAt)
                .attemptCount(0)
                .build();

        outboxEvent = outboxEventRepository.save(outboxEvent);

        Counter.builder("outbox.events.queued")
                .tag("event_type", event.getEventType().name())
                .register(meterRegistry)
                .increment();

        log.debug("Queued outbox event {} ({}) for {} {}",
                eventId, event.getEventType(), event.getAggregateType(), event.getAggregateId());

        return outboxEvent;
    }

    private String encode(UUID eventId, Instant occurredAt, DomainEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("version", event.getVersion());
        envelope.put("eventId", eventId.toString());
        envelope.put("occurredAt", occurredAt.toString());
        if (event.getActor() != null) {
            envelope.put("actor", event.getActor());
        }
        envelope.put("data", event.getData());
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new ComplianceException(ErrorKind.INTERNAL, "encode outbox payload failed", e);
        }
    }
}
