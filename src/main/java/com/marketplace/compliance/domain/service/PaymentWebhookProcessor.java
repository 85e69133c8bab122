package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.PaymentEvent;
import com.marketplace.compliance.domain.model.WebhookOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Exactly-once processing of redelivered payment events.
 *
 * Processing Flow:
 * 1. Validate the event id
 * 2. Claim the id with the idempotency guard; an existing claim means duplicate
 * 3. Reconcile the event
 * 4. On failure release the claim and rethrow, so the provider's redelivery is processed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookProcessor {

    private final IdempotencyGuard idempotencyGuard;
    private final PaymentEventReconciler reconciler;
    private final MeterRegistry meterRegistry;

    public WebhookOutcome process(PaymentEvent event) {
        if (event == null || event.getEventId() == null || event.getEventId().isBlank()) {
            throw ComplianceException.validation("event id is required");
        }
        String eventId = event.getEventId();

        if (idempotencyGuard.checkAndMark(eventId)) {
            log.info("Duplicate payment event skipped: {} ({})", eventId, event.getType());
            count(event, "duplicate");
            return WebhookOutcome.DUPLICATE;
        }

        try {
            boolean handled = reconciler.reconcile(event);
            count(event, handled ? "processed" : "ignored");
            return handled ? WebhookOutcome.PROCESSED : WebhookOutcome.IGNORED;
        } catch (RuntimeException e) {
            log.error("Payment event {} ({}) failed: {}", eventId, event.getType(), e.getMessage(), e);
            release(eventId, e);
            count(event, "failed");
            throw ComplianceException.wrap("process payment event", e);
        }
    }

    private void release(String eventId, RuntimeException failure) {
        try {
            idempotencyGuard.delete(eventId);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.error("Failed to release idempotency key for payment event {}: {}", eventId, e.getMessage(), e);
        }
    }

    private void count(PaymentEvent event, String result) {
        Counter.builder("payment.events")
                .tag("type", event.getType() == null ? "unknown" : event.getType())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
