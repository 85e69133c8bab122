package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.error.ErrorKind;
import com.marketplace.compliance.domain.model.PaymentEvent;
import com.marketplace.compliance.domain.model.WebhookOutcome;
import com.marketplace.compliance.support.InMemoryIdempotencyStore;
import com.marketplace.compliance.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentWebhookProcessorTest {

    private static final String KEY = "compliance:idempotency:stripe:webhook:evt_1";

    @Mock private PaymentEventReconciler reconciler;

    private InMemoryIdempotencyStore store;
    private SimpleMeterRegistry meterRegistry;
    private PaymentWebhookProcessor processor;

    private final PaymentEvent event = PaymentEvent.builder()
            .eventId("evt_1")
            .type("customer.subscription.updated")
            .build();

    @BeforeEach
    void setUp() {
        store = new InMemoryIdempotencyStore(new MutableClock(Instant.parse("2026-02-01T00:00:00Z")));
        meterRegistry = new SimpleMeterRegistry();
        IdempotencyGuard guard = new IdempotencyGuard(store, "compliance:idempotency", "stripe:webhook",
                Duration.ofHours(72));
        processor = new PaymentWebhookProcessor(guard, reconciler, meterRegistry);
    }

    @Test
    void process_redeliveryIsProcessedOnce() {
        when(reconciler.reconcile(event)).thenReturn(true);

        assertEquals(WebhookOutcome.PROCESSED, processor.process(event));
        assertEquals(WebhookOutcome.DUPLICATE, processor.process(event));

        verify(reconciler, times(1)).reconcile(event);
        assertEquals(1.0, meterRegistry.counter("payment.events",
                "type", "customer.subscription.updated", "result", "duplicate").count());
    }

    @Test
    void process_failureReleasesKeySoRetryIsProcessed() {
        when(reconciler.reconcile(event))
                .thenThrow(ComplianceException.dependency("fetch subscription", new IllegalStateException("502")))
                .thenReturn(true);

        ComplianceException e = assertThrows(ComplianceException.class, () -> processor.process(event));
        assertEquals(ErrorKind.DEPENDENCY, e.getKind());
        assertFalse(store.contains(KEY));

        assertEquals(WebhookOutcome.PROCESSED, processor.process(event));
        assertTrue(store.contains(KEY));
        verify(reconciler, times(2)).reconcile(event);
    }

    @Test
    void process_ignoredTypeStillClaimsKey() {
        PaymentEvent refund = PaymentEvent.builder().eventId("evt_1").type("charge.refunded").build();
        when(reconciler.reconcile(refund)).thenReturn(false);

        assertEquals(WebhookOutcome.IGNORED, processor.process(refund));
        assertTrue(store.contains(KEY));
    }

    @Test
    void process_missingEventIdIsValidationError() {
        PaymentEvent anonymous = PaymentEvent.builder().type("invoice.paid").build();

        ComplianceException e = assertThrows(ComplianceException.class, () -> processor.process(anonymous));

        assertEquals(ErrorKind.VALIDATION, e.getKind());
        verifyNoInteractions(reconciler);
    }
}
