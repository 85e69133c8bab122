package com.marketplace.compliance.infrastructure.stripe;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.error.ErrorKind;
import com.marketplace.compliance.domain.model.PaymentEvent;
import com.stripe.Stripe;
import com.stripe.model.Event;
import com.stripe.net.ApiResource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StripeEventTranslatorTest {

    private final StripeEventTranslator translator = new StripeEventTranslator();

    @Test
    void translate_subscriptionEventEmbedsSubscription() {
        Event event = event("evt_sub", "customer.subscription.updated",
                "{\"id\":\"sub_123\",\"object\":\"subscription\",\"status\":\"canceled\","
                        + "\"metadata\":{\"store_id\":\"5f8a3c1e-0000-4000-8000-000000000001\"}}");

        PaymentEvent translated = translator.translate(event);

        assertEquals("evt_sub", translated.getEventId());
        assertEquals("customer.subscription.updated", translated.getType());
        assertEquals("sub_123", translated.getSubscription().getId());
        assertEquals("canceled", translated.getSubscription().getStatus());
        assertEquals("5f8a3c1e-0000-4000-8000-000000000001",
                translated.getSubscription().getMetadata().get("store_id"));
        assertNull(translated.getSubscriptionId());
    }

    @Test
    void translate_invoiceEventReferencesSubscription() {
        Event event = event("evt_inv", "invoice.payment_failed",
                "{\"id\":\"in_1\",\"object\":\"invoice\",\"subscription\":\"sub_123\"}");

        PaymentEvent translated = translator.translate(event);

        assertEquals("sub_123", translated.getSubscriptionId());
        assertNull(translated.getSubscription());
    }

    @Test
    void translate_unhandledTypeKeepsOnlyIdentity() {
        Event event = event("evt_other", "charge.refunded", "{\"id\":\"ch_1\",\"object\":\"charge\"}");

        PaymentEvent translated = translator.translate(event);

        assertEquals("evt_other", translated.getEventId());
        assertNull(translated.getSubscription());
        assertNull(translated.getSubscriptionId());
    }

    @Test
    void translate_mismatchedPayloadIsValidationError() {
        Event event = event("evt_bad", "customer.subscription.created",
                "{\"id\":\"in_1\",\"object\":\"invoice\"}");

        ComplianceException e = assertThrows(ComplianceException.class, () -> translator.translate(event));

        assertEquals(ErrorKind.VALIDATION, e.getKind());
    }

    private static Event event(String id, String type, String objectJson) {
        String json = "{\"id\":\"" + id + "\",\"object\":\"event\",\"api_version\":\"" + Stripe.API_VERSION
                + "\",\"type\":\"" + type + "\",\"data\":{\"object\":" + objectJson + "}}";
        return ApiResource.GSON.fromJson(json, Event.class);
    }
}
