package com.marketplace.compliance.api;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.WebhookOutcome;
import com.marketplace.compliance.domain.service.PaymentWebhookProcessor;
import com.marketplace.compliance.infrastructure.stripe.StripeEventTranslator;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.net.Webhook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Stripe webhook endpoint.
 *
 * A 2xx tells Stripe the event is handled (processed, ignored or duplicate).
 * Failures answer with the error kind's status so Stripe redelivers retryable ones.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks/stripe")
public class StripeWebhookController {

    private final PaymentWebhookProcessor webhookProcessor;
    private final StripeEventTranslator eventTranslator;
    private final String webhookSecret;

    public StripeWebhookController(PaymentWebhookProcessor webhookProcessor,
                                   StripeEventTranslator eventTranslator,
                                   @Value("${app.stripe.webhook-secret:}") String webhookSecret) {
        this.webhookProcessor = webhookProcessor;
        this.eventTranslator = eventTranslator;
        this.webhookSecret = webhookSecret;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> handle(@RequestBody String payload,
                                                      @RequestHeader("Stripe-Signature") String signature) {
        Event event;
        try {
            event = Webhook.constructEvent(payload, signature, webhookSecret);
        } catch (SignatureVerificationException e) {
            log.warn("Rejected Stripe webhook with invalid signature: {}", e.getMessage());
            throw ComplianceException.validation("invalid webhook signature");
        }

        WebhookOutcome outcome = webhookProcessor.process(eventTranslator.translate(event));
        log.debug("Stripe event {} ({}) handled: {}", event.getId(), event.getType(), outcome);
        return ResponseEntity.ok(Collections.singletonMap("outcome", outcome.name().toLowerCase(Locale.ROOT)));
    }
}
