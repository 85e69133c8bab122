package com.marketplace.compliance.infrastructure.stripe;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.PaymentEvent;
import com.marketplace.compliance.domain.model.PaymentEventType;
import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.Invoice;
import com.stripe.model.StripeObject;
import com.stripe.model.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a verified Stripe {@link Event} into a provider-neutral {@link PaymentEvent}.
 */
@Slf4j
@Component
public class StripeEventTranslator {

    public PaymentEvent translate(Event event) {
        PaymentEvent.PaymentEventBuilder builder = PaymentEvent.builder()
                .eventId(event.getId())
                .type(event.getType());

        Optional<PaymentEventType> type = PaymentEventType.fromWireName(event.getType());
        if (type.isEmpty()) {
            return builder.build();
        }

        StripeObject object = dataObject(event);
        if (type.get().carriesSubscription()) {
            if (!(object instanceof Subscription)) {
                throw ComplianceException.validation("event payload is not a subscription");
            }
            builder.subscription(StripeSubscriptionMapper.toProviderSubscription((Subscription) object));
        } else {
            if (!(object instanceof Invoice)) {
                throw ComplianceException.validation("event payload is not an invoice");
            }
            builder.subscriptionId(((Invoice) object).getSubscription());
        }
        return builder.build();
    }

    private StripeObject dataObject(Event event) {
        EventDataObjectDeserializer deserializer = event.getDataObjectDeserializer();
        Optional<StripeObject> object = deserializer.getObject();
        if (object.isPresent()) {
            return object.get();
        }
        // API version mismatch between the account and the library
        try {
            return deserializer.deserializeUnsafe();
        } catch (EventDataObjectDeserializationException e) {
            log.warn("Could not decode Stripe event {} ({}): {}", event.getId(), event.getType(), e.getMessage());
            throw ComplianceException.validation("undecodable event payload");
        }
    }
}
