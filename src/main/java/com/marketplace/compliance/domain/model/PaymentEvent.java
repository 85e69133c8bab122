package com.marketplace.compliance.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Externally delivered payment event, decoded from the provider's envelope.
 */
@Value
@Builder
public class PaymentEvent {

    /** Provider-assigned event id, the idempotency key. */
    String eventId;

    /** Provider event type, e.g. "customer.subscription.updated". */
    String type;

    /** Embedded subscription for subscription events. */
    ProviderSubscription subscription;

    /** Referenced subscription id for invoice events. */
    String subscriptionId;
}
