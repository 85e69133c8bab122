package com.marketplace.compliance.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * External payment events this service reconciles. Anything else is acknowledged and ignored.
 */
public enum PaymentEventType {
    SUBSCRIPTION_CREATED("customer.subscription.created", true),
    SUBSCRIPTION_UPDATED("customer.subscription.updated", true),
    SUBSCRIPTION_DELETED("customer.subscription.deleted", true),
    INVOICE_PAID("invoice.paid", false),
    INVOICE_PAYMENT_SUCCEEDED("invoice.payment_succeeded", false),
    INVOICE_PAYMENT_FAILED("invoice.payment_failed", false);

    private final String wireName;
    private final boolean carriesSubscription;

    PaymentEventType(String wireName, boolean carriesSubscription) {
        this.wireName = wireName;
        this.carriesSubscription = carriesSubscription;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Subscription events embed the full subscription; invoice events only reference it by id.
     */
    public boolean carriesSubscription() {
        return carriesSubscription;
    }

    public static Optional<PaymentEventType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst();
    }
}
