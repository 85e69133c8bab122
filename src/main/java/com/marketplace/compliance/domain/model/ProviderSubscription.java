package com.marketplace.compliance.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Provider-neutral snapshot of an external subscription as delivered by a webhook
 * or fetched from the provider API.
 */
@Value
@Builder
public class ProviderSubscription {

    String id;

    /** Raw provider status, e.g. "active" or "past_due". */
    String status;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    /** Price of the first line item, if any. */
    String priceId;

    Instant currentPeriodStart;
    Instant currentPeriodEnd;
    boolean cancelAtPeriodEnd;
    Instant canceledAt;
    String customerId;
    String paymentMethodId;
}
