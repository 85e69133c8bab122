package com.marketplace.compliance.infrastructure.stripe;

import com.marketplace.compliance.domain.model.ProviderSubscription;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;

import java.time.Instant;

/**
 * Maps Stripe's subscription model onto {@link ProviderSubscription}.
 */
public final class StripeSubscriptionMapper {

    private StripeSubscriptionMapper() {
    }

    public static ProviderSubscription toProviderSubscription(Subscription subscription) {
        ProviderSubscription.ProviderSubscriptionBuilder builder = ProviderSubscription.builder()
                .id(subscription.getId())
                .status(subscription.getStatus())
                .priceId(firstPriceId(subscription))
                .currentPeriodStart(toInstant(subscription.getCurrentPeriodStart()))
                .currentPeriodEnd(toInstant(subscription.getCurrentPeriodEnd()))
                .cancelAtPeriodEnd(Boolean.TRUE.equals(subscription.getCancelAtPeriodEnd()))
                .canceledAt(toInstant(subscription.getCanceledAt()))
                .customerId(subscription.getCustomer())
                .paymentMethodId(subscription.getDefaultPaymentMethod());
        if (subscription.getMetadata() != null) {
            builder.metadata(subscription.getMetadata());
        }
        return builder.build();
    }

    private static String firstPriceId(Subscription subscription) {
        if (subscription.getItems() == null || subscription.getItems().getData() == null) {
            return null;
        }
        for (SubscriptionItem item : subscription.getItems().getData()) {
            Price price = item.getPrice();
            if (price != null && price.getId() != null) {
                return price.getId();
            }
        }
        return null;
    }

    private static Instant toInstant(Long epochSeconds) {
        return epochSeconds == null || epochSeconds == 0L ? null : Instant.ofEpochSecond(epochSeconds);
    }
}
