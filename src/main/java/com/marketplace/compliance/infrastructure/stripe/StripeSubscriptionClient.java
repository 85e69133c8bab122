package com.marketplace.compliance.infrastructure.stripe;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.model.ProviderSubscription;
import com.marketplace.compliance.domain.service.PaymentProviderClient;
import com.stripe.exception.StripeException;
import com.stripe.model.Subscription;
import com.stripe.net.RequestOptions;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Stripe API client for subscription lookups.
 *
 * Retry handles transient Stripe/network failures; the circuit breaker stops
 * hammering Stripe during an outage. Failures surface as DEPENDENCY.
 */
@Slf4j
@Component
public class StripeSubscriptionClient implements PaymentProviderClient {

    private final RequestOptions requestOptions;

    public StripeSubscriptionClient(@Value("${app.stripe.api-key:}") String apiKey) {
        this.requestOptions = RequestOptions.builder()
                .setApiKey(apiKey)
                .build();
    }

    @Override
    @CircuitBreaker(name = "stripeApi")
    @Retry(name = "stripeApi")
    public ProviderSubscription fetchSubscription(String subscriptionId) {
        try {
            Subscription subscription = Subscription.retrieve(subscriptionId, requestOptions);
            log.debug("Fetched Stripe subscription {} (status: {})", subscriptionId, subscription.getStatus());
            return StripeSubscriptionMapper.toProviderSubscription(subscription);
        } catch (StripeException e) {
            log.error("Stripe subscription fetch failed for {}: {}", subscriptionId, e.getMessage());
            throw ComplianceException.dependency("fetch stripe subscription", e);
        }
    }
}
