package com.marketplace.compliance.domain.service;

import com.marketplace.compliance.domain.model.ProviderSubscription;

public interface PaymentProviderClient {

    /**
     * Fetches the current state of a subscription from the payment provider.
     *
     * @throws com.marketplace.compliance.domain.error.ComplianceException DEPENDENCY when the provider call fails
     */
    ProviderSubscription fetchSubscription(String subscriptionId);
}
