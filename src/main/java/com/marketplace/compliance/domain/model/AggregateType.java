package com.marketplace.compliance.domain.model;

public enum AggregateType {
    LICENSE,
    STORE,
    SUBSCRIPTION
}
