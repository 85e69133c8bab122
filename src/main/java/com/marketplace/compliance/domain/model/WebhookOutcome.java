package com.marketplace.compliance.domain.model;

public enum WebhookOutcome {
    PROCESSED,
    IGNORED,
    DUPLICATE
}
