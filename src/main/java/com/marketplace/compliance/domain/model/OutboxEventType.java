package com.marketplace.compliance.domain.model;

public enum OutboxEventType {
    LICENSE_STATUS_CHANGED
}
