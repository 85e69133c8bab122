package com.marketplace.compliance.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Payload of {@link OutboxEventType#LICENSE_STATUS_CHANGED}.
 *
 * A non-null {@code warningType} marks a notification that did not change the status.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class LicenseStatusChangedEvent {

    public static final String EXPIRY_WARNING = "expiry_warning";

    UUID licenseId;
    UUID storeId;
    LicenseStatus status;
    String reason;
    String warningType;
}
