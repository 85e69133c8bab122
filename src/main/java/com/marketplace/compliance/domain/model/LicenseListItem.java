package com.marketplace.compliance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LicenseListItem {

    UUID id;
    UUID storeId;
    UUID userId;
    LicenseStatus status;
    UUID mediaId;
    String issuingState;
    LocalDate issueDate;
    LocalDate expirationDate;
    LicenseType type;
    String number;
    Instant createdAt;
    Instant updatedAt;

    /** Empty when the license has no stored document. */
    String signedUrl;
}
