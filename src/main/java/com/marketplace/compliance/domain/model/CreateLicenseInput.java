package com.marketplace.compliance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateLicenseInput {

    UUID mediaId;
    String issuingState;
    LocalDate issueDate;
    LocalDate expirationDate;
    String type;
    String number;
}
