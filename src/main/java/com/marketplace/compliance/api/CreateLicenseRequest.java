package com.marketplace.compliance.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDate;
import java.util.UUID;

@Data
public class CreateLicenseRequest {

    @JsonProperty("media_id")
    private UUID mediaId;

    @JsonProperty("issuing_state")
    private String issuingState;

    @JsonProperty("issue_date")
    private LocalDate issueDate;

    @JsonProperty("expiration_date")
    private LocalDate expirationDate;

    private String type;

    private String number;
}
