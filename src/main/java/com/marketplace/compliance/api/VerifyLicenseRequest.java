package com.marketplace.compliance.api;

import lombok.Data;

@Data
public class VerifyLicenseRequest {

    /** VERIFIED or REJECTED. */
    private String decision;

    private String reason;
}
