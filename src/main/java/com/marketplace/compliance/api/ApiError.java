package com.marketplace.compliance.api;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ApiError {

    String code;
    String message;
    boolean retryable;
}
