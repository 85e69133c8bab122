package com.marketplace.compliance.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Who caused a domain event. Absent for system-driven transitions.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActorRef {

    UUID userId;
    UUID storeId;
}
