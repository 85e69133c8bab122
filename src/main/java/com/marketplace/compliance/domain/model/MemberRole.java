package com.marketplace.compliance.domain.model;

public enum MemberRole {
    OWNER,
    ADMIN,
    MANAGER,
    VIEWER,
    AGENT,
    STAFF,
    OPS
}
