package com.marketplace.compliance.domain.model;

public enum MediaKind {
    PRODUCT,
    ADS,
    PDF,
    LICENSE_DOC,
    COA,
    MANIFEST,
    USER,
    OTHER
}
