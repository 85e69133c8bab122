package com.marketplace.compliance.domain.model;

public enum MediaStatus {
    PENDING,
    UPLOADED,
    PROCESSING,
    READY,
    FAILED,
    DELETE_REQUESTED,
    DELETED,
    DELETE_FAILED;

    /**
     * Upload finished and the object can be referenced by an aggregate.
     */
    public boolean isAttachable() {
        return this == UPLOADED || this == READY;
    }
}
