package com.marketplace.compliance.domain.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy shared by every operation.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, false),
    FORBIDDEN(HttpStatus.FORBIDDEN, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    CONFLICT(HttpStatus.CONFLICT, false),
    DEPENDENCY(HttpStatus.SERVICE_UNAVAILABLE, true),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, true);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorKind(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
