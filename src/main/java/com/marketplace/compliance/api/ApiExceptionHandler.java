package com.marketplace.compliance.api;

import com.marketplace.compliance.domain.error.ComplianceException;
import com.marketplace.compliance.domain.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders failures as {@code {code, message, retryable}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ComplianceException.class)
    public ResponseEntity<ApiError> handleCompliance(ComplianceException e) {
        ErrorKind kind = e.getKind();
        if (kind == ErrorKind.DEPENDENCY || kind == ErrorKind.INTERNAL) {
            log.error("Request failed ({}): {}", kind, e.getMessage(), e);
        } else {
            log.warn("Request rejected ({}): {}", kind, e.getMessage());
        }
        return render(kind, e.getMessage());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return render(ErrorKind.VALIDATION, "malformed request");
    }

    private ResponseEntity<ApiError> render(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.getHttpStatus())
                .body(ApiError.builder()
                        .code(kind.name())
                        .message(message)
                        .retryable(kind.isRetryable())
                        .build());
    }
}
