package com.marketplace.compliance.domain.error;

/**
 * Unchecked failure carrying an {@link ErrorKind} and a caller-facing message.
 *
 * Thrown inside a transactional unit it rolls the unit back.
 */
public class ComplianceException extends RuntimeException {

    private final ErrorKind kind;

    public ComplianceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ComplianceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ComplianceException validation(String message) {
        return new ComplianceException(ErrorKind.VALIDATION, message);
    }

    public static ComplianceException forbidden(String message) {
        return new ComplianceException(ErrorKind.FORBIDDEN, message);
    }

    public static ComplianceException notFound(String message) {
        return new ComplianceException(ErrorKind.NOT_FOUND, message);
    }

    public static ComplianceException conflict(String message) {
        return new ComplianceException(ErrorKind.CONFLICT, message);
    }

    public static ComplianceException internal(String message) {
        return new ComplianceException(ErrorKind.INTERNAL, message);
    }

    /**
     * Wraps a collaborator failure with the name of the operation that hit it.
     */
    public static ComplianceException dependency(String operation, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new ComplianceException(ErrorKind.DEPENDENCY, operation + " failed" + detail, cause);
    }

    /**
     * Passes a {@link ComplianceException} through unchanged and wraps anything else as DEPENDENCY.
     */
    public static ComplianceException wrap(String operation, RuntimeException e) {
        if (e instanceof ComplianceException) {
            return (ComplianceException) e;
        }
        return dependency(operation, e);
    }
}
