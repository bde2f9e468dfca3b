package com.clinicflow.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Stable machine-readable error codes returned in {@code ProblemResponse.code}.
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    CROSS_TENANT_ACCESS(HttpStatus.FORBIDDEN),
    DEPT_ACCESS_DENIED(HttpStatus.FORBIDDEN),
    SLOT_CONFLICT(HttpStatus.CONFLICT),
    VERSION_CONFLICT(HttpStatus.CONFLICT),
    HAS_IN_PROGRESS(HttpStatus.CONFLICT),
    AVAILABILITY_OVERLAP(HttpStatus.CONFLICT),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
