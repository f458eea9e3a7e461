package com.dbbaskette.envsync.error;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes surfaced in API responses, batch results and audit metadata.
 */
public enum ErrorCode {
    GITHUB_SECRETS_RATE_LIMIT_EXHAUSTED(HttpStatus.TOO_MANY_REQUESTS),
    GITHUB_SECRETS_SECONDARY_RATE_LIMIT(HttpStatus.TOO_MANY_REQUESTS),
    GITHUB_SECRETS_ENCRYPTION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    GITHUB_SCOPE_UNREACHABLE(HttpStatus.SERVICE_UNAVAILABLE),
    GITHUB_API_ERROR(HttpStatus.BAD_GATEWAY),
    GITHUB_TOKEN_MISSING(HttpStatus.SERVICE_UNAVAILABLE),
    GITHUB_ENV_REVIEWER_NOT_FOUND(HttpStatus.UNPROCESSABLE_ENTITY),
    PROJECT_NOT_CONFIGURED(HttpStatus.BAD_REQUEST),
    CONFLICT_DETECTED(HttpStatus.CONFLICT),
    WRITE_TIMED_OUT(HttpStatus.GATEWAY_TIMEOUT),
    IDEMPOTENCY_PAYLOAD_DIVERGENCE(HttpStatus.UNPROCESSABLE_ENTITY),
    IDEMPOTENCY_IN_PROGRESS(HttpStatus.CONFLICT),
    VALUES_SOURCE_UNAVAILABLE(HttpStatus.BAD_REQUEST),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() { return httpStatus; }
}
