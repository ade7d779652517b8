package com.cleancity.api.error;

import org.springframework.http.HttpStatus;

/**
 * Canonical, machine-readable rejection codes returned to clients.
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    DAILY_LIMIT_REACHED(HttpStatus.TOO_MANY_REQUESTS),
    COOLDOWN_ACTIVE(HttpStatus.TOO_MANY_REQUESTS),
    STALE_PHOTO(HttpStatus.UNPROCESSABLE_ENTITY),
    DUPLICATE_REPORT(HttpStatus.CONFLICT),
    STATE_ERROR(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    PROXIMITY_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    TIMING_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    ALREADY_APPROVED(HttpStatus.CONFLICT),
    ALREADY_REJECTED(HttpStatus.CONFLICT),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() { return httpStatus; }
}
