package com.cateringhub.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Failure categories of the membership core. Each kind maps to exactly one HTTP status.
 */
public enum ErrorKind {

    FORBIDDEN(HttpStatus.FORBIDDEN),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    CONFLICT(HttpStatus.CONFLICT),
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    EXPIRED(HttpStatus.GONE),
    ALREADY_ACCEPTED(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
