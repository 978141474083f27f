package com.example.dutyroster.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    VALIDATION(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    ALREADY_PUBLISHED(HttpStatus.CONFLICT),
    NOT_PUBLISHED(HttpStatus.CONFLICT),
    ALREADY_RESOLVED(HttpStatus.CONFLICT),
    ALREADY_REQUESTED(HttpStatus.CONFLICT),
    NOT_ACCEPTED(HttpStatus.CONFLICT),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT),
    FATIGUE_VIOLATION(HttpStatus.CONFLICT),
    UNAVAILABLE(HttpStatus.CONFLICT),
    NOTHING_TO_PUBLISH(HttpStatus.UNPROCESSABLE_ENTITY),
    STAFFING(HttpStatus.UNPROCESSABLE_ENTITY);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
