package com.health.consult.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds of the consultation workflow, one per condition a caller must be able
 * to tell apart.
 */
public enum ErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.CONFLICT),
    SEQUENCE_VIOLATION(HttpStatus.CONFLICT),
    INVALID_ANSWER(HttpStatus.UNPROCESSABLE_ENTITY),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    CONFLICTING_REQUEST(HttpStatus.CONFLICT),
    ALREADY_PAID(HttpStatus.CONFLICT),
    AMOUNT_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_TIME(HttpStatus.BAD_REQUEST),
    SESSION_NOT_OWNED(HttpStatus.FORBIDDEN),
    FORBIDDEN(HttpStatus.FORBIDDEN);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
