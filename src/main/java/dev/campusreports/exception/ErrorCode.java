package dev.campusreports.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the report engine. Every code is recoverable by the caller.
 */
public enum ErrorCode {
    INVALID_TRANSITION(HttpStatus.CONFLICT, "error.invalid_transition"),
    INVALID_STATE(HttpStatus.CONFLICT, "error.invalid_state"),
    LOCKED(HttpStatus.LOCKED, "error.locked"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "error.not_found"),
    UNAUTHORIZED(HttpStatus.FORBIDDEN, "error.unauthorized"),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "error.validation_failed");

    private final HttpStatus httpStatus;
    private final String messageKey;

    ErrorCode(HttpStatus httpStatus, String messageKey) {
        this.httpStatus = httpStatus;
        this.messageKey = messageKey;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }

    public String messageKey() {
        return messageKey;
    }
}
