package com.goldtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes returned in the {@code error.code} field of every failed API call.
 *
 * <p>{@code retryable} tells clients whether the same request may succeed later without changes,
 * e.g. once the price feed or the queue backend is back.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, false),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, false),
    FORBIDDEN(HttpStatus.FORBIDDEN, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    INVALID_STATE(HttpStatus.CONFLICT, false),
    PRICE_UNAVAILABLE(HttpStatus.UNPROCESSABLE_ENTITY, true),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY, false),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, false),
    QUEUE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true);

    private final HttpStatus status;
    private final boolean retryable;

    public String getCode() {
        return name();
    }
}
