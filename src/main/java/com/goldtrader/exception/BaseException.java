package com.goldtrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the trading exceptions. Each carries an {@link ErrorCode}, which fixes the HTTP status,
 * and an optional map of details rendered under {@code error.details}.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    private BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    public boolean isServerError() {
        return errorCode.getStatus().is5xxServerError();
    }
}
