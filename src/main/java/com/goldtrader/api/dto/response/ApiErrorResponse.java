package com.goldtrader.api.dto.response;

import com.goldtrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Failure envelope. {@code error.retryable} mirrors {@link ErrorCode#isRetryable()} so clients can tell
 * a dead price feed or queue apart from a request they must change.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getStatus().value())
                .retryable(errorCode.isRetryable())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Value
    @Builder
    public static class ErrorDetail {
        String code;
        int status;
        boolean retryable;
        String message;
        Map<String, Object> details;
        String path;
        Instant timestamp;
    }
}
