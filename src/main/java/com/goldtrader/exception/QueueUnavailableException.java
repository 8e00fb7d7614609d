package com.goldtrader.exception;

/**
 * Thrown when the work queue backend cannot be reached. Callers that already moved
 * money (a buy hold) must compensate before letting this propagate.
 */
public class QueueUnavailableException extends BaseException {

    public QueueUnavailableException(String message, Throwable cause) {
        super(ErrorCode.QUEUE_UNAVAILABLE, message, cause);
    }
}
