package com.goldtrader.exception;

/** Thrown when an operation is not allowed in the transaction's current status (e.g. cancelling a completed order). */
public class InvalidStateException extends BaseException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
