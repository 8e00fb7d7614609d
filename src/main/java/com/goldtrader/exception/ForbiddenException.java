package com.goldtrader.exception;

/** Thrown when a user touches a transaction owned by someone else. */
public class ForbiddenException extends BaseException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
