package com.goldtrader.exception;

import java.util.Map;
import lombok.Getter;

/** A request value that passed bean validation but breaks a trading rule. Reported as a field error. */
@Getter
public class BusinessException extends BaseException {

    private final String field;

    public BusinessException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of(field, message));
        this.field = field;
    }
}
