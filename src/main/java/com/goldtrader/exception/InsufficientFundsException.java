package com.goldtrader.exception;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

public class InsufficientFundsException extends BaseException {

    public InsufficientFundsException(String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
    }

    public InsufficientFundsException(BigDecimal required, BigDecimal available) {
        super(
                ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient balance: required %s, available %s", required, available),
                details(required, available));
    }

    private static Map<String, Object> details(BigDecimal required, BigDecimal available) {
        Map<String, Object> details = new HashMap<>();
        details.put("required", required);
        details.put("available", available);
        return details;
    }
}
