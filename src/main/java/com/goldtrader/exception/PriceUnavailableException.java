package com.goldtrader.exception;

import com.goldtrader.domain.enums.Symbol;

/**
 * Thrown when the price oracle has no usable price for a symbol, or the lookup did not
 * answer within the configured bound. Order creation aborts with no side effects.
 */
public class PriceUnavailableException extends BaseException {

    public PriceUnavailableException(Symbol symbol) {
        super(ErrorCode.PRICE_UNAVAILABLE, "No current price data available for " + symbol.getWireName());
    }

    public PriceUnavailableException(Symbol symbol, Throwable cause) {
        super(ErrorCode.PRICE_UNAVAILABLE, "No current price data available for " + symbol.getWireName(), cause);
    }
}
