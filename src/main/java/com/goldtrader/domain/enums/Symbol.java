package com.goldtrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tradable instruments and their pricing convention.
 *
 * <p>SPOT is quoted as a single price per gram used for both sides. GOLD96 is quoted
 * per baht-weight with separate buy (ask) and sell (bid) prices.
 */
@Getter
@RequiredArgsConstructor
public enum Symbol {
    SPOT("spot", false),
    GOLD96("gold96", true);

    private final String wireName;

    /** True when the feed publishes separate bid and ask prices for this symbol. */
    private final boolean twoSided;

    public static Symbol fromWireName(String value) {
        for (Symbol symbol : values()) {
            if (symbol.wireName.equalsIgnoreCase(value)) {
                return symbol;
            }
        }
        throw new IllegalArgumentException("Symbol must be 'spot' or 'gold96', got: " + value);
    }
}
