package com.goldtrader.domain.enums;

/** Buy or sell side of a transaction. Wire form is the lowercase name ("buy", "sell"). */
public enum OrderSide {
    BUY,
    SELL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static OrderSide fromWireName(String value) {
        for (OrderSide side : values()) {
            if (side.wireName().equalsIgnoreCase(value)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Transaction side must be 'buy' or 'sell', got: " + value);
    }
}
