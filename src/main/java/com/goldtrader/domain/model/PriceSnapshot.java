package com.goldtrader.domain.model;

import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Latest price published by the feed for one symbol.
 * Single-priced symbols fill {@code singlePrice}; two-sided symbols fill {@code bidPrice} and {@code askPrice}.
 */
@Data
@Builder
public class PriceSnapshot {

    private Symbol symbol;
    private BigDecimal singlePrice;

    /** Price the dealer pays when the user sells. */
    private BigDecimal bidPrice;

    /** Price the dealer charges when the user buys. */
    private BigDecimal askPrice;

    private LocalDateTime asOf;

    /**
     * Returns the per-unit price that applies to the given side, or null if the
     * snapshot does not carry it. Buys take the ask, sells take the bid; single-priced
     * symbols use the same price for both.
     */
    public BigDecimal priceFor(OrderSide side) {
        if (!symbol.isTwoSided()) {
            return singlePrice;
        }
        return side == OrderSide.BUY ? askPrice : bidPrice;
    }
}
