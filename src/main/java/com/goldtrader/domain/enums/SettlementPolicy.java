package com.goldtrader.domain.enums;

/**
 * Which side of an order stays fixed when it is re-priced at execution time.
 *
 * <ul>
 *   <li>AMOUNT_PRESERVING: the cash amount is fixed; quantity = amount / current price.
 *       A buy never needs a refund or an extra charge.</li>
 *   <li>QUANTITY_PRESERVING: the quoted quantity (amount / quoted price) is fixed; the
 *       executed amount follows the current price, so buys are refunded or charged the difference.</li>
 * </ul>
 */
public enum SettlementPolicy {
    AMOUNT_PRESERVING,
    QUANTITY_PRESERVING
}
