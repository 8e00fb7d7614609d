package com.goldtrader.domain.enums;

/** Why a settlement attempt did not produce an outcome. Drives the worker's compensation. */
public enum SettlementErrorType {
    /** The oracle had no price for the symbol, or the lookup timed out. */
    PRICE_UNAVAILABLE,

    /** A buy's price rose and the account could not cover the difference. */
    INSUFFICIENT_FUNDS_ON_SETTLEMENT,

    /** The ledger itself failed (no account, backend error). */
    LEDGER_ERROR,

    /** The task payload was inconsistent with the stored transaction. */
    INVALID_TASK,

    /** Anything else thrown while settling. */
    INTERNAL_ERROR
}
