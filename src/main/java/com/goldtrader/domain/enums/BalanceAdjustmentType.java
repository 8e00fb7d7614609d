package com.goldtrader.domain.enums;

/** How settlement moved the user's cash balance. */
public enum BalanceAdjustmentType {
    /** Buy settled below the held amount; the difference went back to the user. */
    REFUND,

    /** Buy settled above the held amount; the difference was charged on top of the hold. */
    ADDITIONAL_CHARGE,

    /** Sell proceeds credited. */
    CREDIT,

    NONE
}
