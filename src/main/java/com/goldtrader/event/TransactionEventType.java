package com.goldtrader.event;

/** Classifies the lifecycle step that triggered a {@link TransactionEvent}. */
public enum TransactionEventType {

    /** Order accepted, funds held for a buy and the execution task enqueued. */
    PLACED,

    /** Settled at the execution-time price. */
    COMPLETED,

    /** Rejected at placement after creation, or failed during settlement. */
    FAILED,

    /** Marked failed by its owner before settlement finished. */
    CANCELLED
}
