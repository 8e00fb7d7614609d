package com.goldtrader.domain.enums;

/**
 * Durable lifecycle status of a transaction.
 * Moves forward only: PENDING -> PROCESSING -> COMPLETED | FAILED. COMPLETED and FAILED are terminal.
 */
public enum TransactionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == PROCESSING;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
