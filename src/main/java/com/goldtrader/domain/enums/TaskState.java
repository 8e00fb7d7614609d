package com.goldtrader.domain.enums;

/**
 * Ephemeral state of a queued execution task, kept in the expiring status cache.
 * Independent of the durable {@link TransactionStatus}; last writer wins.
 */
public enum TaskState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    /** Projects the task state onto the transaction lifecycle for polling responses. */
    public TransactionStatus toTransactionStatus() {
        return switch (this) {
            case QUEUED, PROCESSING -> TransactionStatus.PROCESSING;
            case COMPLETED -> TransactionStatus.COMPLETED;
            case FAILED -> TransactionStatus.FAILED;
        };
    }
}
