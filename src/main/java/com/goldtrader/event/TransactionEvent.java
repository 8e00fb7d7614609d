package com.goldtrader.event;

import com.goldtrader.domain.model.Transaction;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a transaction moves through its lifecycle. Carries a snapshot of the
 * transaction as written to the store.
 */
public class TransactionEvent extends ApplicationEvent {

    private final Transaction transaction;
    private final TransactionEventType eventType;

    public TransactionEvent(Object source, Transaction transaction, TransactionEventType eventType) {
        super(source);
        this.transaction = transaction;
        this.eventType = eventType;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public TransactionEventType getEventType() {
        return eventType;
    }
}
