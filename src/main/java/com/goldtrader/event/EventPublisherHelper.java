package com.goldtrader.event;

import com.goldtrader.domain.model.Transaction;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}. Delivery is synchronous
 * unless a listener opts into {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishTransactionPlaced(Object source, Transaction transaction) {
        applicationEventPublisher.publishEvent(
                new TransactionEvent(source, transaction, TransactionEventType.PLACED));
    }

    public void publishTransactionCompleted(Object source, Transaction transaction) {
        applicationEventPublisher.publishEvent(
                new TransactionEvent(source, transaction, TransactionEventType.COMPLETED));
    }

    public void publishTransactionFailed(Object source, Transaction transaction) {
        applicationEventPublisher.publishEvent(
                new TransactionEvent(source, transaction, TransactionEventType.FAILED));
    }

    public void publishTransactionCancelled(Object source, Transaction transaction) {
        applicationEventPublisher.publishEvent(
                new TransactionEvent(source, transaction, TransactionEventType.CANCELLED));
    }
}
