package com.goldtrader.oms;

import com.goldtrader.config.SettlementConfig;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.domain.model.PollingResult;
import com.goldtrader.domain.model.TaskStatus;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.event.EventPublisherHelper;
import com.goldtrader.exception.BusinessException;
import com.goldtrader.exception.ForbiddenException;
import com.goldtrader.exception.InsufficientFundsException;
import com.goldtrader.exception.InvalidStateException;
import com.goldtrader.exception.QueueUnavailableException;
import com.goldtrader.exception.ResourceNotFoundException;
import com.goldtrader.ledger.LedgerService;
import com.goldtrader.price.PriceQuoteService;
import com.goldtrader.queue.ExecutionTask;
import com.goldtrader.queue.OrderExecutionRequest;
import com.goldtrader.queue.WorkQueue;
import com.goldtrader.service.TransactionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The only writer of new transactions.
 *
 * <p>Placement quotes the order, holds the full amount of a buy, enqueues the execution task and
 * returns at once; the {@link ExecutionWorker} settles later at the then-current price. Any failure
 * after the transaction row exists leaves it failed, never stuck in processing, and a buy's hold is
 * refunded. A refund that itself fails is recorded in the transaction's error message.
 *
 * <p>Polling merges the durable transaction with its ephemeral task status: a live status
 * overrides a non-terminal durable one, a terminal durable status always wins.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    public static final String POLL_URL_PREFIX = "/api/trading/poll/";
    public static final String CANCELLED_BY_USER = "Cancelled by user";

    static final int HIGH_PRIORITY = 1;
    static final int NORMAL_PRIORITY = 0;
    static final int MAX_HISTORY_LIMIT = 100;

    private final PriceQuoteService priceQuoteService;
    private final LedgerService ledgerService;
    private final TransactionStore transactionStore;
    private final WorkQueue workQueue;
    private final SettlementCalculator settlementCalculator;
    private final EventPublisherHelper eventPublisherHelper;
    private final SettlementConfig settlementConfig;

    public OrderService(
            PriceQuoteService priceQuoteService,
            LedgerService ledgerService,
            TransactionStore transactionStore,
            WorkQueue workQueue,
            SettlementCalculator settlementCalculator,
            EventPublisherHelper eventPublisherHelper,
            SettlementConfig settlementConfig) {
        this.priceQuoteService = priceQuoteService;
        this.ledgerService = ledgerService;
        this.transactionStore = transactionStore;
        this.workQueue = workQueue;
        this.settlementCalculator = settlementCalculator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.settlementConfig = settlementConfig;
    }

    public Transaction placeOrder(String userId, Symbol symbol, OrderSide side, BigDecimal amount) {
        return placeOrder(userId, symbol, side, amount, false);
    }

    /**
     * Places a deferred-execution order.
     *
     * @throws BusinessException if the amount is not a positive currency amount
     * @throws com.goldtrader.exception.PriceUnavailableException if there is no quote; nothing is written
     * @throws InsufficientFundsException if a buy is not covered, before creation or at debit time
     * @throws QueueUnavailableException if the task could not be enqueued; the transaction is failed
     */
    public Transaction placeOrder(
            String userId, Symbol symbol, OrderSide side, BigDecimal amount, boolean highPriority) {
        validateAmount(amount);

        BigDecimal quotedPrice = priceQuoteService.quotePrice(symbol, side);

        if (side == OrderSide.BUY) {
            BigDecimal balance = ledgerService.getBalanceOrZero(userId);
            if (balance.compareTo(amount) < 0) {
                log.warn("Buy rejected: userId={}, amount={}, balance={}", userId, amount, balance);
                throw new InsufficientFundsException(amount, balance);
            }
        }

        String processingId = UUID.randomUUID().toString();
        Transaction transaction = transactionStore.create(Transaction.builder()
                .userId(userId)
                .symbol(symbol)
                .side(side)
                .requestedAmount(amount)
                .quotedPricePerUnit(quotedPrice)
                .executedQuantity(BigDecimal.ZERO)
                .status(TransactionStatus.PENDING)
                .processingId(processingId)
                .build());
        String transactionId = transaction.getId();

        // Separate write: pollers may observe pending before processing
        transaction = transactionStore.updateStatus(transactionId, TransactionStatus.PROCESSING, null);

        BigDecimal quotedQuantity = settlementCalculator.quotedQuantity(amount, quotedPrice);

        if (side == OrderSide.BUY) {
            placeHold(transactionId, userId, amount);
        }

        ExecutionTask task = ExecutionTask.builder()
                .processingId(processingId)
                .priority(highPriority ? HIGH_PRIORITY : NORMAL_PRIORITY)
                .payload(OrderExecutionRequest.builder()
                        .transactionId(transactionId)
                        .userId(userId)
                        .symbol(symbol)
                        .side(side)
                        .requestedAmount(amount)
                        .quotedPricePerUnit(quotedPrice)
                        .quotedQuantity(quotedQuantity)
                        .createdAt(transaction.getCreatedAt())
                        .build())
                .build();

        try {
            workQueue.enqueue(task);
        } catch (RuntimeException e) {
            failAfterEnqueueError(transaction, e);
            throw e instanceof QueueUnavailableException queueError
                    ? queueError
                    : new QueueUnavailableException("Failed to enqueue transaction " + transactionId, e);
        }

        Transaction placed = transactionStore.attachPollUrl(transactionId, POLL_URL_PREFIX + transactionId);
        eventPublisherHelper.publishTransactionPlaced(this, placed);

        log.info(
                "Order placed: id={}, userId={}, side={}, symbol={}, amount={}, quotedPrice={}, highPriority={}",
                transactionId,
                userId,
                side,
                symbol,
                amount,
                quotedPrice,
                highPriority);
        return placed;
    }

    /**
     * Marks a pending or processing transaction failed. A buy's hold is not reversed, and a
     * settlement already in flight may still overwrite the cancellation.
     */
    public Transaction cancel(String transactionId, String userId) {
        Transaction transaction = getTransaction(transactionId, userId);
        if (!transaction.getStatus().isCancellable()) {
            throw new InvalidStateException(
                    "Transaction " + transactionId + " cannot be cancelled in status " + transaction.getStatus());
        }
        Transaction cancelled =
                transactionStore.updateStatus(transactionId, TransactionStatus.FAILED, CANCELLED_BY_USER);
        eventPublisherHelper.publishTransactionCancelled(this, cancelled);
        log.info("Transaction cancelled: id={}, userId={}", transactionId, userId);
        return cancelled;
    }

    /** Read-only: a poll never writes the durable transaction. */
    public PollingResult pollStatus(String transactionId, String userId) {
        Transaction transaction = getTransaction(transactionId, userId);

        if (transaction.getStatus().isTerminal()) {
            return fromDurable(transaction);
        }

        Optional<TaskStatus> live = liveStatus(transaction.getProcessingId());
        if (live.isEmpty()) {
            return fromDurable(transaction);
        }

        TaskStatus taskStatus = live.get();
        TransactionStatus status = taskStatus.getState().toTransactionStatus();
        if (status.isTerminal()) {
            // the worker writes the transaction before the task status, so it is usually settled by now
            Transaction latest = transactionStore.findById(transactionId).orElse(transaction);
            if (latest.getStatus().isTerminal()) {
                return fromDurable(latest);
            }
        }
        PollingResult.PollingResultBuilder result = PollingResult.builder()
                .transactionId(transactionId)
                .status(status)
                .data(taskStatus.getResult());
        return switch (status) {
            case COMPLETED -> result.message("completed")
                    .completedAt(toLocal(taskStatus))
                    .build();
            case FAILED -> result.message("failed: " + liveError(taskStatus))
                    .completedAt(toLocal(taskStatus))
                    .build();
            default -> result.message(status.wireName()).build();
        };
    }

    /**
     * @throws ResourceNotFoundException if the transaction does not exist
     * @throws ForbiddenException if it belongs to another user
     */
    public Transaction getTransaction(String transactionId, String userId) {
        Transaction transaction = transactionStore
                .findById(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
        if (!transaction.getUserId().equals(userId)) {
            throw new ForbiddenException("Transaction " + transactionId + " does not belong to the requesting user");
        }
        return transaction;
    }

    public List<Transaction> history(String userId, int limit, int offset) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new BusinessException("limit", "limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        if (offset < 0) {
            throw new BusinessException("offset", "offset must not be negative");
        }
        return transactionStore.findByUser(userId, limit, offset);
    }

    private void validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException("amount", "Amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > settlementConfig.getCurrencyScale()) {
            throw new BusinessException(
                    "amount",
                    "Amount must have at most " + settlementConfig.getCurrencyScale() + " decimal places");
        }
    }

    private void placeHold(String transactionId, String userId, BigDecimal amount) {
        boolean debited;
        try {
            debited = ledgerService.adjust(userId, amount.negate());
        } catch (RuntimeException e) {
            log.error("Hold failed: transactionId={}, userId={}, amount={}", transactionId, userId, amount, e);
            failPlacement(transactionId, "Failed to hold funds: " + e.getMessage());
            throw e;
        }
        if (!debited) {
            failPlacement(transactionId, "Insufficient balance at debit time");
            throw new InsufficientFundsException(
                    "Insufficient balance to hold " + amount + " for transaction " + transactionId);
        }
    }

    private void failPlacement(String transactionId, String errorMessage) {
        Transaction failed = transactionStore.updateStatus(transactionId, TransactionStatus.FAILED, errorMessage);
        eventPublisherHelper.publishTransactionFailed(this, failed);
    }

    private void failAfterEnqueueError(Transaction transaction, RuntimeException cause) {
        String errorMessage = "Failed to enqueue: " + cause.getMessage();
        if (transaction.getSide() == OrderSide.BUY) {
            try {
                if (!ledgerService.adjust(transaction.getUserId(), transaction.getRequestedAmount())) {
                    errorMessage += "; refund of " + transaction.getRequestedAmount() + " was rejected";
                }
            } catch (RuntimeException refundError) {
                log.error("Refund after enqueue failure failed: transactionId={}", transaction.getId(), refundError);
                errorMessage += "; refund failed: " + refundError.getMessage();
            }
        }
        log.error("Enqueue failed: transactionId={}, reason={}", transaction.getId(), errorMessage, cause);
        failPlacement(transaction.getId(), errorMessage);
    }

    private Optional<TaskStatus> liveStatus(String processingId) {
        if (processingId == null) {
            return Optional.empty();
        }
        try {
            return workQueue.getStatus(processingId);
        } catch (QueueUnavailableException e) {
            log.warn("Task status unavailable for {}, answering from the store: {}", processingId, e.getMessage());
            return Optional.empty();
        }
    }

    private PollingResult fromDurable(Transaction transaction) {
        PollingResult.PollingResultBuilder result =
                PollingResult.builder().transactionId(transaction.getId()).status(transaction.getStatus());
        return switch (transaction.getStatus()) {
            case COMPLETED -> result.message("completed")
                    .data(SettlementReport.of(transaction))
                    .completedAt(transaction.getUpdatedAt())
                    .build();
            case FAILED -> result.message("failed: " + transaction.getErrorMessage())
                    .data(Map.of("error", String.valueOf(transaction.getErrorMessage())))
                    .completedAt(transaction.getUpdatedAt())
                    .build();
            default -> result.message(transaction.getStatus().wireName()).build();
        };
    }

    private static String liveError(TaskStatus taskStatus) {
        Map<String, Object> result = taskStatus.getResult();
        Object error = result != null ? result.get("error") : null;
        return error != null ? error.toString() : "unknown error";
    }

    private static LocalDateTime toLocal(TaskStatus taskStatus) {
        return taskStatus.getUpdatedAt() != null
                ? LocalDateTime.ofInstant(taskStatus.getUpdatedAt(), ZoneId.systemDefault())
                : null;
    }
}
