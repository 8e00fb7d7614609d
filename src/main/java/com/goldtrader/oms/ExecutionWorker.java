package com.goldtrader.oms;

import com.goldtrader.config.QueueConfig;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.QueueLane;
import com.goldtrader.domain.enums.SettlementErrorType;
import com.goldtrader.domain.enums.TaskState;
import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.event.EventPublisherHelper;
import com.goldtrader.ledger.LedgerService;
import com.goldtrader.queue.ExecutionTask;
import com.goldtrader.queue.OrderExecutionRequest;
import com.goldtrader.queue.WorkQueue;
import com.goldtrader.service.TransactionStore;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Dedicated consumer thread that drains the {@link WorkQueue} and settles each task through the
 * {@link TaskHandler} registered for its lane.
 *
 * <p>Each pass tries the priority lane first and goes back to it after every task, so the normal
 * lane is only polled while the priority lane is empty. A pass that finds nothing sleeps for the
 * configured idle pause; a backend error backs off before retrying.
 *
 * <p>No failure escapes {@link #processTask}: a failed settlement becomes a failed transaction plus
 * a best-effort refund of a buy's hold, and a failed store or status write is logged and the loop
 * moves on. A task lost that way is an accepted limitation, the same as a crash after dequeue.
 */
@Component
public class ExecutionWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExecutionWorker.class);

    private final WorkQueue workQueue;
    private final LedgerService ledgerService;
    private final TransactionStore transactionStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final QueueConfig queueConfig;

    private final Map<QueueLane, TaskHandler> handlers = new EnumMap<>(QueueLane.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private Thread consumerThread;

    public ExecutionWorker(
            WorkQueue workQueue,
            TransactionSettlementHandler settlementHandler,
            LedgerService ledgerService,
            TransactionStore transactionStore,
            EventPublisherHelper eventPublisherHelper,
            QueueConfig queueConfig) {
        this.workQueue = workQueue;
        this.ledgerService = ledgerService;
        this.transactionStore = transactionStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.queueConfig = queueConfig;
        registerHandler(QueueLane.PRIORITY, settlementHandler);
        registerHandler(QueueLane.NORMAL, settlementHandler);
    }

    public void registerHandler(QueueLane lane, TaskHandler handler) {
        handlers.put(lane, handler);
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            consumerThread = new Thread(this::processLoop, "execution-worker");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("ExecutionWorker started");
        }
    }

    /** Stops after the task in flight, if any, has been settled. */
    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consumerThread != null) {
                consumerThread.interrupt();
            }
            log.info("ExecutionWorker stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    /** Tasks settled or failed since startup. */
    public long getProcessedCount() {
        return processedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }

    private void processLoop() {
        while (running.get()) {
            try {
                if (!pollOnce()) {
                    Thread.sleep(queueConfig.getIdleSleep().toMillis());
                }
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("ExecutionWorker interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("ExecutionWorker interrupted unexpectedly, resuming");
            } catch (RuntimeException e) {
                log.error("ExecutionWorker loop error, backing off {}", queueConfig.getErrorBackoff(), e);
                backOff();
            }
        }
        log.info("ExecutionWorker stopped: processed={}, failed={}", processedCount.get(), failedCount.get());
    }

    /**
     * One pass: the priority lane, then the normal lane, settling at most one task.
     *
     * @return true if a task was dequeued
     */
    public boolean pollOnce() {
        Duration timeout = queueConfig.getDequeueTimeout();
        for (QueueLane lane : new QueueLane[] {QueueLane.PRIORITY, QueueLane.NORMAL}) {
            Optional<ExecutionTask> task = workQueue.dequeue(lane, timeout);
            if (task.isPresent()) {
                processTask(task.get(), lane);
                return true;
            }
        }
        return false;
    }

    /** Settles one task and writes its outcome. Never throws. */
    public void processTask(ExecutionTask task, QueueLane lane) {
        OrderExecutionRequest request = task.getPayload();
        String processingId = task.getProcessingId();
        long queueLatencyMs = task.getQueuedAt() != null
                ? Duration.between(task.getQueuedAt(), Instant.now()).toMillis()
                : -1;
        log.debug(
                "Processing task: processingId={}, transactionId={}, lane={}, queueLatency={}ms",
                processingId,
                request.getTransactionId(),
                lane,
                queueLatencyMs);

        writeStatus(processingId, TaskState.PROCESSING, null);

        SettlementResult result;
        try {
            result = handlers.get(lane).handle(task);
        } catch (RuntimeException e) {
            log.error("Settlement handler threw for transaction {}", request.getTransactionId(), e);
            result = SettlementResult.failure(
                    SettlementErrorType.INTERNAL_ERROR, "Unexpected settlement error: " + e.getMessage());
        }

        processedCount.incrementAndGet();
        if (result.isSuccess()) {
            recordCompletion(request, result.getOutcome());
        } else {
            recordFailure(task, result.getError());
        }
    }

    private void recordCompletion(OrderExecutionRequest request, SettlementOutcome outcome) {
        try {
            Transaction completed = transactionStore.complete(
                    request.getTransactionId(),
                    outcome.getExecutedQuantity(),
                    outcome.getExecutedPricePerUnit(),
                    outcome.getExecutedAmount());
            eventPublisherHelper.publishTransactionCompleted(this, completed);
        } catch (RuntimeException e) {
            log.error("Failed to record completion of transaction {}", request.getTransactionId(), e);
        }
        writeStatus(outcome.getProcessingId(), TaskState.COMPLETED, SettlementReport.of(request, outcome));

        log.info(
                "Transaction settled: id={}, side={}, executedAmount={}, price={}, adjustment={}",
                request.getTransactionId(),
                request.getSide(),
                outcome.getExecutedAmount(),
                outcome.getExecutedPricePerUnit(),
                outcome.getAdjustmentType());
    }

    private void recordFailure(ExecutionTask task, SettlementError error) {
        OrderExecutionRequest request = task.getPayload();
        failedCount.incrementAndGet();

        String errorMessage = error.getMessage() != null ? error.getMessage() : error.getType().name();
        if (needsHoldRefund(request, error)) {
            errorMessage = refundHold(request, errorMessage);
        }

        log.error(
                "Settlement failed: transactionId={}, type={}, reason={}",
                request.getTransactionId(),
                error.getType(),
                errorMessage);

        try {
            Transaction failed =
                    transactionStore.updateStatus(request.getTransactionId(), TransactionStatus.FAILED, errorMessage);
            eventPublisherHelper.publishTransactionFailed(this, failed);
        } catch (RuntimeException e) {
            log.error("Failed to record failure of transaction {}", request.getTransactionId(), e);
        }
        writeStatus(task.getProcessingId(), TaskState.FAILED, Map.of("error", errorMessage));
    }

    /** A buy's hold goes back in full unless the task never matched a stored transaction. */
    private boolean needsHoldRefund(OrderExecutionRequest request, SettlementError error) {
        if (request.getSide() != OrderSide.BUY) {
            return false;
        }
        return switch (error.getType()) {
            case PRICE_UNAVAILABLE, INSUFFICIENT_FUNDS_ON_SETTLEMENT, LEDGER_ERROR, INTERNAL_ERROR -> true;
            case INVALID_TASK -> false;
        };
    }

    /** Returns the error message, extended with the secondary error if the refund itself fails. */
    private String refundHold(OrderExecutionRequest request, String errorMessage) {
        try {
            if (ledgerService.adjust(request.getUserId(), request.getRequestedAmount())) {
                log.info(
                        "Hold refunded: transactionId={}, userId={}, amount={}",
                        request.getTransactionId(),
                        request.getUserId(),
                        request.getRequestedAmount());
                return errorMessage;
            }
            return errorMessage + "; refund of " + request.getRequestedAmount() + " was rejected";
        } catch (RuntimeException e) {
            log.error("Hold refund failed for transaction {}", request.getTransactionId(), e);
            return errorMessage + "; refund failed: " + e.getMessage();
        }
    }

    private void writeStatus(String processingId, TaskState state, Map<String, Object> result) {
        try {
            workQueue.setStatus(processingId, state, result);
        } catch (RuntimeException e) {
            log.error("Failed to write {} status for task {}", state, processingId, e);
        }
    }

    private void backOff() {
        try {
            Thread.sleep(queueConfig.getErrorBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
