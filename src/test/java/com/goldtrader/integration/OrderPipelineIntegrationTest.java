package com.goldtrader.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.goldtrader.config.QueueConfig;
import com.goldtrader.config.SettlementConfig;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.SettlementPolicy;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.enums.TaskState;
import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.domain.model.PollingResult;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.entity.TransactionEntity;
import com.goldtrader.entity.UserAccountEntity;
import com.goldtrader.event.EventPublisherHelper;
import com.goldtrader.event.TransactionEvent;
import com.goldtrader.event.TransactionEventType;
import com.goldtrader.exception.QueueUnavailableException;
import com.goldtrader.ledger.LedgerService;
import com.goldtrader.mapper.TransactionMapper;
import com.goldtrader.oms.ExecutionWorker;
import com.goldtrader.oms.OrderService;
import com.goldtrader.oms.SettlementCalculator;
import com.goldtrader.oms.TransactionSettlementHandler;
import com.goldtrader.price.PriceQuoteService;
import com.goldtrader.queue.InMemoryWorkQueue;
import com.goldtrader.service.TransactionStore;
import com.goldtrader.support.MapBackedRepositories;
import com.goldtrader.support.StubPriceOracle;
import com.goldtrader.support.TestFixtures;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

/**
 * End-to-end order pipeline without Spring: real OrderService, ExecutionWorker, LedgerService,
 * TransactionStore and in-memory queue over map-backed repositories. The worker is driven one
 * task at a time through {@code pollOnce()} so every step is deterministic.
 */
class OrderPipelineIntegrationTest {

    private static final String USER = "user-1";

    /** One fully wired pipeline under a given settlement policy. */
    private static final class Pipeline {

        final Map<String, TransactionEntity> transactionRows = new ConcurrentHashMap<>();
        final Map<String, UserAccountEntity> accountRows = new ConcurrentHashMap<>();
        final List<TransactionEvent> events = new CopyOnWriteArrayList<>();
        final StubPriceOracle priceOracle = new StubPriceOracle().spot("2000").gold96("42100", "41900");
        final InMemoryWorkQueue workQueue;
        final LedgerService ledgerService;
        final TransactionStore transactionStore;
        final OrderService orderService;
        final ExecutionWorker worker;

        Pipeline(SettlementPolicy policy) {
            this(policy, new InMemoryWorkQueue(TestFixtures.codec(), TestFixtures.queueConfig()));
        }

        Pipeline(SettlementPolicy policy, InMemoryWorkQueue workQueue) {
            SettlementConfig settlementConfig = TestFixtures.settlementConfig(policy);
            QueueConfig queueConfig = TestFixtures.queueConfig();

            PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
            when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                    .thenAnswer(invocation -> new SimpleTransactionStatus());

            this.workQueue = workQueue;
            ledgerService = new LedgerService(MapBackedRepositories.accounts(accountRows), transactionManager);
            transactionStore = new TransactionStore(
                    MapBackedRepositories.transactions(transactionRows), Mappers.getMapper(TransactionMapper.class));
            PriceQuoteService priceQuoteService = new PriceQuoteService(priceOracle, Runnable::run, settlementConfig);
            SettlementCalculator calculator = new SettlementCalculator(settlementConfig);
            EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(event -> {
                if (event instanceof TransactionEvent transactionEvent) {
                    events.add(transactionEvent);
                }
            });

            orderService = new OrderService(
                    priceQuoteService,
                    ledgerService,
                    transactionStore,
                    workQueue,
                    calculator,
                    eventPublisherHelper,
                    settlementConfig);
            worker = new ExecutionWorker(
                    workQueue,
                    new TransactionSettlementHandler(priceQuoteService, calculator, ledgerService, transactionStore),
                    ledgerService,
                    transactionStore,
                    eventPublisherHelper,
                    queueConfig);
        }

        Transaction buy(String amount) {
            return orderService.placeOrder(USER, Symbol.SPOT, OrderSide.BUY, new BigDecimal(amount));
        }

        Transaction sell(String amount) {
            return orderService.placeOrder(USER, Symbol.SPOT, OrderSide.SELL, new BigDecimal(amount));
        }

        void drain() {
            while (worker.pollOnce()) {
                // settle everything queued
            }
        }

        BigDecimal balance() {
            return ledgerService.getBalanceOrZero(USER);
        }

        Transaction reload(Transaction transaction) {
            return transactionStore.findById(transaction.getId()).orElseThrow();
        }

        List<String> completedIds() {
            return events.stream()
                    .filter(event -> event.getEventType() == TransactionEventType.COMPLETED)
                    .map(event -> event.getTransaction().getId())
                    .collect(Collectors.toList());
        }
    }

    @Nested
    @DisplayName("Amount-preserving settlement")
    class AmountPreserving {

        @Test
        @DisplayName("Balance 1000, buy 500 quoted at 2000, settled at 1800: amount 500, quantity 0.2777777778, no refund")
        void priceDropScenario() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            Transaction placed = pipeline.buy("500");
            assertThat(pipeline.balance()).isEqualByComparingTo("500");

            pipeline.priceOracle.spot("1800");
            pipeline.drain();

            Transaction settled = pipeline.reload(placed);
            assertThat(settled.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
            assertThat(settled.getExecutedAmount()).isEqualByComparingTo("500.00");
            assertThat(settled.getExecutedQuantity()).isEqualByComparingTo("0.2777777778");
            assertThat(settled.getExecutedPricePerUnit()).isEqualByComparingTo("1800");
            assertThat(pipeline.balance()).isEqualByComparingTo("500.00");
        }

        @Test
        @DisplayName("Unchanged price: executed amount equals requested and the net balance change is the amount")
        void unchangedPrice() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            Transaction placed = pipeline.buy("500");
            pipeline.drain();

            assertThat(pipeline.reload(placed).getExecutedAmount()).isEqualByComparingTo("500");
            assertThat(pipeline.balance()).isEqualByComparingTo("500");
        }

        @Test
        @DisplayName("Sell credits the requested amount with no hold at placement")
        void sellCredit() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("100"));

            pipeline.sell("500");
            assertThat(pipeline.balance()).isEqualByComparingTo("100");

            pipeline.priceOracle.spot("2100");
            pipeline.drain();

            assertThat(pipeline.balance()).isEqualByComparingTo("600.00");
        }
    }

    @Nested
    @DisplayName("Quantity-preserving settlement")
    class QuantityPreserving {

        @Test
        @DisplayName("Price drop refunds the difference: balance ends at initial minus executed amount")
        void priceDropRefunds() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.QUANTITY_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            Transaction placed = pipeline.buy("500");
            pipeline.priceOracle.spot("1800");
            pipeline.drain();

            Transaction settled = pipeline.reload(placed);
            assertThat(settled.getExecutedAmount()).isEqualByComparingTo("450.00");
            assertThat(pipeline.balance()).isEqualByComparingTo(new BigDecimal("1000").subtract(settled.getExecutedAmount()));
        }

        @Test
        @DisplayName("Uncovered price rise fails the order and restores the initial balance")
        void uncoveredPriceRise() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.QUANTITY_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("500"));

            Transaction placed = pipeline.buy("500");
            assertThat(pipeline.balance()).isEqualByComparingTo("0");

            pipeline.priceOracle.spot("2200");
            pipeline.drain();

            Transaction failed = pipeline.reload(placed);
            assertThat(failed.getStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(failed.getErrorMessage()).startsWith("Insufficient funds to cover price difference");
            assertThat(pipeline.balance()).isEqualByComparingTo("500");

            PollingResult poll = pipeline.orderService.pollStatus(placed.getId(), USER);
            assertThat(poll.getMessage()).startsWith("failed: Insufficient funds");
        }

        @Test
        @DisplayName("Covered price rise charges the difference on top of the hold")
        void coveredPriceRise() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.QUANTITY_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            pipeline.buy("500");
            pipeline.priceOracle.spot("2200");
            pipeline.drain();

            assertThat(pipeline.balance()).isEqualByComparingTo("450.00");
        }

        @Test
        @DisplayName("Sell credits the quoted quantity at the settlement price")
        void sellCredit() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.QUANTITY_PRESERVING);

            pipeline.sell("500");
            pipeline.priceOracle.spot("2100");
            pipeline.drain();

            assertThat(pipeline.balance()).isEqualByComparingTo("525.00");
        }
    }

    @Nested
    @DisplayName("Failures and compensation")
    class Failures {

        @Test
        @DisplayName("Price disappearing before settlement fails the buy and refunds the hold")
        void priceUnavailableAtSettlement() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            Transaction placed = pipeline.buy("500");
            pipeline.priceOracle.remove(Symbol.SPOT);
            pipeline.drain();

            assertThat(pipeline.reload(placed).getStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(pipeline.balance()).isEqualByComparingTo("1000");
            assertThat(pipeline.worker.getFailedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A queue that cannot record the task status fails the buy and never settles it")
        void statusWriteFailureDuringEnqueue() {
            InMemoryWorkQueue statusWriteFails = new InMemoryWorkQueue(
                    TestFixtures.codec(), TestFixtures.queueConfig()) {
                @Override
                public void setStatus(String processingId, TaskState state, Map<String, Object> result) {
                    if (state == TaskState.QUEUED) {
                        throw new QueueUnavailableException("Failed to write task status", new IllegalStateException());
                    }
                    super.setStatus(processingId, state, result);
                }
            };
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING, statusWriteFails);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            assertThatThrownBy(() -> pipeline.buy("500")).isInstanceOf(QueueUnavailableException.class);
            assertThat(pipeline.workQueue.depth().getNormalCount()).isZero();

            pipeline.drain();

            Transaction stored = pipeline.transactionStore.findByUser(USER, 1, 0).get(0);
            assertThat(stored.getStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(stored.getExecutedQuantity()).isEqualByComparingTo("0");
            assertThat(pipeline.balance()).isEqualByComparingTo("1000");
            assertThat(pipeline.worker.getProcessedCount()).isZero();
        }

        @Test
        @DisplayName("Settlement finishing after a cancel overwrites it")
        void settlementAfterCancelWins() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            Transaction placed = pipeline.buy("500");
            pipeline.orderService.cancel(placed.getId(), USER);
            pipeline.drain();

            assertThat(pipeline.reload(placed).getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Polling and queue behaviour")
    class PollingAndQueue {

        @Test
        @DisplayName("Polling a completed order repeatedly returns an identical payload")
        void pollIdempotent() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));
            Transaction placed = pipeline.buy("500");
            pipeline.drain();

            PollingResult first = pipeline.orderService.pollStatus(placed.getId(), USER);
            PollingResult second = pipeline.orderService.pollStatus(placed.getId(), USER);

            assertThat(first.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
            assertThat(first.getData()).containsEntry("executedAmount", "500.00");
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("The task status and the stored transaction report a completed order with the same payload")
        void liveAndDurablePayloadsMatch() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.QUANTITY_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));
            Transaction placed = pipeline.buy("500");
            pipeline.priceOracle.spot("1800");
            pipeline.drain();

            Map<String, Object> live =
                    pipeline.workQueue.getStatus(placed.getProcessingId()).orElseThrow().getResult();
            PollingResult polled = pipeline.orderService.pollStatus(placed.getId(), USER);

            assertThat(polled.getData()).isEqualTo(live);
            assertThat(polled.getData())
                    .containsEntry("executedQuantity", "0.2500000000")
                    .containsEntry("executedPricePerUnit", "1800.0000")
                    .containsEntry("executedAmount", "450.00");
            assertThat(polled.getCompletedAt()).isEqualTo(pipeline.reload(placed).getUpdatedAt());
        }

        @Test
        @DisplayName("A(normal), B(high), C(normal) settle in the order B, A, C")
        void priorityOrdering() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("1000"));

            Transaction a = pipeline.orderService.placeOrder(USER, Symbol.SPOT, OrderSide.BUY, new BigDecimal("100"));
            Transaction b = pipeline.orderService.placeOrder(
                    USER, Symbol.SPOT, OrderSide.BUY, new BigDecimal("100"), true);
            Transaction c = pipeline.orderService.placeOrder(USER, Symbol.SPOT, OrderSide.BUY, new BigDecimal("100"));
            pipeline.drain();

            assertThat(pipeline.completedIds()).containsExactly(b.getId(), a.getId(), c.getId());
        }

        @Test
        @DisplayName("Enqueuing N normal and M priority tasks and draining them returns depth to zero")
        void depthReturnsToZero() {
            Pipeline pipeline = new Pipeline(SettlementPolicy.AMOUNT_PRESERVING);
            pipeline.ledgerService.deposit(USER, new BigDecimal("10000"));

            for (int i = 0; i < 4; i++) {
                pipeline.orderService.placeOrder(USER, Symbol.SPOT, OrderSide.BUY, new BigDecimal("100"));
            }
            for (int i = 0; i < 3; i++) {
                pipeline.orderService.placeOrder(USER, Symbol.SPOT, OrderSide.BUY, new BigDecimal("100"), true);
            }
            assertThat(pipeline.workQueue.depth().getNormalCount()).isEqualTo(4);
            assertThat(pipeline.workQueue.depth().getPriorityCount()).isEqualTo(3);

            pipeline.drain();

            assertThat(pipeline.workQueue.depth().getNormalCount()).isZero();
            assertThat(pipeline.workQueue.depth().getPriorityCount()).isZero();
            assertThat(pipeline.worker.getProcessedCount()).isEqualTo(7);
        }
    }
}
