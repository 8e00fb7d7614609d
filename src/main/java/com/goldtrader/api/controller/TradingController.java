package com.goldtrader.api.controller;

import com.goldtrader.api.dto.request.DepositRequest;
import com.goldtrader.api.dto.request.PlaceOrderRequest;
import com.goldtrader.api.dto.response.BalanceResponse;
import com.goldtrader.api.dto.response.QueueHealthResponse;
import com.goldtrader.config.SettlementConfig;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.model.PollingResult;
import com.goldtrader.domain.model.Portfolio;
import com.goldtrader.domain.model.PriceSnapshot;
import com.goldtrader.domain.model.QueueHealth;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.exception.BusinessException;
import com.goldtrader.ledger.LedgerService;
import com.goldtrader.oms.ExecutionWorker;
import com.goldtrader.oms.OrderService;
import com.goldtrader.price.PriceQuoteService;
import com.goldtrader.queue.WorkQueue;
import com.goldtrader.service.PortfolioService;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for deferred-execution trading.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/trading/buy, /sell -- place an order; answers 202 with a poll URL</li>
 *   <li>GET /api/trading/poll/{id} -- execution status</li>
 *   <li>POST /api/trading/cancel/{id} -- cancel a pending or processing order</li>
 *   <li>GET /api/trading/history, /transaction/{id} -- past orders</li>
 *   <li>GET /api/trading/balance, POST /balance/add -- cash balance</li>
 *   <li>GET /api/trading/price/{symbol}, /portfolio, /queue/health</li>
 * </ul>
 *
 * <p>Authentication happens upstream; the authenticated user id arrives in {@code X-User-Id}.
 */
@RestController
@RequestMapping("/api/trading")
public class TradingController {

    private static final Logger log = LoggerFactory.getLogger(TradingController.class);

    public static final String USER_HEADER = "X-User-Id";

    private final OrderService orderService;
    private final LedgerService ledgerService;
    private final PriceQuoteService priceQuoteService;
    private final PortfolioService portfolioService;
    private final WorkQueue workQueue;
    private final ExecutionWorker executionWorker;
    private final SettlementConfig settlementConfig;

    public TradingController(
            OrderService orderService,
            LedgerService ledgerService,
            PriceQuoteService priceQuoteService,
            PortfolioService portfolioService,
            WorkQueue workQueue,
            ExecutionWorker executionWorker,
            SettlementConfig settlementConfig) {
        this.orderService = orderService;
        this.ledgerService = ledgerService;
        this.priceQuoteService = priceQuoteService;
        this.portfolioService = portfolioService;
        this.workQueue = workQueue;
        this.executionWorker = executionWorker;
        this.settlementConfig = settlementConfig;
    }

    @PostMapping("/buy")
    public ResponseEntity<Transaction> buy(
            @RequestHeader(USER_HEADER) String userId, @Valid @RequestBody PlaceOrderRequest request) {
        return place(userId, OrderSide.BUY, request);
    }

    @PostMapping("/sell")
    public ResponseEntity<Transaction> sell(
            @RequestHeader(USER_HEADER) String userId, @Valid @RequestBody PlaceOrderRequest request) {
        return place(userId, OrderSide.SELL, request);
    }

    @GetMapping("/poll/{transactionId}")
    public ResponseEntity<PollingResult> poll(
            @RequestHeader(USER_HEADER) String userId, @PathVariable String transactionId) {
        return ResponseEntity.ok(orderService.pollStatus(transactionId, userId));
    }

    @PostMapping("/cancel/{transactionId}")
    public ResponseEntity<Transaction> cancel(
            @RequestHeader(USER_HEADER) String userId, @PathVariable String transactionId) {
        return ResponseEntity.ok(orderService.cancel(transactionId, userId));
    }

    @GetMapping("/history")
    public ResponseEntity<List<Transaction>> history(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(orderService.history(userId, limit, offset));
    }

    @GetMapping("/transaction/{transactionId}")
    public ResponseEntity<Transaction> transaction(
            @RequestHeader(USER_HEADER) String userId, @PathVariable String transactionId) {
        return ResponseEntity.ok(orderService.getTransaction(transactionId, userId));
    }

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> balance(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(balanceResponse(userId, ledgerService.getBalance(userId)));
    }

    @PostMapping("/balance/add")
    public ResponseEntity<BalanceResponse> addBalance(
            @RequestHeader(USER_HEADER) String userId, @Valid @RequestBody DepositRequest request) {
        BigDecimal balance = ledgerService.deposit(userId, request.getAmount());
        return ResponseEntity.ok(balanceResponse(userId, balance));
    }

    @GetMapping("/price/{symbol}")
    public ResponseEntity<PriceSnapshot> price(@PathVariable String symbol) {
        return ResponseEntity.ok(priceQuoteService.currentSnapshot(parseSymbol(symbol)));
    }

    @GetMapping("/portfolio")
    public ResponseEntity<Portfolio> portfolio(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(portfolioService.portfolio(userId));
    }

    @GetMapping("/queue/health")
    public ResponseEntity<QueueHealthResponse> queueHealth() {
        QueueHealth health = workQueue.health();
        return ResponseEntity.ok(QueueHealthResponse.builder()
                .normalQueueDepth(health.getNormalQueueDepth())
                .priorityQueueDepth(health.getPriorityQueueDepth())
                .backendConnected(health.isBackendConnected())
                .workerRunning(executionWorker.isRunning())
                .processedCount(executionWorker.getProcessedCount())
                .failedCount(executionWorker.getFailedCount())
                .build());
    }

    private ResponseEntity<Transaction> place(String userId, OrderSide side, PlaceOrderRequest request) {
        Symbol symbol = parseSymbol(request.getSymbol());
        log.info("{} request: userId={}, symbol={}, amount={}", side, userId, symbol, request.getAmount());
        Transaction transaction =
                orderService.placeOrder(userId, symbol, side, request.getAmount(), request.isHighPriority());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(transaction);
    }

    private BalanceResponse balanceResponse(String userId, BigDecimal balance) {
        return BalanceResponse.builder()
                .userId(userId)
                .balance(balance)
                .currency(settlementConfig.getCurrency())
                .build();
    }

    private static Symbol parseSymbol(String value) {
        try {
            return Symbol.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new BusinessException("symbol", e.getMessage());
        }
    }
}
