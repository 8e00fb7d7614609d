package com.goldtrader.oms;

import com.goldtrader.domain.enums.BalanceAdjustmentType;
import com.goldtrader.domain.enums.SettlementErrorType;
import com.goldtrader.exception.PriceUnavailableException;
import com.goldtrader.ledger.LedgerService;
import com.goldtrader.price.PriceQuoteService;
import com.goldtrader.queue.ExecutionTask;
import com.goldtrader.queue.OrderExecutionRequest;
import com.goldtrader.service.TransactionStore;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-prices a transaction at the current oracle price and reconciles the ledger against what was
 * held at placement. Store and task-status writes are left to the {@link ExecutionWorker}, which
 * also runs the compensation for a failed result.
 *
 * <p>The price used is always the freshest one observable at settlement, never the quoted one.
 */
@Component
public class TransactionSettlementHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(TransactionSettlementHandler.class);

    private final PriceQuoteService priceQuoteService;
    private final SettlementCalculator settlementCalculator;
    private final LedgerService ledgerService;
    private final TransactionStore transactionStore;

    public TransactionSettlementHandler(
            PriceQuoteService priceQuoteService,
            SettlementCalculator settlementCalculator,
            LedgerService ledgerService,
            TransactionStore transactionStore) {
        this.priceQuoteService = priceQuoteService;
        this.settlementCalculator = settlementCalculator;
        this.ledgerService = ledgerService;
        this.transactionStore = transactionStore;
    }

    @Override
    public SettlementResult handle(ExecutionTask task) {
        OrderExecutionRequest request = task.getPayload();

        if (transactionStore.findById(request.getTransactionId()).isEmpty()) {
            return SettlementResult.failure(
                    SettlementErrorType.INVALID_TASK, "Transaction not found: " + request.getTransactionId());
        }

        BigDecimal currentPrice;
        try {
            currentPrice = priceQuoteService.quotePrice(request.getSymbol(), request.getSide());
        } catch (PriceUnavailableException e) {
            return SettlementResult.failure(SettlementErrorType.PRICE_UNAVAILABLE, e.getMessage());
        }

        SettlementOutcome outcome = settlementCalculator.settle(request, task.getProcessingId(), currentPrice);
        log.debug(
                "Settlement priced: transactionId={}, quoted={}, current={}, executedAmount={}, adjustment={}",
                request.getTransactionId(),
                request.getQuotedPricePerUnit(),
                currentPrice,
                outcome.getExecutedAmount(),
                outcome.getAdjustmentType());

        if (outcome.getAdjustmentType() == BalanceAdjustmentType.NONE) {
            return SettlementResult.success(outcome);
        }

        boolean applied;
        try {
            applied = ledgerService.adjust(request.getUserId(), outcome.getBalanceDelta());
        } catch (RuntimeException e) {
            log.error("Ledger adjustment failed for transaction {}", request.getTransactionId(), e);
            return SettlementResult.failure(SettlementErrorType.LEDGER_ERROR, "Ledger error: " + e.getMessage());
        }

        if (!applied) {
            if (outcome.getAdjustmentType() == BalanceAdjustmentType.ADDITIONAL_CHARGE) {
                return SettlementResult.failure(
                        SettlementErrorType.INSUFFICIENT_FUNDS_ON_SETTLEMENT,
                        "Insufficient funds to cover price difference of " + outcome.getBalanceDelta().negate());
            }
            return SettlementResult.failure(
                    SettlementErrorType.LEDGER_ERROR,
                    "Ledger rejected " + outcome.getAdjustmentType() + " of " + outcome.getBalanceDelta());
        }
        return SettlementResult.success(outcome);
    }
}
