package com.goldtrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.goldtrader.domain.enums.BalanceAdjustmentType;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.SettlementErrorType;
import com.goldtrader.domain.enums.SettlementPolicy;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.exception.PriceUnavailableException;
import com.goldtrader.ledger.LedgerService;
import com.goldtrader.oms.SettlementCalculator;
import com.goldtrader.oms.SettlementResult;
import com.goldtrader.oms.TransactionSettlementHandler;
import com.goldtrader.price.PriceQuoteService;
import com.goldtrader.queue.ExecutionTask;
import com.goldtrader.service.TransactionStore;
import com.goldtrader.support.TestFixtures;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class TransactionSettlementHandlerTest {

    @Mock
    private PriceQuoteService priceQuoteService;

    @Mock
    private LedgerService ledgerService;

    @Mock
    private TransactionStore transactionStore;

    private TransactionSettlementHandler handler;

    @BeforeEach
    void setUp() {
        SettlementCalculator calculator =
                new SettlementCalculator(TestFixtures.settlementConfig(SettlementPolicy.QUANTITY_PRESERVING));
        handler = new TransactionSettlementHandler(priceQuoteService, calculator, ledgerService, transactionStore);
    }

    private ExecutionTask task(OrderSide side) {
        return TestFixtures.task("proc-1", 0, TestFixtures.request("tx-1", "user-1", side, "500", "2000"));
    }

    private void transactionExists() {
        when(transactionStore.findById("tx-1"))
                .thenReturn(Optional.of(Transaction.builder()
                        .id("tx-1")
                        .status(TransactionStatus.PROCESSING)
                        .build()));
    }

    @Nested
    @DisplayName("Successful settlement")
    class Success {

        @Test
        @DisplayName("Buy below the quote refunds the difference through the ledger")
        void refundApplied() {
            transactionExists();
            when(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.BUY)).thenReturn(new BigDecimal("1800"));
            when(ledgerService.adjust(eq("user-1"), any(BigDecimal.class))).thenReturn(true);

            SettlementResult result = handler.handle(task(OrderSide.BUY));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutcome().getAdjustmentType()).isEqualTo(BalanceAdjustmentType.REFUND);
            verify(ledgerService).adjust("user-1", new BigDecimal("50.00"));
        }

        @Test
        @DisplayName("Buy at the quoted price settles without touching the ledger")
        void noAdjustmentSkipsLedger() {
            transactionExists();
            when(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.BUY)).thenReturn(new BigDecimal("2000"));

            SettlementResult result = handler.handle(task(OrderSide.BUY));

            assertThat(result.isSuccess()).isTrue();
            verify(ledgerService, never()).adjust(anyString(), any());
        }

        @Test
        @DisplayName("Sell credits the proceeds")
        void sellCredited() {
            transactionExists();
            when(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.SELL)).thenReturn(new BigDecimal("2100"));
            when(ledgerService.adjust(eq("user-1"), any(BigDecimal.class))).thenReturn(true);

            SettlementResult result = handler.handle(task(OrderSide.SELL));

            assertThat(result.isSuccess()).isTrue();
            verify(ledgerService).adjust("user-1", new BigDecimal("525.00"));
        }
    }

    @Nested
    @DisplayName("Failed settlement")
    class Failure {

        @Test
        @DisplayName("Unknown transaction is an invalid task and prices nothing")
        void unknownTransaction() {
            when(transactionStore.findById("tx-1")).thenReturn(Optional.empty());

            SettlementResult result = handler.handle(task(OrderSide.BUY));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError().getType()).isEqualTo(SettlementErrorType.INVALID_TASK);
            verify(priceQuoteService, never()).quotePrice(any(), any());
        }

        @Test
        @DisplayName("Missing price fails with PRICE_UNAVAILABLE")
        void priceUnavailable() {
            transactionExists();
            when(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.BUY))
                    .thenThrow(new PriceUnavailableException(Symbol.SPOT));

            SettlementResult result = handler.handle(task(OrderSide.BUY));

            assertThat(result.getError().getType()).isEqualTo(SettlementErrorType.PRICE_UNAVAILABLE);
            assertThat(result.getError().getMessage()).contains("spot");
        }

        @Test
        @DisplayName("Uncovered price rise fails with INSUFFICIENT_FUNDS_ON_SETTLEMENT")
        void uncoveredPriceRise() {
            transactionExists();
            when(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.BUY)).thenReturn(new BigDecimal("2200"));
            when(ledgerService.adjust("user-1", new BigDecimal("-50.00"))).thenReturn(false);

            SettlementResult result = handler.handle(task(OrderSide.BUY));

            assertThat(result.getError().getType()).isEqualTo(SettlementErrorType.INSUFFICIENT_FUNDS_ON_SETTLEMENT);
            assertThat(result.getError().getMessage()).contains("50.00");
        }

        @Test
        @DisplayName("Ledger exception fails with LEDGER_ERROR")
        void ledgerThrows() {
            transactionExists();
            when(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.SELL)).thenReturn(new BigDecimal("2100"));
            when(ledgerService.adjust(eq("user-1"), any(BigDecimal.class)))
                    .thenThrow(new DataAccessResourceFailureException("database down"));

            SettlementResult result = handler.handle(task(OrderSide.SELL));

            assertThat(result.getError().getType()).isEqualTo(SettlementErrorType.LEDGER_ERROR);
            assertThat(result.getError().getMessage()).contains("database down");
        }
    }
}
