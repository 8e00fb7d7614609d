package com.goldtrader.service;

import com.goldtrader.config.SettlementConfig;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.domain.model.Portfolio;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.exception.PriceUnavailableException;
import com.goldtrader.ledger.LedgerService;
import com.goldtrader.price.PriceQuoteService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Balance plus holdings derived from completed transactions: bought quantity minus sold quantity
 * per symbol. Sells are cash-settled and unchecked against holdings, so a holding can go negative.
 */
@Service
public class PortfolioService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioService.class);

    private final LedgerService ledgerService;
    private final TransactionStore transactionStore;
    private final PriceQuoteService priceQuoteService;
    private final SettlementConfig settlementConfig;

    public PortfolioService(
            LedgerService ledgerService,
            TransactionStore transactionStore,
            PriceQuoteService priceQuoteService,
            SettlementConfig settlementConfig) {
        this.ledgerService = ledgerService;
        this.transactionStore = transactionStore;
        this.priceQuoteService = priceQuoteService;
        this.settlementConfig = settlementConfig;
    }

    public Portfolio portfolio(String userId) {
        BigDecimal balance = ledgerService.getBalanceOrZero(userId);
        List<Transaction> completed = transactionStore.findByUserAndStatus(userId, TransactionStatus.COMPLETED);

        Map<Symbol, BigDecimal> holdings = new EnumMap<>(Symbol.class);
        for (Symbol symbol : Symbol.values()) {
            holdings.put(symbol, BigDecimal.ZERO);
        }
        for (Transaction transaction : completed) {
            BigDecimal quantity = transaction.getExecutedQuantity();
            if (quantity == null) {
                continue;
            }
            BigDecimal signed = transaction.getSide() == OrderSide.BUY ? quantity : quantity.negate();
            holdings.merge(transaction.getSymbol(), signed, BigDecimal::add);
        }

        Map<Symbol, BigDecimal> holdingsValue = new EnumMap<>(Symbol.class);
        BigDecimal totalValue = balance;
        for (Map.Entry<Symbol, BigDecimal> holding : holdings.entrySet()) {
            BigDecimal value = valueOf(holding.getKey(), holding.getValue());
            holdingsValue.put(holding.getKey(), value);
            totalValue = totalValue.add(value);
        }

        return Portfolio.builder()
                .userId(userId)
                .balance(balance)
                .holdings(holdings)
                .holdingsValue(holdingsValue)
                .totalValue(totalValue)
                .currency(settlementConfig.getCurrency())
                .asOf(LocalDateTime.now())
                .build();
    }

    /** Valued at what a sale would realize: the spot price, the gold96 bid. Zero when unpriced. */
    private BigDecimal valueOf(Symbol symbol, BigDecimal quantity) {
        if (quantity.signum() == 0) {
            return BigDecimal.ZERO;
        }
        try {
            BigDecimal price = priceQuoteService.quotePrice(symbol, OrderSide.SELL);
            return quantity.multiply(price).setScale(settlementConfig.getCurrencyScale(), RoundingMode.HALF_UP);
        } catch (PriceUnavailableException e) {
            log.warn("Holding of {} left unvalued: {}", symbol, e.getMessage());
            return BigDecimal.ZERO;
        }
    }
}
