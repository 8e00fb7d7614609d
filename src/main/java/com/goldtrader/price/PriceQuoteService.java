package com.goldtrader.price;

import com.goldtrader.config.SettlementConfig;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.model.PriceSnapshot;
import com.goldtrader.exception.PriceUnavailableException;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Bounded-wait front of the {@link PriceOracle}, shared by quoting at placement and re-pricing
 * at settlement.
 *
 * <p>A lookup that fails, times out, or comes back without a positive price for the requested
 * side surfaces as {@link PriceUnavailableException}.
 */
@Service
public class PriceQuoteService {

    private static final Logger log = LoggerFactory.getLogger(PriceQuoteService.class);

    private final PriceOracle priceOracle;
    private final Executor priceLookupExecutor;
    private final SettlementConfig settlementConfig;

    public PriceQuoteService(
            PriceOracle priceOracle,
            @Qualifier("priceLookupExecutor") Executor priceLookupExecutor,
            SettlementConfig settlementConfig) {
        this.priceOracle = priceOracle;
        this.priceLookupExecutor = priceLookupExecutor;
        this.settlementConfig = settlementConfig;
    }

    /**
     * Returns the per-unit price for the side: the ask for a gold96 buy, the bid for a gold96 sell,
     * the single price for spot.
     */
    public BigDecimal quotePrice(Symbol symbol, OrderSide side) {
        BigDecimal price = currentSnapshot(symbol).priceFor(side);
        if (price == null || price.signum() <= 0) {
            log.warn("No usable {} price for {}", side, symbol);
            throw new PriceUnavailableException(symbol);
        }
        return price;
    }

    /** Latest snapshot for the symbol. */
    public PriceSnapshot currentSnapshot(Symbol symbol) {
        CompletableFuture<Optional<PriceSnapshot>> lookup =
                CompletableFuture.supplyAsync(() -> priceOracle.getCurrentPrice(symbol), priceLookupExecutor);
        try {
            return lookup.get(settlementConfig.getPriceLookupTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .orElseThrow(() -> new PriceUnavailableException(symbol));
        } catch (TimeoutException e) {
            lookup.cancel(true);
            log.warn("Price lookup for {} timed out after {}", symbol, settlementConfig.getPriceLookupTimeout());
            throw new PriceUnavailableException(symbol, e);
        } catch (ExecutionException e) {
            log.error("Price lookup for {} failed", symbol, e.getCause());
            throw new PriceUnavailableException(symbol, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PriceUnavailableException(symbol, e);
        }
    }
}
