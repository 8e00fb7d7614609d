package com.goldtrader.unit.price;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.goldtrader.config.SettlementConfig;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.SettlementPolicy;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.model.PriceSnapshot;
import com.goldtrader.exception.ErrorCode;
import com.goldtrader.exception.PriceUnavailableException;
import com.goldtrader.price.PriceOracle;
import com.goldtrader.price.PriceQuoteService;
import com.goldtrader.support.StubPriceOracle;
import com.goldtrader.support.TestFixtures;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PriceQuoteServiceTest {

    private StubPriceOracle priceOracle;
    private SettlementConfig settlementConfig;
    private PriceQuoteService priceQuoteService;

    @BeforeEach
    void setUp() {
        priceOracle = new StubPriceOracle();
        settlementConfig = TestFixtures.settlementConfig(SettlementPolicy.AMOUNT_PRESERVING);
        priceQuoteService = new PriceQuoteService(priceOracle, Runnable::run, settlementConfig);
    }

    @Nested
    @DisplayName("Side-specific quotes")
    class SideQuotes {

        @Test
        @DisplayName("Spot uses its single price for both sides")
        void spotSinglePrice() {
            priceOracle.spot("2150.25");

            assertThat(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.BUY)).isEqualByComparingTo("2150.25");
            assertThat(priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.SELL)).isEqualByComparingTo("2150.25");
        }

        @Test
        @DisplayName("Gold96 buys take the ask and sells take the bid")
        void gold96AskAndBid() {
            priceOracle.gold96("42100", "41900");

            assertThat(priceQuoteService.quotePrice(Symbol.GOLD96, OrderSide.BUY)).isEqualByComparingTo("42100");
            assertThat(priceQuoteService.quotePrice(Symbol.GOLD96, OrderSide.SELL)).isEqualByComparingTo("41900");
        }

        @Test
        @DisplayName("Zero price counts as unavailable")
        void zeroPriceUnavailable() {
            priceOracle.spot("0");

            assertThatThrownBy(() -> priceQuoteService.quotePrice(Symbol.SPOT, OrderSide.BUY))
                    .isInstanceOf(PriceUnavailableException.class)
                    .hasMessageContaining("spot");
        }

        @Test
        @DisplayName("Missing snapshot counts as unavailable")
        void missingSnapshot() {
            assertThatThrownBy(() -> priceQuoteService.currentSnapshot(Symbol.GOLD96))
                    .isInstanceOf(PriceUnavailableException.class)
                    .satisfies(e -> assertThat(((PriceUnavailableException) e).getErrorCode())
                            .isEqualTo(ErrorCode.PRICE_UNAVAILABLE));
        }
    }

    @Nested
    @DisplayName("Bounded lookup")
    class BoundedLookup {

        private ExecutorService executor;
        private CountDownLatch release;

        @BeforeEach
        void setUp() {
            executor = Executors.newSingleThreadExecutor();
            release = new CountDownLatch(1);
        }

        @AfterEach
        void tearDown() {
            release.countDown();
            executor.shutdownNow();
        }

        @Test
        @DisplayName("A lookup that does not answer within the timeout is unavailable")
        void slowOracleTimesOut() {
            PriceOracle slowOracle = symbol -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Optional.of(PriceSnapshot.builder().symbol(symbol).build());
            };
            settlementConfig.setPriceLookupTimeout(Duration.ofMillis(50));
            PriceQuoteService service = new PriceQuoteService(slowOracle, executor, settlementConfig);

            assertThatThrownBy(() -> service.quotePrice(Symbol.SPOT, OrderSide.BUY))
                    .isInstanceOf(PriceUnavailableException.class)
                    .hasCauseInstanceOf(java.util.concurrent.TimeoutException.class);
        }

        @Test
        @DisplayName("An oracle failure is reported as unavailable with the original cause")
        void oracleFailure() {
            PriceOracle brokenOracle = symbol -> {
                throw new IllegalStateException("feed table missing");
            };
            PriceQuoteService service = new PriceQuoteService(brokenOracle, executor, settlementConfig);

            assertThatThrownBy(() -> service.currentSnapshot(Symbol.SPOT))
                    .isInstanceOf(PriceUnavailableException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
    }
}
