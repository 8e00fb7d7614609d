package com.goldtrader.price;

import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.model.PriceSnapshot;
import com.goldtrader.repository.jpa.Gold96PriceJpaRepository;
import com.goldtrader.repository.jpa.GoldPriceJpaRepository;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * {@link PriceOracle} reading the newest row the external feed wrote: {@code gold_prices} for spot,
 * {@code gold96_prices} for gold96 (buy price is the ask, sell price the bid).
 */
@Component
public class DatabasePriceOracle implements PriceOracle {

    private final GoldPriceJpaRepository goldPriceJpaRepository;
    private final Gold96PriceJpaRepository gold96PriceJpaRepository;

    public DatabasePriceOracle(
            GoldPriceJpaRepository goldPriceJpaRepository, Gold96PriceJpaRepository gold96PriceJpaRepository) {
        this.goldPriceJpaRepository = goldPriceJpaRepository;
        this.gold96PriceJpaRepository = gold96PriceJpaRepository;
    }

    @Override
    public Optional<PriceSnapshot> getCurrentPrice(Symbol symbol) {
        return switch (symbol) {
            case SPOT -> goldPriceJpaRepository.findTopByOrderByRecordedAtDesc().map(row -> PriceSnapshot.builder()
                    .symbol(Symbol.SPOT)
                    .singlePrice(row.getPrice())
                    .asOf(row.getRecordedAt())
                    .build());
            case GOLD96 -> gold96PriceJpaRepository.findTopByOrderByRecordedAtDesc().map(row -> PriceSnapshot.builder()
                    .symbol(Symbol.GOLD96)
                    .askPrice(row.getBuyPrice())
                    .bidPrice(row.getSellPrice())
                    .asOf(row.getRecordedAt())
                    .build());
        };
    }
}
