package com.goldtrader.price;

import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.model.PriceSnapshot;
import java.util.Optional;

/**
 * Source of the latest known price for a symbol. Staleness is not checked here: callers get
 * whatever the feed last published, with its {@code asOf}.
 */
public interface PriceOracle {

    /** Empty when the feed has never published a price for the symbol. */
    Optional<PriceSnapshot> getCurrentPrice(Symbol symbol);
}
