package com.goldtrader.config;

import com.goldtrader.domain.enums.SettlementPolicy;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for quoting and settlement.
 *
 * <p>Properties prefix: {@code goldtrader.settlement.*}
 */
@Configuration
@ConfigurationProperties(prefix = "goldtrader.settlement")
@Getter
@Setter
public class SettlementConfig {

    /** Which side of an order stays fixed when it is re-priced at execution. */
    private SettlementPolicy policy = SettlementPolicy.AMOUNT_PRESERVING;

    /** Upper bound on a single price oracle lookup. Expiry surfaces as PRICE_UNAVAILABLE. */
    private Duration priceLookupTimeout = Duration.ofSeconds(2);

    /** Decimal places kept on quantities. */
    private int quantityScale = 10;

    /** Decimal places kept on cash amounts. */
    private int currencyScale = 2;

    private String currency = "THB";
}
