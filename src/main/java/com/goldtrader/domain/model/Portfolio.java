package com.goldtrader.domain.model;

import com.goldtrader.domain.enums.Symbol;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Cash balance plus holdings per symbol, derived from completed transactions.
 * Holdings are valued at the spot price and the gold96 bid (what the user would receive on sale).
 */
@Data
@Builder
public class Portfolio {

    private String userId;
    private BigDecimal balance;
    private Map<Symbol, BigDecimal> holdings;
    private Map<Symbol, BigDecimal> holdingsValue;
    private BigDecimal totalValue;
    private String currency;
    private LocalDateTime asOf;
}
