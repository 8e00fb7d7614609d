package com.goldtrader.api.dto.response;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class BalanceResponse {

    private final String userId;
    private final BigDecimal balance;
    private final String currency;
}
