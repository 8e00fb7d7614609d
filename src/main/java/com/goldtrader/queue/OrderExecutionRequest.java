package com.goldtrader.queue;

import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the execution worker needs to settle one transaction, carried inside an {@link ExecutionTask}.
 *
 * <p>The quoted price and quantity are what the user saw at placement. Settlement re-prices
 * against the current oracle price and uses these only for reconciliation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderExecutionRequest {

    private String transactionId;
    private String userId;
    private Symbol symbol;
    private OrderSide side;
    private BigDecimal requestedAmount;
    private BigDecimal quotedPricePerUnit;
    private BigDecimal quotedQuantity;
    private LocalDateTime createdAt;
}
