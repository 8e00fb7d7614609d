package com.goldtrader.oms;

import com.goldtrader.domain.enums.BalanceAdjustmentType;
import com.goldtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Priced settlement of one transaction: what was executed and how the balance must move.
 * {@code balanceDelta} is signed and applied to the ledger as-is.
 */
@Data
@Builder
public class SettlementOutcome {

    private String transactionId;
    private String processingId;
    private OrderSide side;
    private BigDecimal executedQuantity;
    private BigDecimal executedPricePerUnit;
    private BigDecimal executedAmount;
    private BalanceAdjustmentType adjustmentType;
    private BigDecimal balanceDelta;
}
