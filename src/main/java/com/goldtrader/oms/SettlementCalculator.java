package com.goldtrader.oms;

import com.goldtrader.config.SettlementConfig;
import com.goldtrader.domain.enums.BalanceAdjustmentType;
import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.SettlementPolicy;
import com.goldtrader.queue.OrderExecutionRequest;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Settlement arithmetic. Pure: no I/O, no ledger calls.
 *
 * <p>Under AMOUNT_PRESERVING the requested amount is fixed and the quantity follows the current
 * price, so {@code executedAmount == requestedAmount} and a buy needs no reconciliation. Under
 * QUANTITY_PRESERVING the quoted quantity is fixed and the amount follows the current price:
 * a buy is refunded or charged the difference to the held amount.
 *
 * <p>A buy's delta is {@code requestedAmount - executedAmount} (positive refunds, negative charges).
 * A sell credits {@code executedAmount}, nothing having been held at placement.
 */
@Component
public class SettlementCalculator {

    private final SettlementConfig settlementConfig;

    public SettlementCalculator(SettlementConfig settlementConfig) {
        this.settlementConfig = settlementConfig;
    }

    /** Provisional quantity shown at placement: amount over quoted price, same division for both sides. */
    public BigDecimal quotedQuantity(BigDecimal amount, BigDecimal quotedPricePerUnit) {
        return amount.divide(quotedPricePerUnit, settlementConfig.getQuantityScale(), RoundingMode.HALF_UP);
    }

    public SettlementOutcome settle(OrderExecutionRequest request, String processingId, BigDecimal currentPrice) {
        BigDecimal executedQuantity = executedQuantity(request, currentPrice);
        BigDecimal executedAmount =
                executedQuantity.multiply(currentPrice).setScale(settlementConfig.getCurrencyScale(), RoundingMode.HALF_UP);

        BigDecimal balanceDelta;
        BalanceAdjustmentType adjustmentType;
        if (request.getSide() == OrderSide.SELL) {
            balanceDelta = executedAmount;
            adjustmentType = BalanceAdjustmentType.CREDIT;
        } else {
            balanceDelta = request.getRequestedAmount().subtract(executedAmount);
            adjustmentType = switch (balanceDelta.signum()) {
                case 1 -> BalanceAdjustmentType.REFUND;
                case -1 -> BalanceAdjustmentType.ADDITIONAL_CHARGE;
                default -> BalanceAdjustmentType.NONE;
            };
        }

        return SettlementOutcome.builder()
                .transactionId(request.getTransactionId())
                .processingId(processingId)
                .side(request.getSide())
                .executedQuantity(executedQuantity)
                .executedPricePerUnit(currentPrice)
                .executedAmount(executedAmount)
                .adjustmentType(adjustmentType)
                .balanceDelta(balanceDelta)
                .build();
    }

    private BigDecimal executedQuantity(OrderExecutionRequest request, BigDecimal currentPrice) {
        if (settlementConfig.getPolicy() == SettlementPolicy.QUANTITY_PRESERVING) {
            return request.getQuotedQuantity() != null
                    ? request.getQuotedQuantity()
                    : quotedQuantity(request.getRequestedAmount(), request.getQuotedPricePerUnit());
        }
        return request.getRequestedAmount()
                .divide(currentPrice, settlementConfig.getQuantityScale(), RoundingMode.HALF_UP);
    }
}
