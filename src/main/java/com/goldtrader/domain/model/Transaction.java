package com.goldtrader.domain.model;

import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.enums.TransactionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A user's request to buy or sell a fixed cash amount of a symbol.
 *
 * <p>Created by the OrderService with the price quoted at placement time and settled
 * later by the ExecutionWorker at whatever price is current then. The processingId
 * correlates this durable record with its ephemeral task status in the work queue.
 *
 * <p>All money, price and quantity fields are {@link BigDecimal} so they round-trip through
 * the store without precision loss.
 */
@Data
@Builder(toBuilder = true)
public class Transaction {

    private String id;
    private String userId;
    private Symbol symbol;
    private OrderSide side;

    /** Cash amount in THB: money to spend for a buy, money to receive for a sell. */
    private BigDecimal requestedAmount;

    /** Price per unit observed when the order was placed. */
    private BigDecimal quotedPricePerUnit;

    /** Zero until settlement. */
    @Builder.Default
    private BigDecimal executedQuantity = BigDecimal.ZERO;

    private BigDecimal executedPricePerUnit;
    private BigDecimal executedAmount;

    private TransactionStatus status;
    private String processingId;
    private String pollUrl;
    private String errorMessage;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
