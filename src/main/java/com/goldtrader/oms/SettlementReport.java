package com.goldtrader.oms;

import com.goldtrader.domain.model.Transaction;
import com.goldtrader.queue.OrderExecutionRequest;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code data} payload of a completed transaction. The worker writes it into the task status and
 * polling renders it from the stored transaction, so both carry the same keys and the same decimal
 * scales as the transaction columns.
 */
public final class SettlementReport {

    private static final int AMOUNT_SCALE = 2;
    private static final int PRICE_SCALE = 4;
    private static final int QUANTITY_SCALE = 10;

    private SettlementReport() {}

    public static Map<String, Object> of(Transaction transaction) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("transactionId", transaction.getId());
        data.put("symbol", transaction.getSymbol() != null ? transaction.getSymbol().getWireName() : null);
        data.put("side", transaction.getSide() != null ? transaction.getSide().wireName() : null);
        data.put("requestedAmount", plain(transaction.getRequestedAmount(), AMOUNT_SCALE));
        data.put("executedQuantity", plain(transaction.getExecutedQuantity(), QUANTITY_SCALE));
        data.put("executedPricePerUnit", plain(transaction.getExecutedPricePerUnit(), PRICE_SCALE));
        data.put("executedAmount", plain(transaction.getExecutedAmount(), AMOUNT_SCALE));
        return data;
    }

    /** Same payload built before (or without) the durable write. */
    public static Map<String, Object> of(OrderExecutionRequest request, SettlementOutcome outcome) {
        return of(Transaction.builder()
                .id(request.getTransactionId())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .requestedAmount(request.getRequestedAmount())
                .executedQuantity(outcome.getExecutedQuantity())
                .executedPricePerUnit(outcome.getExecutedPricePerUnit())
                .executedAmount(outcome.getExecutedAmount())
                .build());
    }

    private static String plain(BigDecimal value, int scale) {
        return value != null ? value.setScale(scale, RoundingMode.HALF_UP).toPlainString() : null;
    }
}
