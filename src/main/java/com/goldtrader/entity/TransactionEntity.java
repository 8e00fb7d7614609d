package com.goldtrader.entity;

import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.enums.TransactionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the transactions table. Money is DECIMAL(19,2), prices DECIMAL(19,4) and
 * quantities DECIMAL(24,10), so values round-trip without loss.
 */
@Entity
@Table(
        name = "transactions",
        indexes = {
            @Index(name = "idx_transactions_user", columnList = "user_id"),
            @Index(name = "idx_transactions_processing", columnList = "processing_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private Symbol symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private OrderSide side;

    @Column(name = "requested_amount", precision = 19, scale = 2, nullable = false)
    private BigDecimal requestedAmount;

    @Column(name = "quoted_price_per_unit", precision = 19, scale = 4)
    private BigDecimal quotedPricePerUnit;

    @Column(name = "executed_quantity", precision = 24, scale = 10)
    private BigDecimal executedQuantity;

    @Column(name = "executed_price_per_unit", precision = 19, scale = 4)
    private BigDecimal executedPricePerUnit;

    @Column(name = "executed_amount", precision = 19, scale = 2)
    private BigDecimal executedAmount;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)", nullable = false)
    private TransactionStatus status;

    @Column(name = "processing_id", length = 36)
    private String processingId;

    @Column(name = "poll_url", length = 255)
    private String pollUrl;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
