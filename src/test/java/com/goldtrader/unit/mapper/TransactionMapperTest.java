package com.goldtrader.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.goldtrader.domain.enums.OrderSide;
import com.goldtrader.domain.enums.Symbol;
import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.entity.TransactionEntity;
import com.goldtrader.mapper.TransactionMapper;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class TransactionMapperTest {

    private final TransactionMapper mapper = Mappers.getMapper(TransactionMapper.class);

    @Test
    void entityToDomainKeepsDecimalsAndStatus() {
        LocalDateTime createdAt = LocalDateTime.of(2025, 3, 1, 9, 0);
        TransactionEntity entity = TransactionEntity.builder()
                .id("tx-1")
                .userId("user-1")
                .symbol(Symbol.GOLD96)
                .side(OrderSide.SELL)
                .requestedAmount(new BigDecimal("1250.50"))
                .quotedPricePerUnit(new BigDecimal("41900"))
                .executedQuantity(new BigDecimal("0.0298448687"))
                .status(TransactionStatus.COMPLETED)
                .processingId("proc-1")
                .pollUrl("/api/trading/poll/tx-1")
                .createdAt(createdAt)
                .build();

        Transaction transaction = mapper.toDomain(entity);

        assertThat(transaction.getId()).isEqualTo("tx-1");
        assertThat(transaction.getSymbol()).isEqualTo(Symbol.GOLD96);
        assertThat(transaction.getRequestedAmount()).isEqualTo(new BigDecimal("1250.50"));
        assertThat(transaction.getExecutedQuantity()).isEqualTo(new BigDecimal("0.0298448687"));
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(transaction.getPollUrl()).isEqualTo("/api/trading/poll/tx-1");
        assertThat(transaction.getCreatedAt()).isEqualTo(createdAt);
    }

    @Test
    void domainToEntityCarriesErrorMessage() {
        Transaction transaction = Transaction.builder()
                .id("tx-2")
                .userId("user-1")
                .symbol(Symbol.SPOT)
                .side(OrderSide.BUY)
                .requestedAmount(new BigDecimal("500.00"))
                .status(TransactionStatus.FAILED)
                .errorMessage("Cancelled by user")
                .build();

        TransactionEntity entity = mapper.toEntity(transaction);

        assertThat(entity.getErrorMessage()).isEqualTo("Cancelled by user");
        assertThat(entity.getExecutedQuantity()).isEqualByComparingTo("0");
    }

    @Test
    void listMappingPreservesOrder() {
        List<Transaction> transactions = mapper.toDomainList(List.of(
                TransactionEntity.builder().id("a").build(), TransactionEntity.builder().id("b").build()));

        assertThat(transactions).extracting(Transaction::getId).containsExactly("a", "b");
    }
}
