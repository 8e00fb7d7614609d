package com.goldtrader.mapper;

import com.goldtrader.domain.model.Transaction;
import com.goldtrader.entity.TransactionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between the Transaction domain model and TransactionEntity. Field names match one to one. */
@Mapper
public interface TransactionMapper {

    TransactionEntity toEntity(Transaction transaction);

    Transaction toDomain(TransactionEntity entity);

    List<Transaction> toDomainList(List<TransactionEntity> entities);
}
