package com.goldtrader.repository.jpa;

import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.entity.TransactionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TransactionJpaRepository extends JpaRepository<TransactionEntity, String> {

    List<TransactionEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    List<TransactionEntity> findByUserIdAndStatus(String userId, TransactionStatus status);

    Optional<TransactionEntity> findByProcessingId(String processingId);
}
