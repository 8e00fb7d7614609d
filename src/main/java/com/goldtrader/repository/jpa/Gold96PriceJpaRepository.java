package com.goldtrader.repository.jpa;

import com.goldtrader.entity.Gold96PriceEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface Gold96PriceJpaRepository extends JpaRepository<Gold96PriceEntity, Long> {

    Optional<Gold96PriceEntity> findTopByOrderByRecordedAtDesc();
}
