package com.goldtrader.repository.jpa;

import com.goldtrader.entity.GoldPriceEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GoldPriceJpaRepository extends JpaRepository<GoldPriceEntity, Long> {

    Optional<GoldPriceEntity> findTopByOrderByRecordedAtDesc();
}
