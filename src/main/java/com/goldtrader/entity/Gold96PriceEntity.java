package com.goldtrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 96.5% gold bar price rows written by the external price feed. The dealer quotes two sides:
 * {@code buyPrice} is what the user pays, {@code sellPrice} what the user receives.
 */
@Entity
@Table(name = "gold96_prices")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Gold96PriceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "buy_price", precision = 19, scale = 4, nullable = false)
    private BigDecimal buyPrice;

    @Column(name = "sell_price", precision = 19, scale = 4, nullable = false)
    private BigDecimal sellPrice;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;
}
