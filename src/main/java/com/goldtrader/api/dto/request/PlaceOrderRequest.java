package com.goldtrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Body of a buy or sell. The amount is cash in THB: what to spend, or what to receive. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlaceOrderRequest {

    /** "spot" or "gold96". */
    @NotBlank
    private String symbol;

    @NotNull
    @Positive
    private BigDecimal amount;

    private boolean highPriority;
}
