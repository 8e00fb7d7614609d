package com.goldtrader.oms;

import com.goldtrader.domain.enums.SettlementErrorType;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SettlementError {

    private SettlementErrorType type;
    private String message;
}
