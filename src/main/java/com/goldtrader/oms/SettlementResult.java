package com.goldtrader.oms;

import com.goldtrader.domain.enums.SettlementErrorType;
import lombok.Builder;
import lombok.Data;

/**
 * Result of settling one task: an outcome when it succeeded, an error otherwise.
 * Exactly one of the two is set.
 */
@Data
@Builder
public class SettlementResult {

    private boolean success;
    private SettlementOutcome outcome;
    private SettlementError error;

    public static SettlementResult success(SettlementOutcome outcome) {
        return SettlementResult.builder().success(true).outcome(outcome).build();
    }

    public static SettlementResult failure(SettlementErrorType type, String message) {
        return SettlementResult.builder()
                .success(false)
                .error(new SettlementError(type, message))
                .build();
    }
}
