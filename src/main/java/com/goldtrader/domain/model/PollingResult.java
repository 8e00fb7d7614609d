package com.goldtrader.domain.model;

import com.goldtrader.domain.enums.TransactionStatus;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Answer to a status poll. Merges the durable transaction with its live task status:
 * a live status overrides a non-terminal durable one, a terminal durable status always wins.
 */
@Data
@Builder
public class PollingResult {

    private String transactionId;
    private TransactionStatus status;

    /** "pending", "processing", "completed" or "failed: reason". */
    private String message;

    private Map<String, Object> data;

    /** Set only for terminal states. */
    private LocalDateTime completedAt;
}
