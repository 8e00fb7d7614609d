package com.goldtrader.domain.model;

import com.goldtrader.domain.enums.TaskState;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ephemeral status of a queued task. Lives in an expiring cache; each write replaces the
 * previous entry and resets the TTL. A missing entry means "expired or never written", not failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatus {

    private String processingId;
    private TaskState state;

    /** Settlement result on completion, {@code {"error": ...}} on failure, null otherwise. */
    private Map<String, Object> result;

    private Instant updatedAt;
}
