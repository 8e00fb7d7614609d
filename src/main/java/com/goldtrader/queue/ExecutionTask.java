package com.goldtrader.queue;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Versioned envelope stored in the work queue. {@link TaskEnvelopeCodec} writes it as JSON
 * and rejects anything that does not decode into a complete, current-version envelope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionTask {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    /** Assigned by the queue on enqueue when absent. */
    private String processingId;

    /** Zero routes to the normal lane; anything above zero to the priority lane. */
    private int priority;

    /** Stamped by the queue on enqueue. */
    private Instant queuedAt;

    private OrderExecutionRequest payload;
}
