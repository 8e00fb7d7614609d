package com.goldtrader.oms;

import com.goldtrader.queue.ExecutionTask;

/** Settles one dequeued task. Registered per queue lane with the {@link ExecutionWorker}. */
@FunctionalInterface
public interface TaskHandler {

    /** Never throws for expected failures; they come back as a failed {@link SettlementResult}. */
    SettlementResult handle(ExecutionTask task);
}
