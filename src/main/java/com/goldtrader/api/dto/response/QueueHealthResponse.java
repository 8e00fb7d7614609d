package com.goldtrader.api.dto.response;

import lombok.Builder;
import lombok.Getter;

/** Queue depth per lane, backend reachability, and the execution worker's state. */
@Getter
@Builder
public class QueueHealthResponse {

    private final long normalQueueDepth;
    private final long priorityQueueDepth;
    private final boolean backendConnected;
    private final boolean workerRunning;
    private final long processedCount;
    private final long failedCount;
}
