package com.goldtrader.domain.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QueueHealth {

    private long normalQueueDepth;
    private long priorityQueueDepth;
    private boolean backendConnected;
}
