package com.goldtrader.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Number of tasks waiting in each lane. Eventually consistent with concurrent enqueue/dequeue. */
@Data
@AllArgsConstructor
public class QueueDepth {

    private long normalCount;
    private long priorityCount;

    public long total() {
        return normalCount + priorityCount;
    }
}
