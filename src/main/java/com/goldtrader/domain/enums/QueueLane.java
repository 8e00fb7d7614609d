package com.goldtrader.domain.enums;

/**
 * The two lanes of the work queue. The priority lane is always drained before the
 * normal lane is polled, so a burst of priority tasks can starve the normal lane.
 */
public enum QueueLane {
    NORMAL,
    PRIORITY;

    /** Routes a task by its priority value: anything above zero goes to the priority lane. */
    public static QueueLane forPriority(int priority) {
        return priority > 0 ? PRIORITY : NORMAL;
    }
}
