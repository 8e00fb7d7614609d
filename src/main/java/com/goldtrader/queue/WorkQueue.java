package com.goldtrader.queue;

import com.goldtrader.domain.enums.QueueLane;
import com.goldtrader.domain.enums.TaskState;
import com.goldtrader.domain.model.QueueDepth;
import com.goldtrader.domain.model.QueueHealth;
import com.goldtrader.domain.model.TaskStatus;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Dual-lane work queue with an expiring task-status cache.
 *
 * <p>Delivery is at-least-once up to dequeue: a task is removed before it is handed out, so a
 * consumer crash between dequeue and settlement loses it. Backend failures surface as
 * {@link com.goldtrader.exception.QueueUnavailableException}; the queue never drops a task on its own,
 * apart from payloads that fail envelope validation, which go to the dead-letter list.
 */
public interface WorkQueue {

    /**
     * Makes the task visible to consumers. Assigns a processingId when absent, stamps
     * {@code queuedAt}, writes a QUEUED status and then routes by priority.
     *
     * @return the processingId
     * @throws com.goldtrader.exception.QueueUnavailableException only when the task was not queued
     */
    String enqueue(ExecutionTask task);

    /**
     * Pops one task from a lane. The priority lane is a non-blocking pop; the normal lane waits
     * up to {@code timeout}.
     */
    Optional<ExecutionTask> dequeue(QueueLane lane, Duration timeout);

    /** Drains the priority lane strictly before polling the normal lane. */
    default Optional<ExecutionTask> dequeue(Duration timeout) {
        Optional<ExecutionTask> priorityTask = dequeue(QueueLane.PRIORITY, timeout);
        if (priorityTask.isPresent()) {
            return priorityTask;
        }
        return dequeue(QueueLane.NORMAL, timeout);
    }

    /** Overwrites the status entry and resets its TTL. Last writer wins. */
    void setStatus(String processingId, TaskState state, Map<String, Object> result);

    /** Empty once the TTL has elapsed. Callers must not read a missing status as failure. */
    Optional<TaskStatus> getStatus(String processingId);

    QueueDepth depth();

    QueueHealth health();

    /** Empties both lanes. Status entries are left to expire. */
    void clear();
}
