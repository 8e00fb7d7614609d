package com.goldtrader.queue;

/**
 * Redis key schema of the work queue. Every key carries the configured prefix because the
 * Redis server is shared.
 *
 * <pre>
 *   {prefix}{queue}                 list of normal-lane task JSON (LPUSH / BRPOP)
 *   {prefix}{queue}_priority        sorted set of priority-lane task JSON, scored min-first
 *   {prefix}{queue}_dead            list of payloads rejected at dequeue
 *   {prefix}task_status:{id}        task status JSON, expiring
 * </pre>
 */
public final class QueueKeys {

    private final String normalLane;
    private final String priorityLane;
    private final String deadLetter;
    private final String statusPrefix;

    public QueueKeys(String keyPrefix, String queueName) {
        this.normalLane = keyPrefix + queueName;
        this.priorityLane = keyPrefix + queueName + "_priority";
        this.deadLetter = keyPrefix + queueName + "_dead";
        this.statusPrefix = keyPrefix + "task_status:";
    }

    public String normalLane() {
        return normalLane;
    }

    public String priorityLane() {
        return priorityLane;
    }

    public String deadLetter() {
        return deadLetter;
    }

    public String status(String processingId) {
        return statusPrefix + processingId;
    }
}
