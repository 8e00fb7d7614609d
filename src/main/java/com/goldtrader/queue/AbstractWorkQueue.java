package com.goldtrader.queue;

import com.goldtrader.config.QueueConfig;
import com.goldtrader.domain.enums.QueueLane;
import com.goldtrader.domain.enums.TaskState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend-independent half of a {@link WorkQueue}: envelope stamping, lane routing, priority
 * scoring and dead-lettering of payloads the codec rejects. Subclasses store raw JSON strings.
 */
public abstract class AbstractWorkQueue implements WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(AbstractWorkQueue.class);

    protected final TaskEnvelopeCodec codec;
    protected final QueueConfig queueConfig;
    protected final Clock clock;

    protected AbstractWorkQueue(TaskEnvelopeCodec codec, QueueConfig queueConfig, Clock clock) {
        this.codec = codec;
        this.queueConfig = queueConfig;
        this.clock = clock;
    }

    @Override
    public String enqueue(ExecutionTask task) {
        if (task.getProcessingId() == null || task.getProcessingId().isBlank()) {
            task.setProcessingId(UUID.randomUUID().toString());
        }
        task.setVersion(ExecutionTask.CURRENT_VERSION);
        task.setQueuedAt(clock.instant());

        String raw = codec.encode(task);
        QueueLane lane = QueueLane.forPriority(task.getPriority());
        // status first: once pushed, the task may be settled, and a later throw would fail a live order
        setStatus(task.getProcessingId(), TaskState.QUEUED, null);
        if (lane == QueueLane.PRIORITY) {
            pushPriority(raw, score(task));
        } else {
            pushNormal(raw);
        }

        log.debug("Task enqueued: processingId={}, lane={}", task.getProcessingId(), lane);
        return task.getProcessingId();
    }

    @Override
    public Optional<ExecutionTask> dequeue(QueueLane lane, Duration timeout) {
        String raw = lane == QueueLane.PRIORITY ? popPriority() : popNormal(timeout);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(raw));
        } catch (MalformedTaskException e) {
            log.warn("Rejected malformed task from {} lane: {}", lane, e.getMessage());
            pushDeadLetter(raw);
            if (e.getProcessingId() != null) {
                setStatus(e.getProcessingId(), TaskState.FAILED, Map.of("error", e.getMessage()));
            }
            return Optional.empty();
        }
    }

    /** Lower scores dequeue first. Priority weighs against arrival time in epoch seconds. */
    protected double score(ExecutionTask task) {
        Instant queuedAt = task.getQueuedAt();
        double epochSeconds = queuedAt.getEpochSecond() + queuedAt.getNano() / 1_000_000_000.0;
        return task.getPriority() * queueConfig.getPriorityScoreOffset() + epochSeconds;
    }

    protected abstract void pushNormal(String raw);

    protected abstract void pushPriority(String raw, double score);

    /** Returns null when the lane is empty. */
    protected abstract String popPriority();

    /** Returns null when nothing arrived within the timeout. */
    protected abstract String popNormal(Duration timeout);

    protected abstract void pushDeadLetter(String raw);
}
