package com.goldtrader.queue;

import com.goldtrader.config.QueueConfig;
import com.goldtrader.domain.enums.TaskState;
import com.goldtrader.domain.model.QueueDepth;
import com.goldtrader.domain.model.QueueHealth;
import com.goldtrader.domain.model.TaskStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-process {@link WorkQueue}. Nothing survives a restart.
 *
 * <p>The priority lane is a {@link PriorityBlockingQueue} sorted by score, then by a monotonically
 * increasing sequence number so equal scores keep arrival order. The normal lane is a FIFO
 * {@link LinkedBlockingQueue}. Status entries expire on read, and writes sweep out expired entries
 * at most once per {@link #SWEEP_INTERVAL}.
 */
@Component
@ConditionalOnProperty(prefix = "goldtrader.queue", name = "backend", havingValue = "memory")
public class InMemoryWorkQueue extends AbstractWorkQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkQueue.class);

    private static final int INITIAL_CAPACITY = 64;

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final AtomicLong sequenceCounter = new AtomicLong(0);

    private final PriorityBlockingQueue<ScoredEntry> priorityLane = new PriorityBlockingQueue<>(
            INITIAL_CAPACITY,
            Comparator.comparingDouble(ScoredEntry::score).thenComparingLong(ScoredEntry::sequenceNumber));

    private final LinkedBlockingQueue<String> normalLane = new LinkedBlockingQueue<>();

    private final List<String> deadLetters = new CopyOnWriteArrayList<>();

    private final Map<String, ExpiringStatus> statuses = new ConcurrentHashMap<>();

    private volatile Instant nextSweepAt = Instant.MIN;

    @Autowired
    public InMemoryWorkQueue(TaskEnvelopeCodec codec, QueueConfig queueConfig) {
        this(codec, queueConfig, Clock.systemUTC());
    }

    public InMemoryWorkQueue(TaskEnvelopeCodec codec, QueueConfig queueConfig, Clock clock) {
        super(codec, queueConfig, clock);
    }

    @Override
    protected void pushNormal(String raw) {
        normalLane.add(raw);
    }

    @Override
    protected void pushPriority(String raw, double score) {
        priorityLane.put(new ScoredEntry(score, sequenceCounter.incrementAndGet(), raw));
    }

    @Override
    protected String popPriority() {
        ScoredEntry head = priorityLane.poll();
        return head != null ? head.raw() : null;
    }

    @Override
    protected String popNormal(Duration timeout) {
        try {
            return normalLane.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    @Override
    protected void pushDeadLetter(String raw) {
        deadLetters.add(raw);
    }

    @Override
    public void setStatus(String processingId, TaskState state, Map<String, Object> result) {
        Instant now = clock.instant();
        TaskStatus status = TaskStatus.builder()
                .processingId(processingId)
                .state(state)
                .result(result)
                .updatedAt(now)
                .build();
        statuses.put(processingId, new ExpiringStatus(status, now.plus(queueConfig.getStatusTtl())));
        if (!now.isBefore(nextSweepAt)) {
            sweepExpired(now);
        }
    }

    private void sweepExpired(Instant now) {
        nextSweepAt = now.plus(SWEEP_INTERVAL);
        int before = statuses.size();
        statuses.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        int removed = before - statuses.size();
        if (removed > 0) {
            log.debug("Swept {} expired task statuses", removed);
        }
    }

    @Override
    public Optional<TaskStatus> getStatus(String processingId) {
        ExpiringStatus entry = statuses.get(processingId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            statuses.remove(processingId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.status());
    }

    @Override
    public QueueDepth depth() {
        return new QueueDepth(normalLane.size(), priorityLane.size());
    }

    @Override
    public QueueHealth health() {
        return QueueHealth.builder()
                .normalQueueDepth(normalLane.size())
                .priorityQueueDepth(priorityLane.size())
                .backendConnected(true)
                .build();
    }

    @Override
    public void clear() {
        int cleared = normalLane.size() + priorityLane.size();
        normalLane.clear();
        priorityLane.clear();
        if (cleared > 0) {
            log.info("Work queue cleared: {} tasks removed", cleared);
        }
    }

    /** Status entries currently held, expired ones not yet swept included. */
    public int statusCount() {
        return statuses.size();
    }

    /** Payloads rejected at dequeue, oldest first. */
    public List<String> deadLetters() {
        return List.copyOf(deadLetters);
    }

    private static final class ScoredEntry {
        private final double score;
        private final long sequenceNumber;
        private final String raw;

        ScoredEntry(double score, long sequenceNumber, String raw) {
            this.score = score;
            this.sequenceNumber = sequenceNumber;
            this.raw = raw;
        }

        double score() {
            return score;
        }

        long sequenceNumber() {
            return sequenceNumber;
        }

        String raw() {
            return raw;
        }
    }

    private static final class ExpiringStatus {
        private final TaskStatus status;
        private final Instant expiresAt;

        ExpiringStatus(TaskStatus status, Instant expiresAt) {
            this.status = status;
            this.expiresAt = expiresAt;
        }

        TaskStatus status() {
            return status;
        }

        Instant expiresAt() {
            return expiresAt;
        }
    }
}
