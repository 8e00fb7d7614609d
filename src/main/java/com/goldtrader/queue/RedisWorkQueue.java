package com.goldtrader.queue;

import com.goldtrader.config.QueueConfig;
import com.goldtrader.domain.enums.TaskState;
import com.goldtrader.domain.model.QueueDepth;
import com.goldtrader.domain.model.QueueHealth;
import com.goldtrader.domain.model.TaskStatus;
import com.goldtrader.exception.QueueUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;

/**
 * {@link WorkQueue} on a shared Redis server. The normal lane is a list (LPUSH, BRPOP), the
 * priority lane a sorted set (ZADD, ZPOPMIN) and each status a string with an expiry (SET EX).
 * See {@link QueueKeys} for the key layout.
 */
@Component
@ConditionalOnProperty(prefix = "goldtrader.queue", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisWorkQueue extends AbstractWorkQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisWorkQueue.class);

    private final StringRedisTemplate redisTemplate;
    private final QueueKeys keys;

    @Autowired
    public RedisWorkQueue(StringRedisTemplate redisTemplate, TaskEnvelopeCodec codec, QueueConfig queueConfig) {
        this(redisTemplate, codec, queueConfig, Clock.systemUTC());
    }

    public RedisWorkQueue(
            StringRedisTemplate redisTemplate, TaskEnvelopeCodec codec, QueueConfig queueConfig, Clock clock) {
        super(codec, queueConfig, clock);
        this.redisTemplate = redisTemplate;
        this.keys = new QueueKeys(queueConfig.getKeyPrefix(), queueConfig.getQueueName());
    }

    @Override
    protected void pushNormal(String raw) {
        try {
            redisTemplate.opsForList().leftPush(keys.normalLane(), raw);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to enqueue task", e);
        }
    }

    @Override
    protected void pushPriority(String raw, double score) {
        try {
            redisTemplate.opsForZSet().add(keys.priorityLane(), raw, score);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to enqueue priority task", e);
        }
    }

    @Override
    protected String popPriority() {
        try {
            ZSetOperations.TypedTuple<String> head = redisTemplate.opsForZSet().popMin(keys.priorityLane());
            return head != null ? head.getValue() : null;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to dequeue from priority lane", e);
        }
    }

    @Override
    protected String popNormal(Duration timeout) {
        try {
            return redisTemplate.opsForList().rightPop(keys.normalLane(), timeout);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to dequeue from normal lane", e);
        }
    }

    @Override
    protected void pushDeadLetter(String raw) {
        try {
            redisTemplate.opsForList().leftPush(keys.deadLetter(), raw);
        } catch (DataAccessException e) {
            log.error("Failed to dead-letter rejected task payload", e);
        }
    }

    @Override
    public void setStatus(String processingId, TaskState state, Map<String, Object> result) {
        TaskStatus status = TaskStatus.builder()
                .processingId(processingId)
                .state(state)
                .result(result)
                .updatedAt(clock.instant())
                .build();
        try {
            redisTemplate
                    .opsForValue()
                    .set(keys.status(processingId), codec.encodeStatus(status), queueConfig.getStatusTtl());
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to write status for task " + processingId, e);
        }
    }

    @Override
    public Optional<TaskStatus> getStatus(String processingId) {
        String raw;
        try {
            raw = redisTemplate.opsForValue().get(keys.status(processingId));
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to read status for task " + processingId, e);
        }
        return raw == null ? Optional.empty() : Optional.of(codec.decodeStatus(raw));
    }

    @Override
    public QueueDepth depth() {
        try {
            Long normal = redisTemplate.opsForList().size(keys.normalLane());
            Long priority = redisTemplate.opsForZSet().zCard(keys.priorityLane());
            return new QueueDepth(normal != null ? normal : 0, priority != null ? priority : 0);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to read queue depth", e);
        }
    }

    @Override
    public QueueHealth health() {
        boolean connected = ping();
        QueueDepth depth = connected ? depth() : new QueueDepth(0, 0);
        return QueueHealth.builder()
                .normalQueueDepth(depth.getNormalCount())
                .priorityQueueDepth(depth.getPriorityCount())
                .backendConnected(connected)
                .build();
    }

    @Override
    public void clear() {
        try {
            Long removed = redisTemplate.delete(List.of(keys.normalLane(), keys.priorityLane()));
            log.info("Work queue cleared: {} lane keys removed", removed);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to clear work queue", e);
        }
    }

    private boolean ping() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
