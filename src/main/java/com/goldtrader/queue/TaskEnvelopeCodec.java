package com.goldtrader.queue;

import com.goldtrader.domain.model.TaskStatus;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON codec for queue entries and task statuses.
 *
 * <p>{@link #decode} is the single gate between the queue backend and the worker: a payload that
 * comes back from it is a complete current-version envelope with positive amount and price.
 */
@Component
public class TaskEnvelopeCodec {

    private static final Logger log = LoggerFactory.getLogger(TaskEnvelopeCodec.class);

    private final ObjectMapper objectMapper;

    public TaskEnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ExecutionTask task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JacksonException e) {
            log.error("Failed to serialize task {}", task.getProcessingId(), e);
            throw new IllegalStateException("Task serialization failed", e);
        }
    }

    /**
     * Decodes and validates a raw queue entry.
     *
     * @throws MalformedTaskException if the entry is unreadable, stale or incomplete
     */
    public ExecutionTask decode(String raw) {
        ExecutionTask task;
        try {
            task = objectMapper.readValue(raw, ExecutionTask.class);
        } catch (JacksonException e) {
            throw new MalformedTaskException("Unreadable task payload: " + e.getMessage(), e);
        }
        if (task == null) {
            throw new MalformedTaskException("Empty task payload", (String) null);
        }
        validate(task);
        return task;
    }

    public String encodeStatus(TaskStatus status) {
        try {
            return objectMapper.writeValueAsString(status);
        } catch (JacksonException e) {
            log.error("Failed to serialize status for {}", status.getProcessingId(), e);
            throw new IllegalStateException("Task status serialization failed", e);
        }
    }

    public TaskStatus decodeStatus(String raw) {
        try {
            return objectMapper.readValue(raw, TaskStatus.class);
        } catch (JacksonException e) {
            log.error("Failed to deserialize task status: {}", raw, e);
            throw new IllegalStateException("Task status deserialization failed", e);
        }
    }

    private void validate(ExecutionTask task) {
        String processingId = task.getProcessingId();
        if (task.getVersion() != ExecutionTask.CURRENT_VERSION) {
            throw new MalformedTaskException(
                    "Unsupported task version " + task.getVersion() + ", expected " + ExecutionTask.CURRENT_VERSION,
                    processingId);
        }
        if (processingId == null || processingId.isBlank()) {
            throw new MalformedTaskException("Task has no processingId", (String) null);
        }
        OrderExecutionRequest payload = task.getPayload();
        if (payload == null) {
            throw new MalformedTaskException("Task has no payload", processingId);
        }
        requireField(payload.getTransactionId(), "transactionId", processingId);
        requireField(payload.getUserId(), "userId", processingId);
        requireField(payload.getSymbol(), "symbol", processingId);
        requireField(payload.getSide(), "side", processingId);
        requirePositive(payload.getRequestedAmount(), "requestedAmount", processingId);
        requirePositive(payload.getQuotedPricePerUnit(), "quotedPricePerUnit", processingId);
    }

    private static void requireField(Object value, String field, String processingId) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new MalformedTaskException("Task payload is missing " + field, processingId);
        }
    }

    private static void requirePositive(BigDecimal value, String field, String processingId) {
        if (value == null || value.signum() <= 0) {
            throw new MalformedTaskException("Task payload has non-positive " + field, processingId);
        }
    }
}
