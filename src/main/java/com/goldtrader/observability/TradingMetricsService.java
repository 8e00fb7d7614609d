package com.goldtrader.observability;

import com.goldtrader.event.TransactionEvent;
import com.goldtrader.event.TransactionEventType;
import com.goldtrader.oms.ExecutionWorker;
import com.goldtrader.queue.WorkQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the order pipeline.
 *
 * <ul>
 *   <li><b>transactions.count</b> (counter, tag {@code type}): one per {@link TransactionEvent}</li>
 *   <li><b>queue.depth</b> (gauge, tag {@code lane}): tasks waiting in each lane</li>
 *   <li><b>worker.running</b> (gauge 0/1): whether the execution worker loop is up</li>
 * </ul>
 *
 * <p>Gauges are evaluated on scrape. A queue backend that cannot answer reports NaN.
 */
@Service
public class TradingMetricsService {

    private static final Logger log = LoggerFactory.getLogger(TradingMetricsService.class);

    private final Map<TransactionEventType, Counter> transactionCounters = new EnumMap<>(TransactionEventType.class);

    public TradingMetricsService(MeterRegistry meterRegistry, WorkQueue workQueue, ExecutionWorker executionWorker) {
        for (TransactionEventType type : TransactionEventType.values()) {
            transactionCounters.put(
                    type,
                    Counter.builder("transactions.count")
                            .description("Transactions by lifecycle event")
                            .tag("type", type.name().toLowerCase())
                            .register(meterRegistry));
        }

        registerDepthGauge(meterRegistry, workQueue, "normal", queue -> queue.depth().getNormalCount());
        registerDepthGauge(meterRegistry, workQueue, "priority", queue -> queue.depth().getPriorityCount());

        meterRegistry.gauge("worker.running", executionWorker, worker -> worker.isRunning() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onTransactionEvent(TransactionEvent event) {
        transactionCounters.get(event.getEventType()).increment();
    }

    private static void registerDepthGauge(
            MeterRegistry meterRegistry, WorkQueue workQueue, String lane, ToLongFunction<WorkQueue> depth) {
        Gauge.builder("queue.depth", workQueue, queue -> {
                    try {
                        return depth.applyAsLong(queue);
                    } catch (RuntimeException e) {
                        log.debug("Queue depth unavailable for {} lane: {}", lane, e.getMessage());
                        return Double.NaN;
                    }
                })
                .description("Tasks waiting in the work queue")
                .tag("lane", lane)
                .register(meterRegistry);
    }
}
