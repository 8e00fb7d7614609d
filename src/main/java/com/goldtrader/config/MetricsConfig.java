package com.goldtrader.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application and the active queue backend, so dashboards can split
 * Redis-backed and in-memory deployments. Trading meters are defined in
 * {@link com.goldtrader.observability.TradingMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final String queueBackend;

    public MetricsConfig(
            MeterRegistry meterRegistry, @Value("${goldtrader.queue.backend:redis}") String queueBackend) {
        this.meterRegistry = meterRegistry;
        this.queueBackend = queueBackend;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "goldtrader", "queue.backend", queueBackend);
    }
}
