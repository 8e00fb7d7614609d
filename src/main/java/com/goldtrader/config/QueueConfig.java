package com.goldtrader.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the work queue and the execution worker loop.
 *
 * <p>Properties prefix: {@code goldtrader.queue.*}
 */
@Configuration
@ConfigurationProperties(prefix = "goldtrader.queue")
@Getter
@Setter
public class QueueConfig {

    /** Queue backend: {@code redis} for the shared server, {@code memory} for a single process. */
    private String backend = "redis";

    /** Prefix applied to every Redis key. The Redis server is shared. */
    private String keyPrefix = "goldtrader:";

    /** Base name of the queue; lane, status and dead-letter keys derive from it. */
    private String queueName = "trading_queue";

    /** How long a task status stays readable after its last write. */
    private Duration statusTtl = Duration.ofHours(1);

    /** Bounded wait of each dequeue attempt. */
    private Duration dequeueTimeout = Duration.ofSeconds(1);

    /** Pause after a pass over both lanes found nothing. */
    private Duration idleSleep = Duration.ofMillis(100);

    /** Pause after the loop itself hit an error, typically a backend outage. */
    private Duration errorBackoff = Duration.ofSeconds(1);

    /**
     * Seconds of queue time one priority level is worth in the priority lane score
     * ({@code priority * offset + queuedAt epoch seconds}, lowest first).
     */
    private double priorityScoreOffset = 1.0;
}
