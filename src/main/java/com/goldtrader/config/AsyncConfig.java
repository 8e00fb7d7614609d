package com.goldtrader.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    @Value("${goldtrader.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${goldtrader.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${goldtrader.async.queue-capacity:100}")
    private int queueCapacity;

    /** Runs price oracle lookups so callers can bound their wait. */
    @Bean("priceLookupExecutor")
    public ThreadPoolTaskExecutor priceLookupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("price-lookup-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
