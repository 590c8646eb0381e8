package com.opencalsync.sync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for feed syncs. Scheduled triggers and manual sync requests both submit here,
 * so concurrent fetches never exceed the max pool size. Submissions beyond the queue capacity are rejected;
 * the dispatcher leaves those connections for the next trigger.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor(
            @Value("${calendar-sync.executor.core-pool-size:4}") int corePoolSize,
            @Value("${calendar-sync.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${calendar-sync.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("calendar-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
