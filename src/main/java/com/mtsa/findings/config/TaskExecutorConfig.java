package com.mtsa.findings.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    @Bean("precomputeExecutor")
    public TaskExecutor precomputeExecutor(@Value("${app.executor.precompute.core-pool-size:4}") int corePoolSize,
                                           @Value("${app.executor.precompute.max-pool-size:4}") int maxPoolSize,
                                           @Value("${app.executor.precompute.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("Precompute-");
        executor.initialize();
        return executor;
    }

    /**
     * Small pool for usage events. Rejects when full so that lookups never block on analytics.
     */
    @Bean("usageRecorderExecutor")
    public TaskExecutor usageRecorderExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(1000);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("UsageRecorder-");
        executor.initialize();
        return executor;
    }
}
