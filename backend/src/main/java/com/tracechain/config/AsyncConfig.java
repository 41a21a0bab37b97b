package com.tracechain.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools. Each started bridge holds one bridge-executor thread for its whole run, so the pool has no
 * queue: starting more bridges than {@code maxPoolSize} is rejected instead of silently waiting.
 */
@Configuration
public class AsyncConfig {

    public static final String BRIDGE_EXECUTOR = "bridge-executor";

    @Bean(name = BRIDGE_EXECUTOR)
    public ThreadPoolTaskExecutor bridgeExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("bridge-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
