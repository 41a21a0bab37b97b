package com.tracechain.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class,
        ClockConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.BRIDGE_EXECUTOR)
    ThreadPoolTaskExecutor bridgeExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("substrate runtime cache is created and usable")
    void runtimeCacheCreatedAndUsed() {
        Cache cache = cacheManager.getCache(CaffeineConfig.SUBSTRATE_RUNTIME_CACHE);
        assertThat(cache).isNotNull();

        cache.put("http://node", "runtime");
        assertThat(cache.get("http://node").get()).isEqualTo("runtime");
    }

    @Test
    @DisplayName("bridge executor is created with its pool sizes")
    void bridgeExecutorConfigured() {
        assertThat(bridgeExecutor.getCorePoolSize()).isEqualTo(4);
        assertThat(bridgeExecutor.getMaxPoolSize()).isEqualTo(16);
        assertThat(bridgeExecutor.getThreadNamePrefix()).isEqualTo("bridge-");
    }

    @Test
    @DisplayName("scheduler pool is created and configured")
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }

    @Test
    void clockIsUtc() {
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
