package com.walletd.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.SYNC_EXECUTOR)
    Executor syncExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("fee estimate cache is created and usable")
    void feeEstimateCacheCreated() {
        assertThat(cacheManager.getCache(CaffeineConfig.FEE_ESTIMATE_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.FEE_ESTIMATE_CACHE).put("rate", 1.5);
        assertThat(cacheManager.getCache(CaffeineConfig.FEE_ESTIMATE_CACHE).get("rate").get()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("sync executor runs one cycle at a time")
    void syncExecutorIsSingleThreaded() {
        assertThat(syncExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor s = (ThreadPoolTaskExecutor) syncExecutor;
        assertThat(s.getCorePoolSize()).isEqualTo(1);
        assertThat(s.getMaxPoolSize()).isEqualTo(1);
        assertThat(s.getThreadNamePrefix()).isEqualTo("sync-");
    }

    @Test
    void schedulerPoolCreated() {
        assertThat(schedulerPool).isNotNull();
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(1);
    }
}
