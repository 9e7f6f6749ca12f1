package com.walletd.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named executors. Event-driven sync triggers run on sync-executor so publishers never wait for a cycle.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SYNC_EXECUTOR = "sync-executor";

    /** One thread: triggers queue up behind the running cycle instead of racing it. */
    @Bean(name = SYNC_EXECUTOR)
    public Executor syncExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(64);
        e.setThreadNamePrefix("sync-");
        e.initialize();
        return e;
    }
}
