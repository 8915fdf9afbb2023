package com.ledgermatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for asynchronous dedup runs. One run occupies one thread; its verifier batches run
 * sequentially on that thread.
 */
@Configuration
public class AsyncConfig {

    public static final String DEDUP_EXECUTOR = "dedup-executor";

    @Bean(name = DEDUP_EXECUTOR)
    public Executor dedupExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("dedup-");
        e.initialize();
        return e;
    }
}
