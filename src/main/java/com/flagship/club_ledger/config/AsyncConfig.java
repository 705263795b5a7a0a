package com.flagship.club_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for fire-and-forget receipt dispatch.
 *
 * Receipt work never runs on the webhook request thread, so a slow or failing
 * notification path cannot hold up or fail a ledger mutation.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    public static final String RECEIPT_EXECUTOR = "receiptExecutor";

    @Bean(name = RECEIPT_EXECUTOR)
    public Executor receiptExecutor(@Value("${notification.executor.pool-size:2}") int poolSize,
                                    @Value("${notification.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("receipt-");
        // Full queue: drop and log, never block the caller
        executor.setRejectedExecutionHandler((task, pool) ->
                log.error("Receipt executor saturated (queue={}), dropping receipt dispatch", queueCapacity));
        executor.initialize();
        return executor;
    }
}
