package com.example.ocppcentral.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for charge point receive loops, billing and call timeouts.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${app.ocpp.session-executor.core-pool-size:16}")
    private int sessionCorePoolSize;

    @Value("${app.ocpp.session-executor.max-pool-size:2000}")
    private int sessionMaxPoolSize;

    @Value("${app.billing.executor.core-pool-size:2}")
    private int billingCorePoolSize;

    @Value("${app.billing.executor.max-pool-size:4}")
    private int billingMaxPoolSize;

    @Value("${app.billing.executor.queue-capacity:500}")
    private int billingQueueCapacity;

    @Value("${app.ocpp.timeout-scheduler-threads:2}")
    private int timeoutSchedulerThreads;

    /**
     * One long-lived worker per connected charge point. No queue: when every
     * worker is taken the new connection is refused instead of waiting.
     */
    @Bean(name = "ocppSessionExecutor")
    public ThreadPoolTaskExecutor ocppSessionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sessionCorePoolSize);
        executor.setMaxPoolSize(sessionMaxPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("ocpp-session-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = "billingExecutor")
    public ThreadPoolTaskExecutor billingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(billingCorePoolSize);
        executor.setMaxPoolSize(billingMaxPoolSize);
        executor.setQueueCapacity(billingQueueCapacity);
        executor.setThreadNamePrefix("billing-");
        // a saturated pool bills on the caller thread rather than dropping the debit
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = "ocppCallTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService ocppCallTimeoutScheduler() {
        return Executors.newScheduledThreadPool(timeoutSchedulerThreads);
    }
}
