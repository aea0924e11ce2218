package com.carhire.rental.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async pool for booking/payment notifications, plus scheduling for the
 * invoice overdue sweep.
 * - Core: 2 threads
 * - Max:  8 threads
 * - Queue: 200 tasks
 * - CallerRunsPolicy: if the queue is full the calling thread publishes
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String NOTIFICATION_EXECUTOR = "notificationTaskExecutor";

    @Bean(NOTIFICATION_EXECUTOR)
    public Executor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("notify-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
