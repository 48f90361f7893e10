package com.fieldservice.scheduling.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SchedulingConfig {

    /** UTC; "now" for the past-date check on jobs. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool for per-contractor scoring. Workers block on distance lookups and
     * repository reads, so size it for I/O rather than CPU.
     */
    @Bean(name = "recommendationExecutor", destroyMethod = "shutdown")
    public ExecutorService recommendationExecutor(
            @Value("${scheduling.recommendation.worker-threads:16}") int workerThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "recommendation-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(workerThreads, threadFactory);
    }
}
