package com.findex.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AsyncConfig {

    @Bean(name = "exportExecutor")
    public Executor exportExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(Math.max(4, processors));
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("export-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "regionExecutor")
    public ThreadPoolTaskExecutor regionExecutor(ExportSettings exportSettings) {
        int parallelism = exportSettings.regionParallelism();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("region-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Runs the blocking SDK calls so a caller can stop waiting on deadline
     * expiry or cancellation.
     */
    @Bean(name = "awsCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService awsCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "aws-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
