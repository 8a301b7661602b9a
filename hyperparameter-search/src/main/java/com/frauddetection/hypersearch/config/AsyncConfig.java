package com.frauddetection.hypersearch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for background search runs.
 * One thread per concurrently running search; extra starts are rejected rather than queued.
 */
@Configuration
public class AsyncConfig {

    @Value("${hypersearch.search.max-concurrent-searches:2}")
    private int maxConcurrentSearches;

    @Bean(name = "searchExecutorService", destroyMethod = "")
    public ExecutorService searchExecutorService() {
        AtomicInteger threadCounter = new AtomicInteger();
        return new ThreadPoolExecutor(maxConcurrentSearches, maxConcurrentSearches,
                0L, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("SearchRunner-" + threadCounter.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
