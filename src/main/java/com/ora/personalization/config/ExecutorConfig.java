package com.ora.personalization.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    @Value("${personalization.executor.ranking.queue-capacity:256}")
    private int rankingQueueCapacity;

    @Value("${personalization.executor.io.size:8}")
    private int ioPoolSize;

    @Value("${personalization.executor.io.queue-capacity:512}")
    private int ioQueueCapacity;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * CPU pool for per-post scoring. Rejected chunks run on the caller thread, so a
     * saturated pool slows a request down instead of failing it.
     */
    @Bean(name = "rankingExecutor", destroyMethod = "shutdown")
    public ExecutorService rankingExecutor() {
        int nThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        return new ThreadPoolExecutor(
                nThreads,
                nThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(rankingQueueCapacity),
                named("ranking-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean(name = "personalizationIoExecutor", destroyMethod = "shutdown")
    public ExecutorService personalizationIoExecutor() {
        return new ThreadPoolExecutor(
                ioPoolSize,
                ioPoolSize,
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(ioQueueCapacity),
                named("personalization-io-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
