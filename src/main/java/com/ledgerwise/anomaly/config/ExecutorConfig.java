package com.ledgerwise.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(DetectionThresholdConfig config) {
        return Executors.newFixedThreadPool(config.getExecutor().getDetectionThreads(),
                namedDaemonThreads("detector-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor(DetectionThresholdConfig config) {
        return Executors.newFixedThreadPool(config.getExecutor().getEnrichmentThreads(),
                namedDaemonThreads("enrichment-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
