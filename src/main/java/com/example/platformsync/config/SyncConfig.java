package com.example.platformsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class SyncConfig {

    @Bean
    @ConfigurationProperties(prefix = "app.sync")
    public SyncProperties syncProperties() {
        return new SyncProperties();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs at most one sync at a time: a single thread and no queue, so a busy runner rejects
     * instead of stacking up runs.
     */
    @Bean
    public ThreadPoolTaskExecutor syncRunExecutor(SyncProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("platform-sync-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownGraceSeconds());
        return executor;
    }

    /**
     * Per-object workers. The engine never has more than {@code workers} objects in flight.
     */
    @Bean
    public ThreadPoolTaskExecutor ingestionWorkerExecutor(SyncProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkers());
        executor.setMaxPoolSize(properties.getWorkers());
        executor.setQueueCapacity(properties.getWorkers());
        executor.setThreadNamePrefix("platform-sync-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownGraceSeconds());
        return executor;
    }
}
