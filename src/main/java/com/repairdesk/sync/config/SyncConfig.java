package com.repairdesk.sync.config;

import com.repairdesk.sync.service.subscription.ReconnectPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

@Slf4j
@Configuration
public class SyncConfig {

    @Bean
    @Qualifier("reconnectPolicy")
    public ReconnectPolicy reconnectPolicy(@Value("${app.sync.reconnect.initial-interval:1s}") Duration initial,
                                           @Value("${app.sync.reconnect.multiplier:2.0}") double multiplier,
                                           @Value("${app.sync.reconnect.jitter:0.3}") double jitter,
                                           @Value("${app.sync.reconnect.max-interval:30s}") Duration max) {
        log.info("Reconnect backoff: initial={}, multiplier={}, jitter={}, max={}", initial, multiplier, jitter, max);
        return ReconnectPolicy.exponential("reconnect", initial, multiplier, jitter, max, 0);
    }

    @Bean
    @Qualifier("resyncPolicy")
    public ReconnectPolicy resyncPolicy(@Value("${app.sync.resync.initial-interval:2s}") Duration initial,
                                        @Value("${app.sync.resync.multiplier:2.0}") double multiplier,
                                        @Value("${app.sync.resync.jitter:0.2}") double jitter,
                                        @Value("${app.sync.resync.max-interval:60s}") Duration max,
                                        @Value("${app.sync.resync.max-attempts:0}") int maxAttempts) {
        log.info("Resync backoff: initial={}, multiplier={}, max={}, max-attempts={}", initial, multiplier, max, maxAttempts);
        return ReconnectPolicy.exponential("resync", initial, multiplier, jitter, max, maxAttempts);
    }

    /**
     * Runs reconnect attempts, resync retries and SSE keep-alive pings.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler syncScheduler(@Value("${app.sync.scheduler-pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("sync-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Runs full fetches so a slow store never blocks a consumer loop.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor resyncExecutor(@Value("${app.sync.resync.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("sync-resync-");
        executor.initialize();
        return executor;
    }
}
