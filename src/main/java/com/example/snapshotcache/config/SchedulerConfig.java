package com.example.snapshotcache.config;

import com.example.snapshotcache.refresh.RefreshCoordinator;
import com.example.snapshotcache.schedule.RefreshScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Collections;

/**
 * Two pools: the scheduler threads only fire ticks, the worker threads run the refreshes.
 * <p>
 * The worker pool has no queue. A tick arriving while every worker is busy is rejected
 * and dropped by {@link RefreshScheduler}, so missed ticks are never replayed later.
 *
 * <pre>{@code
 * snapshot-cache:
 *   scheduler:
 *     enabled: true
 *     initial-delay: 0s
 *     pool-size: 2
 *     worker-pool-size: 6
 * }</pre>
 */
@Configuration
@ConditionalOnProperty(prefix = "snapshot-cache.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public ThreadPoolTaskScheduler refreshTaskScheduler(SnapshotCacheProperties properties) {
        SnapshotCacheProperties.Scheduler settings = properties.scheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(settings.poolSize());
        scheduler.setThreadNamePrefix("refresh-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor refreshWorkerExecutor(SnapshotCacheProperties properties, MeterRegistry meterRegistry) {
        SnapshotCacheProperties.Scheduler settings = properties.scheduler();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.workerPoolSize());
        executor.setMaxPoolSize(settings.workerPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("refresh-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.awaitTerminationSeconds());
        executor.initialize();

        new ExecutorServiceMetrics(executor.getThreadPoolExecutor(), "snapshot.refresh.workers", Collections.emptyList())
                .bindTo(meterRegistry);

        log.info("[RefreshScheduler] Initialized with tickPoolSize={}, workerPoolSize={}",
                settings.poolSize(), settings.workerPoolSize());
        return executor;
    }

    @Bean
    public RefreshScheduler refreshScheduler(ThreadPoolTaskScheduler refreshTaskScheduler,
                                             ThreadPoolTaskExecutor refreshWorkerExecutor,
                                             RefreshCoordinator refreshCoordinator,
                                             SnapshotCacheProperties properties,
                                             Clock clock) {
        return new RefreshScheduler(refreshTaskScheduler, refreshWorkerExecutor, refreshCoordinator, properties, clock);
    }
}
