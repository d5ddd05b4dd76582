package com.example.snapshotcache.schedule;

import com.example.snapshotcache.config.SnapshotCacheProperties;
import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.refresh.RefreshCoordinator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Fires a refresh for every resource type on its fixed interval, starting once the
 * application is ready (after {@code initial-delay}, which defaults to zero so the cache
 * warms up at startup).
 * <p>
 * Types tick independently and each refresh runs on its own worker. A tick for a type
 * that is still refreshing collapses inside the coordinator; a tick finding no free
 * worker is dropped.
 */
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final TaskScheduler taskScheduler;
    private final TaskExecutor workerExecutor;
    private final RefreshCoordinator coordinator;
    private final SnapshotCacheProperties properties;
    private final Clock clock;
    private final List<ScheduledFuture<?>> ticks = new ArrayList<>();

    public RefreshScheduler(TaskScheduler taskScheduler, TaskExecutor workerExecutor, RefreshCoordinator coordinator,
                            SnapshotCacheProperties properties, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.workerExecutor = workerExecutor;
        this.coordinator = coordinator;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!ticks.isEmpty()) {
            return;
        }
        Instant firstTick = clock.instant().plus(properties.scheduler().initialDelay());
        for (ResourceType type : ResourceType.values()) {
            Duration interval = properties.refreshIntervalFor(type);
            ticks.add(taskScheduler.scheduleAtFixedRate(() -> trigger(type), firstTick, interval));
            log.info("Scheduled refresh of '{}' every {}", type.id(), interval);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        ticks.forEach(tick -> tick.cancel(false));
        ticks.clear();
    }

    /** Hands one refresh of {@code type} to a worker without waiting for it. */
    public void trigger(ResourceType type) {
        try {
            workerExecutor.execute(() -> runRefresh(type));
        } catch (TaskRejectedException e) {
            log.warn("No refresh worker free for '{}', dropping this tick", type.id());
        }
    }

    private void runRefresh(ResourceType type) {
        try {
            RefreshOutcome outcome = coordinator.refresh(type);
            log.debug("Scheduled refresh of '{}' finished: {}", type.id(), outcome.status());
        } catch (RuntimeException e) {
            log.error("Scheduled refresh of '{}' threw", type.id(), e);
        }
    }
}
