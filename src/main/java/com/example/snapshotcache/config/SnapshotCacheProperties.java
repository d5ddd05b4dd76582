package com.example.snapshotcache.config;

import com.example.snapshotcache.model.ResourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * Cache, lease and scheduling settings.
 *
 * <pre>{@code
 * snapshot-cache:
 *   store: redis                # memory (default) | redis
 *   refresh-interval: 30m
 *   staleness-threshold: 30m
 *   lease:
 *     mode: redis
 *     ttl: 10m
 *   resources:
 *     todos:
 *       refresh-interval: 10m
 *       staleness-threshold: 15m
 * }</pre>
 */
@ConfigurationProperties(prefix = "snapshot-cache")
public record SnapshotCacheProperties(
        @DefaultValue("memory") Backend store,
        @DefaultValue("snapshot-cache") String keyPrefix,
        @DefaultValue("30m") Duration refreshInterval,
        @DefaultValue("30m") Duration stalenessThreshold,
        @DefaultValue Lease lease,
        @DefaultValue Scheduler scheduler,
        Map<ResourceType, ResourceSettings> resources) {

    public enum Backend { MEMORY, REDIS }

    public SnapshotCacheProperties {
        requirePositive(refreshInterval, "snapshot-cache.refresh-interval");
        requirePositive(stalenessThreshold, "snapshot-cache.staleness-threshold");
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("snapshot-cache.key-prefix must not be blank");
        }
        resources = resources == null ? Map.of() : Map.copyOf(resources);
    }

    public Duration refreshIntervalFor(ResourceType type) {
        ResourceSettings settings = resources.get(type);
        return settings != null && settings.refreshInterval() != null
                ? settings.refreshInterval()
                : refreshInterval;
    }

    public Duration stalenessThresholdFor(ResourceType type) {
        ResourceSettings settings = resources.get(type);
        return settings != null && settings.stalenessThreshold() != null
                ? settings.stalenessThreshold()
                : stalenessThreshold;
    }

    /** Per-type overrides; unset values fall back to the global ones. */
    public record ResourceSettings(Duration refreshInterval, Duration stalenessThreshold) {

        public ResourceSettings {
            if (refreshInterval != null) {
                requirePositive(refreshInterval, "refresh-interval");
            }
            if (stalenessThreshold != null) {
                requirePositive(stalenessThreshold, "staleness-threshold");
            }
        }
    }

    /**
     * @param ttl only applied by the Redis lease registry, where a crashed holder
     *            must not block refreshes forever
     */
    public record Lease(@DefaultValue("memory") Backend mode, @DefaultValue("10m") Duration ttl) {

        public Lease {
            requirePositive(ttl, "snapshot-cache.lease.ttl");
        }
    }

    public record Scheduler(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0s") Duration initialDelay,
            @DefaultValue("2") int poolSize,
            @DefaultValue("6") int workerPoolSize,
            @DefaultValue("60") int awaitTerminationSeconds) {

        public Scheduler {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("snapshot-cache.scheduler.initial-delay must not be negative");
            }
            if (poolSize <= 0) {
                throw new IllegalArgumentException(
                        "snapshot-cache.scheduler.pool-size must be positive, got: " + poolSize);
            }
            if (workerPoolSize <= 0) {
                throw new IllegalArgumentException(
                        "snapshot-cache.scheduler.worker-pool-size must be positive, got: " + workerPoolSize);
            }
            if (awaitTerminationSeconds <= 0) {
                throw new IllegalArgumentException("await-termination-seconds must be positive");
            }
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }
}
