package com.example.snapshotcache.read;

import com.example.snapshotcache.model.ResourceType;

import java.time.Instant;

/**
 * @param stale      {@code ageSeconds} exceeds {@code stalenessThresholdSeconds}; stale data is still served
 * @param refreshing a refresh of this type currently holds the lease
 */
public record Freshness(
        ResourceType resourceType,
        Instant fetchedAt,
        long version,
        int recordCount,
        long ageSeconds,
        long stalenessThresholdSeconds,
        boolean stale,
        boolean refreshing) {
}
