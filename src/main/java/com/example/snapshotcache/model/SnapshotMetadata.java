package com.example.snapshotcache.model;

import java.time.Instant;

/**
 * Freshness data of the current snapshot, readable without loading the records.
 */
public record SnapshotMetadata(
        ResourceType resourceType,
        Instant fetchedAt,
        long version,
        String sourceChecksum,
        int recordCount) {
}
