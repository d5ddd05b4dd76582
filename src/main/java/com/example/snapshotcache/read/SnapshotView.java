package com.example.snapshotcache.read;

import com.example.snapshotcache.model.ResourceType;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Records of the current snapshot (after filtering) with the snapshot's freshness.
 */
public record SnapshotView(
        ResourceType resourceType,
        List<JsonNode> records,
        int total,
        Instant fetchedAt,
        long version,
        boolean stale) {
}
