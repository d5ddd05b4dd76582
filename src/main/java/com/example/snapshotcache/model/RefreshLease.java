package com.example.snapshotcache.model;

import java.time.Instant;

/**
 * Marker for a refresh in flight. Held by exactly one attempt per resource type.
 */
public record RefreshLease(ResourceType resourceType, String ownerToken, Instant startedAt) {
}
