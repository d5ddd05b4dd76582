package com.example.snapshotcache.read;

import com.example.snapshotcache.model.RefreshHistory;
import com.example.snapshotcache.model.ResourceType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStatus(
        ResourceType resourceType,
        CacheState state,
        Long version,
        Instant fetchedAt,
        Integer recordCount,
        boolean refreshing,
        RefreshHistory lastRefresh) {
}
