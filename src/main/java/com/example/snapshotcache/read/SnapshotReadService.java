package com.example.snapshotcache.read;

import com.example.snapshotcache.config.SnapshotCacheProperties;
import com.example.snapshotcache.exception.SnapshotNotFoundException;
import com.example.snapshotcache.lease.RefreshLeaseRegistry;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.model.Snapshot;
import com.example.snapshotcache.model.SnapshotMetadata;
import com.example.snapshotcache.refresh.RefreshHistoryRegistry;
import com.example.snapshotcache.store.SnapshotStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Answers cache queries from the last committed snapshot. Never calls upstream and
 * never waits for a refresh in progress.
 */
@Service
public class SnapshotReadService {

    private final SnapshotStore store;
    private final RefreshLeaseRegistry leaseRegistry;
    private final RefreshHistoryRegistry history;
    private final SnapshotCacheProperties properties;
    private final Clock clock;

    public SnapshotReadService(SnapshotStore store, RefreshLeaseRegistry leaseRegistry, RefreshHistoryRegistry history,
                               SnapshotCacheProperties properties, Clock clock) {
        this.store = store;
        this.leaseRegistry = leaseRegistry;
        this.history = history;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws SnapshotNotFoundException when no refresh of {@code type} has succeeded yet
     */
    public SnapshotView read(ResourceType type, SnapshotFilter filter) {
        Snapshot snapshot = store.get(type).orElseThrow(() -> new SnapshotNotFoundException(type));

        List<JsonNode> records = snapshot.getRecords();
        if (filter != null && !filter.isEmpty()) {
            LocalDate today = LocalDate.now(clock);
            records = records.stream().filter(record -> filter.matches(record, today)).toList();
        }
        return new SnapshotView(type, records, records.size(), snapshot.getFetchedAt(), snapshot.getVersion(),
                isStale(type, snapshot.getFetchedAt()));
    }

    /**
     * @throws SnapshotNotFoundException when no refresh of {@code type} has succeeded yet
     */
    public Freshness freshness(ResourceType type) {
        SnapshotMetadata metadata = store.freshnessOf(type).orElseThrow(() -> new SnapshotNotFoundException(type));
        Duration threshold = properties.stalenessThresholdFor(type);
        Duration age = age(metadata.fetchedAt());
        return new Freshness(
                type,
                metadata.fetchedAt(),
                metadata.version(),
                metadata.recordCount(),
                age.getSeconds(),
                threshold.getSeconds(),
                age.compareTo(threshold) > 0,
                leaseRegistry.isHeld(type));
    }

    public List<CacheStatus> overview() {
        List<CacheStatus> statuses = new ArrayList<>();
        for (ResourceType type : ResourceType.values()) {
            Optional<SnapshotMetadata> metadata = store.freshnessOf(type);
            CacheState state = metadata
                    .map(m -> isStale(type, m.fetchedAt()) ? CacheState.STALE : CacheState.FRESH)
                    .orElse(CacheState.ABSENT);
            statuses.add(new CacheStatus(
                    type,
                    state,
                    metadata.map(SnapshotMetadata::version).orElse(null),
                    metadata.map(SnapshotMetadata::fetchedAt).orElse(null),
                    metadata.map(SnapshotMetadata::recordCount).orElse(null),
                    leaseRegistry.isHeld(type),
                    history.get(type).orElse(null)));
        }
        return statuses;
    }

    private boolean isStale(ResourceType type, Instant fetchedAt) {
        return age(fetchedAt).compareTo(properties.stalenessThresholdFor(type)) > 0;
    }

    private Duration age(Instant fetchedAt) {
        Duration age = Duration.between(fetchedAt, clock.instant());
        return age.isNegative() ? Duration.ZERO : age;
    }
}
