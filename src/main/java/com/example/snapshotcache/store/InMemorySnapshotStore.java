package com.example.snapshotcache.store;

import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.model.Snapshot;
import com.example.snapshotcache.model.SnapshotMetadata;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local store: one atomically swapped reference per resource type.
 * Contents are lost on restart, so versions start again at 1.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    // Populated once in the constructor and never structurally modified afterwards.
    private final Map<ResourceType, AtomicReference<Snapshot>> current = new EnumMap<>(ResourceType.class);
    private final Clock clock;

    public InMemorySnapshotStore(Clock clock) {
        this.clock = clock;
        for (ResourceType type : ResourceType.values()) {
            current.put(type, new AtomicReference<>());
        }
    }

    @Override
    public Optional<Snapshot> get(ResourceType type) {
        return Optional.ofNullable(current.get(type).get());
    }

    @Override
    public Snapshot commit(ResourceType type, List<JsonNode> records, String sourceChecksum) {
        return current.get(type).updateAndGet(previous -> new Snapshot(
                type,
                records,
                clock.instant(),
                previous == null ? 1 : previous.getVersion() + 1,
                sourceChecksum));
    }

    @Override
    public Optional<SnapshotMetadata> freshnessOf(ResourceType type) {
        return get(type).map(Snapshot::metadata);
    }
}
