package com.example.snapshotcache.store;

import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.model.Snapshot;
import com.example.snapshotcache.model.SnapshotMetadata;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Holds the current snapshot per resource type.
 * <p>
 * {@link #commit} replaces the whole snapshot in one step: a concurrent {@link #get}
 * returns either the previous snapshot or the new one, never a mix. Implementations
 * throw {@link com.example.snapshotcache.exception.StorageUnavailableException} when the
 * backing store cannot be reached.
 */
public interface SnapshotStore {

    Optional<Snapshot> get(ResourceType type);

    /**
     * Stores {@code records} as the current snapshot, stamped with the current time and
     * the next version (1 for the first commit).
     */
    Snapshot commit(ResourceType type, List<JsonNode> records, String sourceChecksum);

    Optional<SnapshotMetadata> freshnessOf(ResourceType type);
}
