package com.example.snapshotcache.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The complete cached payload for one {@link ResourceType}.
 * <p>
 * Instances are never mutated after construction; a refresh produces a new
 * instance that replaces the previous one as a whole. Records are deep-copied
 * on the way in and on the way out, so neither the fetcher nor a reader can
 * alter a committed snapshot.
 */
public final class Snapshot {

    private final ResourceType resourceType;
    private final List<JsonNode> records;
    private final Instant fetchedAt;
    private final long version;
    private final String sourceChecksum;

    public Snapshot(ResourceType resourceType, List<JsonNode> records, Instant fetchedAt,
                    long version, String sourceChecksum) {
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
        this.records = copyOf(records);
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt");
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive, got: " + version);
        }
        this.version = version;
        this.sourceChecksum = sourceChecksum;
    }

    public ResourceType getResourceType() { return resourceType; }
    /** Returns a private copy; changing it leaves the snapshot untouched. */
    public List<JsonNode> getRecords() { return copyOf(records); }
    public int getRecordCount() { return records.size(); }
    public Instant getFetchedAt() { return fetchedAt; }
    public long getVersion() { return version; }
    public String getSourceChecksum() { return sourceChecksum; }

    public SnapshotMetadata metadata() {
        return new SnapshotMetadata(resourceType, fetchedAt, version, sourceChecksum, records.size());
    }

    private static List<JsonNode> copyOf(List<JsonNode> records) {
        return records.stream().<JsonNode>map(JsonNode::deepCopy).toList();
    }
}
