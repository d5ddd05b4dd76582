package com.example.snapshotcache.fetch;

import com.example.snapshotcache.model.ResourceType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Retrieves the complete current state of one resource type from the upstream source.
 * Never touches the snapshot store.
 */
public interface UpstreamFetcher {

    /**
     * @return every record of {@code type}, in upstream order
     * @throws com.example.snapshotcache.exception.TransientFetchException when a later attempt may succeed
     * @throws com.example.snapshotcache.exception.PermanentFetchException when operator action is needed
     */
    List<JsonNode> fetchAll(ResourceType type);
}
