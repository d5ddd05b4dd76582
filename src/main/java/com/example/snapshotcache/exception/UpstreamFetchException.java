package com.example.snapshotcache.exception;

import com.example.snapshotcache.model.ResourceType;

/**
 * A full fetch of one resource type from the upstream API did not complete.
 * Partial results are discarded with the exception.
 */
public abstract class UpstreamFetchException extends RuntimeException {

    private final ResourceType resourceType;

    protected UpstreamFetchException(ResourceType resourceType, String message, Throwable cause) {
        super("Fetching '" + resourceType.id() + "' failed: " + message, cause);
        this.resourceType = resourceType;
    }

    public ResourceType getResourceType() { return resourceType; }

    /** Whether the next scheduled attempt can reasonably succeed without operator action. */
    public abstract boolean isTransient();
}
