package com.example.snapshotcache.exception;

import com.example.snapshotcache.model.ResourceType;

/** Authentication failures, unknown databases and missing configuration. */
public class PermanentFetchException extends UpstreamFetchException {

    public PermanentFetchException(ResourceType resourceType, String message) {
        super(resourceType, message, null);
    }

    public PermanentFetchException(ResourceType resourceType, String message, Throwable cause) {
        super(resourceType, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
