package com.example.snapshotcache.exception;

import com.example.snapshotcache.model.ResourceType;

/** Rate limiting, timeouts, 5xx responses and malformed pages. */
public class TransientFetchException extends UpstreamFetchException {

    public TransientFetchException(ResourceType resourceType, String message) {
        super(resourceType, message, null);
    }

    public TransientFetchException(ResourceType resourceType, String message, Throwable cause) {
        super(resourceType, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
