package com.example.snapshotcache.exception;

import com.example.snapshotcache.model.ResourceType;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SnapshotNotFoundException extends RuntimeException {

    private final ResourceType resourceType;

    public SnapshotNotFoundException(ResourceType resourceType) {
        super("No snapshot has been committed yet for resource type '" + resourceType.id() + "'");
        this.resourceType = resourceType;
    }

    public ResourceType getResourceType() { return resourceType; }
}
