package com.example.snapshotcache.lease;

import com.example.snapshotcache.model.RefreshLease;
import com.example.snapshotcache.model.ResourceType;

import java.util.Optional;

public interface RefreshLeaseRegistry {

    /** Returns the new lease, or empty when another refresh of {@code type} holds one. */
    Optional<RefreshLease> tryAcquire(ResourceType type);

    /** Releases {@code lease} if it is still the one held; a lease taken over after expiry is left alone. */
    void release(RefreshLease lease);

    boolean isHeld(ResourceType type);
}
