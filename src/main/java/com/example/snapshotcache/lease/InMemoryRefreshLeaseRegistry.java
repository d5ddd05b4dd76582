package com.example.snapshotcache.lease;

import com.example.snapshotcache.model.RefreshLease;
import com.example.snapshotcache.model.ResourceType;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Leases that live and die with the process. They never expire: a refresh always ends
 * (the upstream client has timeouts) and a crash takes its leases with it.
 */
public class InMemoryRefreshLeaseRegistry implements RefreshLeaseRegistry {

    private final ConcurrentMap<ResourceType, RefreshLease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRefreshLeaseRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<RefreshLease> tryAcquire(ResourceType type) {
        RefreshLease candidate = new RefreshLease(type, UUID.randomUUID().toString(), clock.instant());
        return leases.putIfAbsent(type, candidate) == null ? Optional.of(candidate) : Optional.empty();
    }

    @Override
    public void release(RefreshLease lease) {
        leases.remove(lease.resourceType(), lease);
    }

    @Override
    public boolean isHeld(ResourceType type) {
        return leases.containsKey(type);
    }
}
