package com.example.snapshotcache.lease;

import com.example.snapshotcache.model.RefreshLease;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRefreshLeaseRegistryTest {

    private InMemoryRefreshLeaseRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRefreshLeaseRegistry(new MutableClock(Instant.parse("2026-03-01T09:00:00Z")));
    }

    @Test
    void shouldGrantOneLeasePerType() {
        Optional<RefreshLease> first = registry.tryAcquire(ResourceType.PROJECTS);
        Optional<RefreshLease> second = registry.tryAcquire(ResourceType.PROJECTS);
        Optional<RefreshLease> otherType = registry.tryAcquire(ResourceType.TASKS);

        assertThat(first).isPresent();
        assertThat(first.get().startedAt()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
        assertThat(second).isEmpty();
        assertThat(otherType).isPresent();
        assertThat(registry.isHeld(ResourceType.PROJECTS)).isTrue();
        assertThat(registry.isHeld(ResourceType.TODOS)).isFalse();
    }

    @Test
    void shouldAllowReacquireAfterRelease() {
        RefreshLease lease = registry.tryAcquire(ResourceType.TODOS).orElseThrow();

        registry.release(lease);

        assertThat(registry.isHeld(ResourceType.TODOS)).isFalse();
        assertThat(registry.tryAcquire(ResourceType.TODOS)).isPresent();
    }

    @Test
    void shouldIgnoreReleaseOfLeaseNoLongerHeld() {
        RefreshLease stale = registry.tryAcquire(ResourceType.TODOS).orElseThrow();
        registry.release(stale);
        RefreshLease current = registry.tryAcquire(ResourceType.TODOS).orElseThrow();

        registry.release(stale);

        assertThat(registry.isHeld(ResourceType.TODOS)).isTrue();
        registry.release(current);
        assertThat(registry.isHeld(ResourceType.TODOS)).isFalse();
    }
}
