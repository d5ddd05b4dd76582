package com.example.snapshotcache.read;

import com.example.snapshotcache.config.SnapshotCacheProperties;
import com.example.snapshotcache.exception.SnapshotNotFoundException;
import com.example.snapshotcache.lease.InMemoryRefreshLeaseRegistry;
import com.example.snapshotcache.model.RefreshLease;
import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.refresh.RefreshHistoryRegistry;
import com.example.snapshotcache.store.InMemorySnapshotStore;
import com.example.snapshotcache.support.MutableClock;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.example.snapshotcache.support.Records.projects;
import static com.example.snapshotcache.support.Records.task;
import static com.example.snapshotcache.support.TestProperties.cacheProperties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotReadServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-10T09:00:00Z");

    private MutableClock clock;
    private InMemorySnapshotStore store;
    private InMemoryRefreshLeaseRegistry leaseRegistry;
    private RefreshHistoryRegistry history;
    private SnapshotReadService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemorySnapshotStore(clock);
        leaseRegistry = new InMemoryRefreshLeaseRegistry(clock);
        history = new RefreshHistoryRegistry();
        SnapshotCacheProperties properties = cacheProperties(Map.of(ResourceType.TODOS,
                new SnapshotCacheProperties.ResourceSettings(null, Duration.ofMinutes(5))));
        service = new SnapshotReadService(store, leaseRegistry, history, properties, clock);
    }

    @Test
    void shouldReportAbsentSnapshot() {
        assertThatThrownBy(() -> service.read(ResourceType.PROJECTS, SnapshotFilter.none()))
                .isInstanceOf(SnapshotNotFoundException.class)
                .hasMessageContaining("projects");
        assertThatThrownBy(() -> service.freshness(ResourceType.PROJECTS))
                .isInstanceOf(SnapshotNotFoundException.class);
    }

    @Test
    void shouldServeFreshSnapshot() {
        store.commit(ResourceType.PROJECTS, projects(12), "a");
        clock.advance(Duration.ofMinutes(10));

        SnapshotView view = service.read(ResourceType.PROJECTS, SnapshotFilter.none());

        assertThat(view.total()).isEqualTo(12);
        assertThat(view.version()).isEqualTo(1);
        assertThat(view.fetchedAt()).isEqualTo(T0);
        assertThat(view.stale()).isFalse();
    }

    @Test
    void shouldNotLetReaderChangeCommittedRecords() {
        store.commit(ResourceType.PROJECTS, projects(2), "a");

        SnapshotView first = service.read(ResourceType.PROJECTS, SnapshotFilter.none());
        ((ObjectNode) first.records().get(0)).put("status", "Archived");
        ((ObjectNode) first.records().get(1)).remove("name");

        SnapshotView second = service.read(ResourceType.PROJECTS, SnapshotFilter.none());
        assertThat(second.records().get(0).has("status")).isFalse();
        assertThat(second.records().get(1).path("name").asText()).isEqualTo("Project 2");
        assertThat(store.get(ResourceType.PROJECTS).orElseThrow().getRecords().get(0).has("status")).isFalse();
    }

    @Test
    void shouldFlagStaleSnapshotButStillServeIt() {
        store.commit(ResourceType.PROJECTS, projects(12), "a");
        clock.advance(Duration.ofMinutes(31));

        SnapshotView view = service.read(ResourceType.PROJECTS, null);

        assertThat(view.stale()).isTrue();
        assertThat(view.records()).hasSize(12);
    }

    @Test
    void shouldNotBeStaleExactlyAtThreshold() {
        store.commit(ResourceType.PROJECTS, projects(1), "a");
        clock.advance(Duration.ofMinutes(30));

        assertThat(service.freshness(ResourceType.PROJECTS).stale()).isFalse();
    }

    @Test
    void shouldApplyPerTypeThreshold() {
        store.commit(ResourceType.TODOS, projects(1), "a");
        clock.advance(Duration.ofMinutes(6));

        Freshness freshness = service.freshness(ResourceType.TODOS);

        assertThat(freshness.stale()).isTrue();
        assertThat(freshness.ageSeconds()).isEqualTo(360);
        assertThat(freshness.stalenessThresholdSeconds()).isEqualTo(300);
    }

    @Test
    void shouldClampAgeWhenClockIsBehindFetchTime() {
        store.commit(ResourceType.TASKS, projects(1), "a");
        clock.set(T0.minusSeconds(90));

        assertThat(service.freshness(ResourceType.TASKS).ageSeconds()).isZero();
    }

    @Test
    void shouldFilterRecordsUsingServiceClock() {
        store.commit(ResourceType.TASKS, List.of(
                task("t-1", "In progress", "2026-03-01", "Ada"),
                task("t-2", "Done", "2026-03-01", "Ada"),
                task("t-3", "In progress", "2026-03-20", "Ada")), "a");

        SnapshotView view = service.read(ResourceType.TASKS, new SnapshotFilter(null, null, null, null, true));

        assertThat(view.total()).isEqualTo(1);
        assertThat(view.records().get(0).path("id").asText()).isEqualTo("t-1");
    }

    @Test
    void shouldReportRefreshInProgress() {
        store.commit(ResourceType.TASKS, projects(1), "a");
        RefreshLease lease = leaseRegistry.tryAcquire(ResourceType.TASKS).orElseThrow();

        assertThat(service.freshness(ResourceType.TASKS).refreshing()).isTrue();
        leaseRegistry.release(lease);
        assertThat(service.freshness(ResourceType.TASKS).refreshing()).isFalse();
    }

    @Test
    void shouldSummarizeEveryType() {
        store.commit(ResourceType.PROJECTS, projects(12), "a");
        store.commit(ResourceType.TODOS, projects(2), "b");
        history.record(RefreshOutcome.transientFailure(ResourceType.TASKS, "timeout", 10), T0);
        clock.advance(Duration.ofMinutes(10));

        List<CacheStatus> overview = service.overview();

        assertThat(overview).extracting(CacheStatus::resourceType)
                .containsExactly(ResourceType.PROJECTS, ResourceType.TASKS, ResourceType.TODOS);
        assertThat(overview).extracting(CacheStatus::state)
                .containsExactly(CacheState.FRESH, CacheState.ABSENT, CacheState.STALE);
        assertThat(overview.get(0).recordCount()).isEqualTo(12);
        assertThat(overview.get(1).version()).isNull();
        assertThat(overview.get(1).lastRefresh().consecutiveFailures()).isEqualTo(1);
    }
}
