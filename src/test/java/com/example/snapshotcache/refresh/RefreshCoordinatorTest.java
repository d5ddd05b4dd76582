package com.example.snapshotcache.refresh;

import com.example.snapshotcache.exception.PermanentFetchException;
import com.example.snapshotcache.exception.StorageUnavailableException;
import com.example.snapshotcache.exception.TransientFetchException;
import com.example.snapshotcache.fetch.UpstreamFetcher;
import com.example.snapshotcache.model.RefreshHistory;
import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.RefreshStatus;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.model.Snapshot;
import com.example.snapshotcache.store.InMemorySnapshotStore;
import com.example.snapshotcache.store.SnapshotStore;
import com.example.snapshotcache.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.example.snapshotcache.support.Records.projects;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RefreshCoordinatorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Mock private UpstreamFetcher fetcher;

    private MutableClock clock;
    private InMemorySnapshotStore store;
    private RefreshHistoryRegistry history;
    private SimpleMeterRegistry meterRegistry;
    private RefreshCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemorySnapshotStore(clock);
        history = new RefreshHistoryRegistry();
        meterRegistry = new SimpleMeterRegistry();
        coordinator = new RefreshCoordinator(fetcher, store, new RefreshOutcomeRecorder(history, meterRegistry),
                new ObjectMapper(), clock);
    }

    private double outcomeCount(ResourceType type, String outcome) {
        Counter counter = meterRegistry.find("snapshot.refresh.outcomes")
                .tags("resource", type.id(), "outcome", outcome)
                .counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void shouldCommitFirstSnapshotAsVersionOne() {
        when(fetcher.fetchAll(ResourceType.PROJECTS)).thenReturn(projects(12));

        RefreshOutcome outcome = coordinator.refresh(ResourceType.PROJECTS);

        assertThat(outcome.status()).isEqualTo(RefreshStatus.SUCCESS);
        assertThat(outcome.version()).isEqualTo(1L);
        assertThat(outcome.recordCount()).isEqualTo(12);
        assertThat(outcome.changed()).isTrue();
        assertThat(store.get(ResourceType.PROJECTS)).hasValueSatisfying(snapshot -> {
            assertThat(snapshot.getRecords()).hasSize(12);
            assertThat(snapshot.getFetchedAt()).isEqualTo(T0);
            assertThat(snapshot.getSourceChecksum()).hasSize(64);
        });
        assertThat(outcomeCount(ResourceType.PROJECTS, "success")).isEqualTo(1);
    }

    @Test
    void shouldBumpVersionEvenWhenNothingChanged() {
        when(fetcher.fetchAll(ResourceType.PROJECTS)).thenReturn(projects(12));

        coordinator.refresh(ResourceType.PROJECTS);
        clock.advance(Duration.ofMinutes(30));
        RefreshOutcome second = coordinator.refresh(ResourceType.PROJECTS);

        assertThat(second.version()).isEqualTo(2L);
        assertThat(second.changed()).isFalse();
        assertThat(store.get(ResourceType.PROJECTS).map(Snapshot::getFetchedAt))
                .contains(T0.plus(Duration.ofMinutes(30)));
    }

    @Test
    void shouldKeepPreviousSnapshotOnTransientFailure() {
        when(fetcher.fetchAll(ResourceType.TASKS))
                .thenReturn(projects(5))
                .thenThrow(new TransientFetchException(ResourceType.TASKS, "upstream responded 503"));

        coordinator.refresh(ResourceType.TASKS);
        clock.advance(Duration.ofMinutes(30));
        RefreshOutcome outcome = coordinator.refresh(ResourceType.TASKS);

        assertThat(outcome.status()).isEqualTo(RefreshStatus.TRANSIENT_FAILURE);
        assertThat(outcome.errorDetail()).contains("503");
        assertThat(store.get(ResourceType.TASKS)).hasValueSatisfying(snapshot -> {
            assertThat(snapshot.getVersion()).isEqualTo(1);
            assertThat(snapshot.getRecords()).hasSize(5);
            assertThat(snapshot.getFetchedAt()).isEqualTo(T0);
        });
        assertThat(outcomeCount(ResourceType.TASKS, "transient_failure")).isEqualTo(1);
    }

    @Test
    void shouldReportPermanentFailureWithoutTouchingStore() {
        when(fetcher.fetchAll(ResourceType.TODOS))
                .thenThrow(new PermanentFetchException(ResourceType.TODOS, "upstream responded 401"));

        RefreshOutcome outcome = coordinator.refresh(ResourceType.TODOS);

        assertThat(outcome.status()).isEqualTo(RefreshStatus.PERMANENT_FAILURE);
        assertThat(outcome.version()).isNull();
        assertThat(store.get(ResourceType.TODOS)).isEmpty();
    }

    @Test
    void shouldTreatUnexpectedFetcherErrorAsTransient() {
        when(fetcher.fetchAll(ResourceType.TODOS)).thenThrow(new IllegalStateException("bug"));

        RefreshOutcome outcome = coordinator.refresh(ResourceType.TODOS);

        assertThat(outcome.status()).isEqualTo(RefreshStatus.TRANSIENT_FAILURE);
        assertThat(outcome.errorDetail()).contains("bug");
    }

    @Test
    void shouldReportTransientFailureWhenCommitDoesNotLand() {
        SnapshotStore unavailable = mock(SnapshotStore.class);
        when(unavailable.freshnessOf(ResourceType.PROJECTS)).thenReturn(Optional.empty());
        when(unavailable.commit(any(), anyList(), anyString()))
                .thenThrow(new StorageUnavailableException("Committing snapshot 'projects' failed", null));
        when(fetcher.fetchAll(ResourceType.PROJECTS)).thenReturn(projects(3));
        RefreshCoordinator withUnavailableStore = new RefreshCoordinator(
                fetcher, unavailable, new RefreshOutcomeRecorder(history, meterRegistry), new ObjectMapper(), clock);

        RefreshOutcome outcome = withUnavailableStore.refresh(ResourceType.PROJECTS);

        assertThat(outcome.status()).isEqualTo(RefreshStatus.TRANSIENT_FAILURE);
        assertThat(outcome.errorDetail()).contains("Committing snapshot");
    }

    @Test
    void shouldRecordHistoryOfAttempts() {
        when(fetcher.fetchAll(ResourceType.PROJECTS))
                .thenReturn(projects(2))
                .thenThrow(new TransientFetchException(ResourceType.PROJECTS, "timeout"));

        coordinator.refresh(ResourceType.PROJECTS);
        clock.advance(Duration.ofMinutes(30));
        coordinator.refresh(ResourceType.PROJECTS);

        RefreshHistory recorded = history.get(ResourceType.PROJECTS).orElseThrow();
        assertThat(recorded.lastSuccessAt()).isEqualTo(T0);
        assertThat(recorded.lastAttemptAt()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
        assertThat(recorded.consecutiveFailures()).isEqualTo(1);
        Timer duration = meterRegistry.find("snapshot.refresh.duration").tag("resource", "projects").timer();
        assertThat(duration).isNotNull();
        assertThat(duration.count()).isEqualTo(2);
    }

    @Test
    void shouldCommitEmptyResultAsSnapshot() {
        when(fetcher.fetchAll(ResourceType.TODOS)).thenReturn(projects(0));

        RefreshOutcome outcome = coordinator.refresh(ResourceType.TODOS);

        assertThat(outcome.status()).isEqualTo(RefreshStatus.SUCCESS);
        assertThat(outcome.recordCount()).isZero();
        assertThat(store.get(ResourceType.TODOS)).isPresent();
    }
}
