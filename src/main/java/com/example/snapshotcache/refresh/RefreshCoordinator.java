package com.example.snapshotcache.refresh;

import com.example.snapshotcache.annotation.LeasedRefresh;
import com.example.snapshotcache.exception.StorageUnavailableException;
import com.example.snapshotcache.exception.UpstreamFetchException;
import com.example.snapshotcache.fetch.UpstreamFetcher;
import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.model.Snapshot;
import com.example.snapshotcache.model.SnapshotMetadata;
import com.example.snapshotcache.store.SnapshotStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one refresh attempt: fetch everything, then swap it in as the new snapshot.
 * <p>
 * The lease is taken by {@link com.example.snapshotcache.aspect.RefreshLeaseAspect}
 * around {@link #refresh}, so this class keeps no state between attempts. There is
 * no retry here; the next scheduler tick is the retry.
 */
@Service
public class RefreshCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RefreshCoordinator.class);

    private final UpstreamFetcher fetcher;
    private final SnapshotStore store;
    private final RefreshOutcomeRecorder recorder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RefreshCoordinator(UpstreamFetcher fetcher, SnapshotStore store, RefreshOutcomeRecorder recorder,
                              ObjectMapper objectMapper, Clock clock) {
        this.fetcher = fetcher;
        this.store = store;
        this.recorder = recorder;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @LeasedRefresh
    public RefreshOutcome refresh(ResourceType type) {
        Instant attemptAt = clock.instant();
        long startNanos = System.nanoTime();

        RefreshOutcome outcome = attempt(type, startNanos);

        recorder.record(outcome, attemptAt);
        return outcome;
    }

    private RefreshOutcome attempt(ResourceType type, long startNanos) {
        List<JsonNode> records;
        try {
            records = fetcher.fetchAll(type);
        } catch (UpstreamFetchException e) {
            if (e.isTransient()) {
                log.warn("Refresh of '{}' failed, retrying on next tick: {}", type.id(), e.getMessage());
                return RefreshOutcome.transientFailure(type, e.getMessage(), elapsedMillis(startNanos));
            }
            log.error("Refresh of '{}' failed permanently, check configuration; retrying on next tick: {}",
                    type.id(), e.getMessage());
            return RefreshOutcome.permanentFailure(type, e.getMessage(), elapsedMillis(startNanos));
        } catch (RuntimeException e) {
            log.error("Refresh of '{}' failed unexpectedly while fetching", type.id(), e);
            return RefreshOutcome.transientFailure(type, e.toString(), elapsedMillis(startNanos));
        }

        String checksum = SnapshotChecksum.of(records, objectMapper);
        Snapshot committed;
        boolean changed;
        try {
            String previousChecksum = store.freshnessOf(type).map(SnapshotMetadata::sourceChecksum).orElse(null);
            committed = store.commit(type, records, checksum);
            changed = !Objects.equals(previousChecksum, checksum);
        } catch (StorageUnavailableException e) {
            log.warn("Refresh of '{}' fetched {} records but the commit did not land, previous snapshot stays current: {}",
                    type.id(), records.size(), e.getMessage());
            return RefreshOutcome.transientFailure(type, e.getMessage(), elapsedMillis(startNanos));
        }

        long durationMillis = elapsedMillis(startNanos);
        log.info("Refreshed '{}': {} records, version {}{}, {} ms",
                type.id(), records.size(), committed.getVersion(), changed ? "" : " (unchanged)", durationMillis);
        return RefreshOutcome.success(type, committed.getVersion(), records.size(), changed, durationMillis);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
