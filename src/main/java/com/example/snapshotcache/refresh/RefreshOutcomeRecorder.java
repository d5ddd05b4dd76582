package com.example.snapshotcache.refresh;

import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.RefreshStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Publishes refresh attempts to the history and to the {@code snapshot.refresh.*} meters.
 * Collapsed triggers are not attempts and are ignored.
 */
@Component
public class RefreshOutcomeRecorder {

    private final RefreshHistoryRegistry history;
    private final MeterRegistry meterRegistry;

    public RefreshOutcomeRecorder(RefreshHistoryRegistry history, MeterRegistry meterRegistry) {
        this.history = history;
        this.meterRegistry = meterRegistry;
    }

    public void record(RefreshOutcome outcome, Instant attemptAt) {
        if (outcome.status() == RefreshStatus.ALREADY_IN_PROGRESS) {
            return;
        }
        String resource = outcome.resourceType().id();
        history.record(outcome, attemptAt);
        meterRegistry.counter("snapshot.refresh.outcomes",
                        "resource", resource,
                        "outcome", outcome.status().name().toLowerCase(Locale.ROOT))
                .increment();
        meterRegistry.timer("snapshot.refresh.duration", "resource", resource)
                .record(outcome.durationMillis(), TimeUnit.MILLISECONDS);
    }
}
