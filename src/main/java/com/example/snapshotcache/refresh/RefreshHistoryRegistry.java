package com.example.snapshotcache.refresh;

import com.example.snapshotcache.model.RefreshHistory;
import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.RefreshStatus;
import com.example.snapshotcache.model.ResourceType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Last refresh attempt per resource type, kept in memory for operators.
 */
@Component
public class RefreshHistoryRegistry {

    private final ConcurrentMap<ResourceType, RefreshHistory> histories = new ConcurrentHashMap<>();

    public void record(RefreshOutcome outcome, Instant attemptAt) {
        if (outcome.status() == RefreshStatus.ALREADY_IN_PROGRESS) {
            return;
        }
        histories.compute(outcome.resourceType(), (type, previous) -> previous == null
                ? RefreshHistory.first(outcome, attemptAt)
                : previous.next(outcome, attemptAt));
    }

    public Optional<RefreshHistory> get(ResourceType type) {
        return Optional.ofNullable(histories.get(type));
    }
}
