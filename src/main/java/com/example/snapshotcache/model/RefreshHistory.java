package com.example.snapshotcache.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * What the last refresh attempts for one resource type did. Collapsed triggers
 * ({@link RefreshStatus#ALREADY_IN_PROGRESS}) are not attempts and do not appear here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefreshHistory(
        RefreshOutcome lastOutcome,
        Instant lastAttemptAt,
        Instant lastSuccessAt,
        int consecutiveFailures) {

    public RefreshHistory next(RefreshOutcome outcome, Instant attemptAt) {
        if (outcome.status() == RefreshStatus.SUCCESS) {
            return new RefreshHistory(outcome, attemptAt, attemptAt, 0);
        }
        return new RefreshHistory(outcome, attemptAt, lastSuccessAt, consecutiveFailures + 1);
    }

    public static RefreshHistory first(RefreshOutcome outcome, Instant attemptAt) {
        return new RefreshHistory(null, null, null, 0).next(outcome, attemptAt);
    }
}
