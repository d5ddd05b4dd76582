package com.example.snapshotcache.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one refresh attempt.
 *
 * @param version       version committed by this attempt, {@code null} unless {@link RefreshStatus#SUCCESS}
 * @param recordCount   records committed, 0 unless successful
 * @param changed       whether the committed payload differs from the previous snapshot
 * @param errorDetail   failure description, {@code null} unless the attempt failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefreshOutcome(
        ResourceType resourceType,
        RefreshStatus status,
        Long version,
        int recordCount,
        boolean changed,
        String errorDetail,
        long durationMillis) {

    public static RefreshOutcome success(ResourceType type, long version, int recordCount,
                                         boolean changed, long durationMillis) {
        return new RefreshOutcome(type, RefreshStatus.SUCCESS, version, recordCount, changed, null, durationMillis);
    }

    public static RefreshOutcome alreadyInProgress(ResourceType type) {
        return new RefreshOutcome(type, RefreshStatus.ALREADY_IN_PROGRESS, null, 0, false, null, 0);
    }

    public static RefreshOutcome transientFailure(ResourceType type, String errorDetail, long durationMillis) {
        return new RefreshOutcome(type, RefreshStatus.TRANSIENT_FAILURE, null, 0, false, errorDetail, durationMillis);
    }

    public static RefreshOutcome permanentFailure(ResourceType type, String errorDetail, long durationMillis) {
        return new RefreshOutcome(type, RefreshStatus.PERMANENT_FAILURE, null, 0, false, errorDetail, durationMillis);
    }
}
