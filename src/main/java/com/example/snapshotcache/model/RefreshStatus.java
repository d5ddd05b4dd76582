package com.example.snapshotcache.model;

public enum RefreshStatus {
    SUCCESS,
    /** Another refresh for the same type holds the lease; the trigger was collapsed. */
    ALREADY_IN_PROGRESS,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE;

    public boolean isFailure() {
        return this == TRANSIENT_FAILURE || this == PERMANENT_FAILURE;
    }
}
