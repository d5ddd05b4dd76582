package com.example.snapshotcache.read;

public enum CacheState {
    FRESH,
    /** Older than the staleness threshold but still served. */
    STALE,
    /** Nothing committed yet. */
    ABSENT
}
