package com.dbbaskette.envsync.service.distribution;

public enum WriteStatus {
    WRITTEN,
    SKIPPED,
    FAILED,
    /** Dry run: the write would have happened. */
    PLANNED
}
