package com.dbbaskette.envsync.model;

public enum SyncEventStatus {
    SUCCESS,
    FAILURE,
    PARTIAL;

    /**
     * Derives the event status from per-scope counts so that a success never
     * carries failures and a failure never carries successes.
     */
    public static SyncEventStatus fromCounts(int successCount, int failureCount) {
        if (failureCount == 0) return SUCCESS;
        if (successCount == 0) return FAILURE;
        return PARTIAL;
    }
}
