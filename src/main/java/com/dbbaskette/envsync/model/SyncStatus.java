package com.dbbaskette.envsync.model;

public enum SyncStatus {
    PENDING,
    SYNCED,
    FAILED,
    CONFLICT
}
