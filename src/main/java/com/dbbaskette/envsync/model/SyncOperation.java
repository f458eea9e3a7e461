package com.dbbaskette.envsync.model;

public enum SyncOperation {
    CREATE,
    UPDATE,
    DELETE,
    SYNC_ALL,
    VALIDATE
}
