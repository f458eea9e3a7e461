package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Last known state of one secret in one scope, as recorded at write time.
 */
@Embeddable
public class ScopeSyncState {

    @Column(name = "value_hash", length = 64)
    private String valueHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private SyncStatus status = SyncStatus.PENDING;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    public ScopeSyncState() {}

    public ScopeSyncState(String valueHash, SyncStatus status, Instant lastSyncedAt, String errorMessage) {
        this.valueHash = valueHash;
        this.status = status;
        this.lastSyncedAt = lastSyncedAt;
        this.errorMessage = errorMessage;
    }

    public String getValueHash() { return valueHash; }
    public void setValueHash(String valueHash) { this.valueHash = valueHash; }

    public SyncStatus getStatus() { return status; }
    public void setStatus(SyncStatus status) { this.status = status; }

    public Instant getLastSyncedAt() { return lastSyncedAt; }
    public void setLastSyncedAt(Instant lastSyncedAt) { this.lastSyncedAt = lastSyncedAt; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}
