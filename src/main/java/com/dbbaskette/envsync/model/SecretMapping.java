package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks one named secret of a project across the scopes it is distributed to.
 * Only the SHA-256 of the value is stored; rows are never deleted.
 */
@Entity
@Table(name = "secret_mappings", uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "secret_name"}))
public class SecretMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "secret_name", nullable = false, length = 100)
    private String secretName;

    @Column(name = "value_hash", nullable = false, length = 64)
    private String valueHash;

    @Column(name = "source_scope", nullable = false, length = 20)
    private String sourceScope = "dotenv";

    @Column(name = "is_excluded", nullable = false)
    private boolean excluded;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false)
    private SyncStatus syncStatus = SyncStatus.PENDING;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "secret_mapping_scopes", joinColumns = @JoinColumn(name = "mapping_id"))
    @MapKeyColumn(name = "scope", length = 40)
    private Map<String, ScopeSyncState> scopeStates = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    public SecretMapping() {}

    public SecretMapping(String projectId, String secretName, String valueHash) {
        this.projectId = projectId;
        this.secretName = secretName;
        this.valueHash = valueHash;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Scopes that currently hold a value written by this engine.
     */
    public List<String> getTargetScopes() {
        List<String> scopes = new ArrayList<>();
        scopeStates.forEach((scope, state) -> {
            if (state.getValueHash() != null) {
                scopes.add(scope);
            }
        });
        return scopes;
    }

    /**
     * Recomputes the mapping-level status from the per-scope states:
     * any conflict wins over any failure, which wins over synced.
     */
    public void recomputeStatus() {
        if (scopeStates.isEmpty()) {
            syncStatus = SyncStatus.PENDING;
            errorMessage = null;
            return;
        }
        boolean anyConflict = false;
        boolean anyFailed = false;
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, ScopeSyncState> entry : scopeStates.entrySet()) {
            SyncStatus status = entry.getValue().getStatus();
            if (status == SyncStatus.CONFLICT) anyConflict = true;
            if (status == SyncStatus.FAILED) {
                anyFailed = true;
                errors.add(entry.getKey() + ": " + entry.getValue().getErrorMessage());
            }
        }
        if (anyConflict) {
            syncStatus = SyncStatus.CONFLICT;
        } else if (anyFailed) {
            syncStatus = SyncStatus.FAILED;
        } else {
            syncStatus = SyncStatus.SYNCED;
        }
        errorMessage = errors.isEmpty() ? null : String.join("; ", errors);
    }

    // Getters and setters

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getSecretName() { return secretName; }
    public void setSecretName(String secretName) { this.secretName = secretName; }

    public String getValueHash() { return valueHash; }
    public void setValueHash(String valueHash) { this.valueHash = valueHash; }

    public String getSourceScope() { return sourceScope; }
    public void setSourceScope(String sourceScope) { this.sourceScope = sourceScope; }

    public boolean isExcluded() { return excluded; }
    public void setExcluded(boolean excluded) { this.excluded = excluded; }

    public Instant getLastSyncedAt() { return lastSyncedAt; }
    public void setLastSyncedAt(Instant lastSyncedAt) { this.lastSyncedAt = lastSyncedAt; }

    public SyncStatus getSyncStatus() { return syncStatus; }
    public void setSyncStatus(SyncStatus syncStatus) { this.syncStatus = syncStatus; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Map<String, ScopeSyncState> getScopeStates() { return scopeStates; }
    public void setScopeStates(Map<String, ScopeSyncState> scopeStates) { this.scopeStates = scopeStates; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
