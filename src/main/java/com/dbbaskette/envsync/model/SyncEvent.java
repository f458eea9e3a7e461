package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only audit fact. One row per operation, never updated.
 */
@Entity
@Immutable
@Table(name = "sync_events", indexes = {
        @Index(name = "idx_sync_events_project", columnList = "project_id, created_at"),
        @Index(name = "idx_sync_events_correlation", columnList = "correlation_id"),
        @Index(name = "idx_sync_events_partition", columnList = "partition_month")
})
public class SyncEvent {

    private static final DateTimeFormatter PARTITION_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "actor_id", nullable = false, length = 100)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncOperation operation;

    @Column(name = "secret_name", length = 100)
    private String secretName;

    @Convert(converter = JsonColumnConverters.StringListConverter.class)
    @Column(name = "affected_scopes", length = 2000)
    private List<String> affectedScopes = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncEventStatus status;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "correlation_id", nullable = false, length = 64)
    private String correlationId;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Lob
    @Column
    private String metadata;

    @Column(name = "partition_month", nullable = false, length = 7)
    private String partitionMonth;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    public SyncEvent() {}

    public SyncEvent(String projectId, String actorId, SyncOperation operation, String correlationId, Instant createdAt) {
        this.projectId = projectId;
        this.actorId = actorId;
        this.operation = operation;
        this.correlationId = correlationId;
        this.createdAt = createdAt;
        this.partitionMonth = PARTITION_FORMAT.format(createdAt);
    }

    @PrePersist
    void onPersist() {
        if (partitionMonth == null) {
            partitionMonth = PARTITION_FORMAT.format(createdAt);
        }
    }

    // Getters and setters

    public Long getId() { return id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getActorId() { return actorId; }
    public void setActorId(String actorId) { this.actorId = actorId; }

    public SyncOperation getOperation() { return operation; }
    public void setOperation(SyncOperation operation) { this.operation = operation; }

    public String getSecretName() { return secretName; }
    public void setSecretName(String secretName) { this.secretName = secretName; }

    public List<String> getAffectedScopes() { return affectedScopes; }
    public void setAffectedScopes(List<String> affectedScopes) { this.affectedScopes = new ArrayList<>(affectedScopes); }

    public SyncEventStatus getStatus() { return status; }
    public void setStatus(SyncEventStatus status) { this.status = status; }

    public int getSuccessCount() { return successCount; }
    public void setSuccessCount(int successCount) { this.successCount = successCount; }

    public int getFailureCount() { return failureCount; }
    public void setFailureCount(int failureCount) { this.failureCount = failureCount; }

    public String getCorrelationId() { return correlationId; }
    public void setCorrelationId(String correlationId) { this.correlationId = correlationId; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }

    public String getPartitionMonth() { return partitionMonth; }

    public Instant getCreatedAt() { return createdAt; }
}
