package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local record of one canonical GitHub environment of a project.
 */
@Entity
@Table(name = "environment_records", uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "environment_name"}))
public class EnvironmentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "environment_name", nullable = false, length = 20)
    private CanonicalEnvironment environmentName;

    @Column(name = "remote_environment_id")
    private Long remoteEnvironmentId;

    @Embedded
    private ProtectionRules protectionRules = ProtectionRules.none();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "environment_secrets", joinColumns = @JoinColumn(name = "environment_id"))
    private List<EnvironmentSecretRef> secrets = new ArrayList<>();

    @Convert(converter = JsonColumnConverters.StringMapConverter.class)
    @Column(name = "linked_resources", length = 2000)
    private Map<String, String> linkedResources = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EnvironmentStatus status = EnvironmentStatus.PROVISIONING;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    public EnvironmentRecord() {}

    public EnvironmentRecord(String projectId, CanonicalEnvironment environmentName) {
        this.projectId = projectId;
        this.environmentName = environmentName;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Records that a secret was written to this environment, replacing any earlier entry.
     */
    public void touchSecret(String name, Instant at) {
        for (EnvironmentSecretRef ref : secrets) {
            if (ref.getName().equals(name)) {
                ref.setLastUpdatedAt(at);
                return;
            }
        }
        secrets.add(new EnvironmentSecretRef(name, at));
    }

    public boolean hasSecret(String name) {
        return secrets.stream().anyMatch(ref -> ref.getName().equals(name));
    }

    // Getters and setters

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public CanonicalEnvironment getEnvironmentName() { return environmentName; }
    public void setEnvironmentName(CanonicalEnvironment environmentName) { this.environmentName = environmentName; }

    public Long getRemoteEnvironmentId() { return remoteEnvironmentId; }
    public void setRemoteEnvironmentId(Long remoteEnvironmentId) { this.remoteEnvironmentId = remoteEnvironmentId; }

    public ProtectionRules getProtectionRules() { return protectionRules; }
    public void setProtectionRules(ProtectionRules protectionRules) { this.protectionRules = protectionRules; }

    public List<EnvironmentSecretRef> getSecrets() { return secrets; }
    public void setSecrets(List<EnvironmentSecretRef> secrets) { this.secrets = secrets; }

    public Map<String, String> getLinkedResources() { return linkedResources; }
    public void setLinkedResources(Map<String, String> linkedResources) {
        this.linkedResources = linkedResources == null ? new LinkedHashMap<>() : new LinkedHashMap<>(linkedResources);
    }

    public EnvironmentStatus getStatus() { return status; }
    public void setStatus(EnvironmentStatus status) { this.status = status; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
