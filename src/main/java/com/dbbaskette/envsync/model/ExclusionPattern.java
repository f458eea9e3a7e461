package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A regex over secret names that keeps matching names out of every scope.
 * Global patterns carry no project; project patterns must name one.
 */
@Entity
@Table(name = "exclusion_patterns")
public class ExclusionPattern {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", length = 64)
    private String projectId;

    @Column(nullable = false, length = 200)
    private String pattern;

    @Column(length = 500)
    private String reason;

    @Column(name = "is_global", nullable = false)
    private boolean global;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    public ExclusionPattern() {}

    public static ExclusionPattern global(String pattern, String reason) {
        ExclusionPattern p = new ExclusionPattern();
        p.pattern = pattern;
        p.reason = reason;
        p.global = true;
        return p;
    }

    public static ExclusionPattern forProject(String projectId, String pattern, String reason) {
        ExclusionPattern p = new ExclusionPattern();
        p.projectId = projectId;
        p.pattern = pattern;
        p.reason = reason;
        p.global = false;
        return p;
    }

    @PrePersist
    @PreUpdate
    void checkOwnership() {
        if (global && projectId != null) {
            throw new IllegalStateException("Global exclusion pattern must not have a projectId");
        }
        if (!global && (projectId == null || projectId.isBlank())) {
            throw new IllegalStateException("Project exclusion pattern requires a projectId");
        }
    }

    // Getters and setters

    public Long getId() { return id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getPattern() { return pattern; }
    public void setPattern(String pattern) { this.pattern = pattern; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public boolean isGlobal() { return global; }
    public void setGlobal(boolean global) { this.global = global; }

    public Instant getCreatedAt() { return createdAt; }
}
