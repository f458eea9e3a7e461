package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Last observed rate-limit window for one project and quota class.
 */
@Entity
@Table(name = "quota_records", uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "quota_type"}))
public class QuotaRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "quota_type", nullable = false, length = 20)
    private QuotaType quotaType;

    @Column(nullable = false)
    private int remaining;

    @Column(name = "quota_limit", nullable = false)
    private int limit;

    @Column(name = "reset_at")
    private Instant resetAt;

    @Column(name = "last_checked_at")
    private Instant lastCheckedAt;

    public QuotaRecord() {}

    public QuotaRecord(String projectId, QuotaType quotaType) {
        this.projectId = projectId;
        this.quotaType = quotaType;
    }

    /**
     * Applies an observation, clamping remaining into {@code [0, limit]}.
     */
    public void apply(int remaining, int limit, Instant resetAt, Instant checkedAt) {
        this.limit = Math.max(0, limit);
        this.remaining = Math.max(0, Math.min(remaining, this.limit));
        this.resetAt = resetAt;
        this.lastCheckedAt = checkedAt;
    }

    // Getters and setters

    public Long getId() { return id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public QuotaType getQuotaType() { return quotaType; }
    public void setQuotaType(QuotaType quotaType) { this.quotaType = quotaType; }

    public int getRemaining() { return remaining; }
    public int getLimit() { return limit; }

    public Instant getResetAt() { return resetAt; }
    public Instant getLastCheckedAt() { return lastCheckedAt; }
}
