package com.dbbaskette.envsync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.Instant;

@Embeddable
public class EnvironmentSecretRef {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "last_updated_at")
    private Instant lastUpdatedAt;

    public EnvironmentSecretRef() {}

    public EnvironmentSecretRef(String name, Instant lastUpdatedAt) {
        this.name = name;
        this.lastUpdatedAt = lastUpdatedAt;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getLastUpdatedAt() { return lastUpdatedAt; }
    public void setLastUpdatedAt(Instant lastUpdatedAt) { this.lastUpdatedAt = lastUpdatedAt; }
}
