package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "idempotency_records")
public class IdempotencyRecord {

    @Id
    @Column(name = "idempotency_key", length = 200)
    private String key;

    @Column(name = "payload_checksum", nullable = false, length = 64)
    private String payloadChecksum;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IdempotencyStatus status = IdempotencyStatus.PENDING;

    @Lob
    @Column
    private String result;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    public IdempotencyRecord() {}

    public IdempotencyRecord(String key, String payloadChecksum) {
        this.key = key;
        this.payloadChecksum = payloadChecksum;
    }

    // Getters and setters

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getPayloadChecksum() { return payloadChecksum; }
    public void setPayloadChecksum(String payloadChecksum) { this.payloadChecksum = payloadChecksum; }

    public IdempotencyStatus getStatus() { return status; }
    public void setStatus(IdempotencyStatus status) { this.status = status; }

    public String getResult() { return result; }
    public void setResult(String result) { this.result = result; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
