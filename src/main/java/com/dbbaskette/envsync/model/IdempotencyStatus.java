package com.dbbaskette.envsync.model;

public enum IdempotencyStatus {
    PENDING,
    COMPLETED
}
