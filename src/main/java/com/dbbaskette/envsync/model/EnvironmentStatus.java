package com.dbbaskette.envsync.model;

public enum EnvironmentStatus {
    PROVISIONING,
    ACTIVE,
    FAILED
}
