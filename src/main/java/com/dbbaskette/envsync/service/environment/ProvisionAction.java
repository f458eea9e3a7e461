package com.dbbaskette.envsync.service.environment;

public enum ProvisionAction {
    CREATED,
    UPDATED
}
