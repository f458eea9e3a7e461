package com.dbbaskette.envsync.service.environment;

import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.EnvironmentStatus;
import com.dbbaskette.envsync.service.distribution.SyncError;
import com.dbbaskette.envsync.service.distribution.WriteOutcome;

import java.util.List;

public record EnsureResult(CanonicalEnvironment environment, ProvisionAction action, EnvironmentStatus status,
                           List<SyncError> errors, List<WriteOutcome> writes) {

    public boolean isActive() {
        return status == EnvironmentStatus.ACTIVE;
    }
}
