package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.error.EnvSyncException;

/**
 * One collected per-item failure of a batch. Never carries a secret value.
 */
public record SyncError(String secretName, String scope, String code, String message) {

    public static SyncError of(WriteOutcome outcome) {
        return new SyncError(outcome.secretName(), outcome.scope().label(),
                outcome.errorCode() != null ? outcome.errorCode().name() : null, outcome.errorMessage());
    }

    public static SyncError of(String secretName, String scope, EnvSyncException e) {
        return new SyncError(secretName, scope, e.getCode().name(), e.getMessage());
    }
}
