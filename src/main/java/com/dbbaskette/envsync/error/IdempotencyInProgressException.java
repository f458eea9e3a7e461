package com.dbbaskette.envsync.error;

public class IdempotencyInProgressException extends EnvSyncException {

    public IdempotencyInProgressException(String key) {
        super(ErrorCode.IDEMPOTENCY_IN_PROGRESS,
                "Operation for idempotency key " + key + " is still in progress");
    }
}
