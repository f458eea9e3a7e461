package com.dbbaskette.envsync.error;

public class PayloadDivergenceException extends EnvSyncException {

    public PayloadDivergenceException(String key) {
        super(ErrorCode.IDEMPOTENCY_PAYLOAD_DIVERGENCE,
                "Idempotency key " + key + " was already used with a different payload");
    }
}
