package com.dbbaskette.envsync.service.idempotency;

import com.dbbaskette.envsync.model.IdempotencyRecord;

import java.util.Optional;

/**
 * Persistence seam for {@link IdempotencyGate}.
 */
public interface IdempotencyStore {

    Optional<IdempotencyRecord> find(String key);

    /**
     * Inserts a pending record.
     *
     * @return false when a record for the key already exists
     */
    boolean createPending(String key, String payloadChecksum);

    void complete(String key, String result);

    /** Forgets a pending record so the key can be retried after a failed execution. */
    void release(String key);
}
