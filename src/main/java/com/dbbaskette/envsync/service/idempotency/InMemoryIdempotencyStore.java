package com.dbbaskette.envsync.service.idempotency;

import com.dbbaskette.envsync.model.IdempotencyRecord;
import com.dbbaskette.envsync.model.IdempotencyStatus;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for the CLI and tests.
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ConcurrentHashMap<String, IdempotencyRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdempotencyStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public boolean createPending(String key, String payloadChecksum) {
        return records.putIfAbsent(key, new IdempotencyRecord(key, payloadChecksum)) == null;
    }

    @Override
    public void complete(String key, String result) {
        records.computeIfPresent(key, (k, record) -> {
            record.setStatus(IdempotencyStatus.COMPLETED);
            record.setResult(result);
            record.setCompletedAt(clock.instant());
            return record;
        });
    }

    @Override
    public void release(String key) {
        records.computeIfPresent(key, (k, record) -> record.getStatus() == IdempotencyStatus.PENDING ? null : record);
    }
}
