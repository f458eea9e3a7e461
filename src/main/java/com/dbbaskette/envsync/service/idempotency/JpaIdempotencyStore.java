package com.dbbaskette.envsync.service.idempotency;

import com.dbbaskette.envsync.model.IdempotencyRecord;
import com.dbbaskette.envsync.model.IdempotencyStatus;
import com.dbbaskette.envsync.repository.IdempotencyRecordRepository;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.util.Optional;

/**
 * Database-backed store shared by every instance pointing at the same schema.
 * The key is the primary key, so a concurrent insert from another process fails the unique check.
 */
public class JpaIdempotencyStore implements IdempotencyStore {

    private final IdempotencyRecordRepository repository;
    private final Clock clock;

    public JpaIdempotencyStore(IdempotencyRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        return repository.findById(key);
    }

    @Override
    public boolean createPending(String key, String payloadChecksum) {
        if (repository.existsById(key)) {
            return false;
        }
        try {
            repository.saveAndFlush(new IdempotencyRecord(key, payloadChecksum));
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    @Override
    public void complete(String key, String result) {
        repository.findById(key).ifPresent(record -> {
            record.setStatus(IdempotencyStatus.COMPLETED);
            record.setResult(result);
            record.setCompletedAt(clock.instant());
            repository.save(record);
        });
    }

    @Override
    public void release(String key) {
        repository.findById(key)
                .filter(record -> record.getStatus() == IdempotencyStatus.PENDING)
                .ifPresent(repository::delete);
    }
}
