package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.model.ScopeSyncState;
import com.dbbaskette.envsync.model.SecretMapping;
import com.dbbaskette.envsync.model.SyncStatus;
import com.dbbaskette.envsync.repository.SecretMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records write results on {@link SecretMapping} rows. Updates to one mapping are serialized,
 * since parallel writes of the same name to different scopes share its row.
 */
@Service
public class SecretMappingStore {

    private static final Logger log = LoggerFactory.getLogger(SecretMappingStore.class);

    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();
    private final SecretMappingRepository repository;
    private final Clock clock;

    public SecretMappingStore(SecretMappingRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public boolean exists(String projectId, String secretName) {
        return repository.findByProjectIdAndSecretName(projectId, secretName).isPresent();
    }

    public void recordExcluded(String projectId, String secretName, String hash) {
        synchronized (lockFor(projectId, secretName)) {
            SecretMapping mapping = load(projectId, secretName, hash);
            mapping.setExcluded(true);
            mapping.setValueHash(hash);
            repository.save(mapping);
        }
    }

    /**
     * Records a successful write and reports whether it was a conflict.
     *
     * <p>A write conflicts when the scope previously held a different hash, or was already
     * flagged, and {@code force} is off. Forced writes clear the flag.
     */
    public boolean recordWrite(String projectId, String secretName, String scopeLabel, String hash, boolean force) {
        synchronized (lockFor(projectId, secretName)) {
            Instant now = clock.instant();
            SecretMapping mapping = load(projectId, secretName, hash);
            ScopeSyncState previous = mapping.getScopeStates().get(scopeLabel);
            boolean conflict = !force && previous != null
                    && (previous.getStatus() == SyncStatus.CONFLICT
                        || (previous.getValueHash() != null && !previous.getValueHash().equals(hash)));

            mapping.getScopeStates().put(scopeLabel,
                    new ScopeSyncState(hash, conflict ? SyncStatus.CONFLICT : SyncStatus.SYNCED, now, null));
            mapping.setValueHash(hash);
            mapping.setExcluded(false);
            mapping.setLastSyncedAt(now);
            mapping.recomputeStatus();
            repository.save(mapping);
            if (conflict) {
                log.warn("Conflict on {} in {}: stored value differed, write applied and flagged", secretName, scopeLabel);
            }
            return conflict;
        }
    }

    /**
     * Records a failed write. The scope keeps the hash it had before.
     */
    public void recordFailure(String projectId, String secretName, String scopeLabel, String attemptedHash, String error) {
        synchronized (lockFor(projectId, secretName)) {
            SecretMapping mapping = load(projectId, secretName, attemptedHash);
            ScopeSyncState previous = mapping.getScopeStates().get(scopeLabel);
            String keptHash = previous != null ? previous.getValueHash() : null;
            Instant lastSynced = previous != null ? previous.getLastSyncedAt() : null;
            mapping.getScopeStates().put(scopeLabel, new ScopeSyncState(keptHash, SyncStatus.FAILED, lastSynced, error));
            mapping.setExcluded(false);
            mapping.recomputeStatus();
            repository.save(mapping);
        }
    }

    private SecretMapping load(String projectId, String secretName, String hash) {
        return repository.findByProjectIdAndSecretName(projectId, secretName)
                .orElseGet(() -> new SecretMapping(projectId, secretName, hash));
    }

    private Object lockFor(String projectId, String secretName) {
        return locks.computeIfAbsent(projectId + "/" + secretName, k -> new Object());
    }
}
