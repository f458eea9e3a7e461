package com.dbbaskette.envsync.service.audit;

import com.dbbaskette.envsync.model.SyncOperation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an operation did, before it is turned into a {@link com.dbbaskette.envsync.model.SyncEvent}.
 *
 * @param scopeOutcomes affected scope label to whether every write in that scope succeeded
 */
public record AuditEntry(String projectId, String actorId, SyncOperation operation, String secretName,
                         Map<String, Boolean> scopeOutcomes, String correlationId, long durationMs,
                         Map<String, Object> metadata) {

    public AuditEntry {
        scopeOutcomes = scopeOutcomes == null ? Map.of() : new LinkedHashMap<>(scopeOutcomes);
        metadata = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
    }
}
