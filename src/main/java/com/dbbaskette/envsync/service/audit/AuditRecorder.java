package com.dbbaskette.envsync.service.audit;

import com.dbbaskette.envsync.model.SyncEvent;
import com.dbbaskette.envsync.model.SyncEventStatus;
import com.dbbaskette.envsync.repository.SyncEventRepository;
import com.dbbaskette.envsync.security.Redactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends one immutable {@link SyncEvent} per operation. Recording never throws into the caller;
 * a failed append is logged and the operation's own result stands.
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);
    private static final int MAX_QUERY_LIMIT = 500;
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<Map<String, Object>>() {};

    private final SyncEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditRecorder(SyncEventRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void record(AuditEntry entry) {
        try {
            SyncEvent event = new SyncEvent(entry.projectId(), entry.actorId(), entry.operation(),
                    entry.correlationId(), clock.instant());
            event.setSecretName(entry.secretName());

            List<String> scopes = new ArrayList<>(entry.scopeOutcomes().keySet());
            int success = (int) entry.scopeOutcomes().values().stream().filter(Boolean::booleanValue).count();
            int failure = scopes.size() - success;
            event.setAffectedScopes(scopes);
            event.setSuccessCount(success);
            event.setFailureCount(failure);
            event.setStatus(SyncEventStatus.fromCounts(success, failure));
            event.setDurationMs(entry.durationMs());
            event.setMetadata(objectMapper.writeValueAsString(Redactor.redactStructure(entry.metadata())));

            repository.save(event);
            log.info("[AUDIT] {} {} for {}: {} ({} ok, {} failed)", entry.operation(), entry.correlationId(),
                    entry.projectId(), event.getStatus(), success, failure);
        } catch (Exception e) {
            log.error("Failed to record audit event {} for {}: {}", entry.operation(), entry.correlationId(), e.getMessage());
        }
    }

    public List<SyncEvent> recent(String projectId, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_QUERY_LIMIT));
        return repository.findByProjectIdOrderByCreatedAtDesc(projectId, PageRequest.of(0, bounded));
    }

    public List<SyncEvent> byCorrelationId(String correlationId) {
        return repository.findByCorrelationIdOrderByCreatedAtAsc(correlationId);
    }

    /** Reads back the stored metadata; events written before metadata existed yield an empty map. */
    public Map<String, Object> metadataOf(SyncEvent event) {
        if (event.getMetadata() == null || event.getMetadata().isBlank()) return Map.of();
        try {
            return objectMapper.readValue(event.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on audit event {}: {}", event.getId(), e.getMessage());
            return Map.of();
        }
    }
}
