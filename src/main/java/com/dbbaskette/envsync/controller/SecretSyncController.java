package com.dbbaskette.envsync.controller;

import com.dbbaskette.envsync.error.InvalidRequestException;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.model.SyncEvent;
import com.dbbaskette.envsync.observability.CorrelationIdFilter;
import com.dbbaskette.envsync.security.ActorResolver;
import com.dbbaskette.envsync.service.audit.AuditRecorder;
import com.dbbaskette.envsync.service.conflict.ConflictValidator;
import com.dbbaskette.envsync.service.conflict.ValidationResult;
import com.dbbaskette.envsync.service.distribution.DistributionRequest;
import com.dbbaskette.envsync.service.distribution.DistributionResult;
import com.dbbaskette.envsync.service.distribution.SecretDistributionService;
import com.dbbaskette.envsync.service.distribution.SyncStatusReport;
import com.dbbaskette.envsync.service.distribution.SyncStatusService;
import com.dbbaskette.envsync.service.idempotency.IdempotentRequests;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/secrets")
public class SecretSyncController {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final SecretDistributionService distributionService;
    private final SyncStatusService statusService;
    private final ConflictValidator conflictValidator;
    private final AuditRecorder auditRecorder;
    private final IdempotentRequests idempotentRequests;

    public SecretSyncController(SecretDistributionService distributionService, SyncStatusService statusService,
                                ConflictValidator conflictValidator, AuditRecorder auditRecorder,
                                IdempotentRequests idempotentRequests) {
        this.distributionService = distributionService;
        this.statusService = statusService;
        this.conflictValidator = conflictValidator;
        this.auditRecorder = auditRecorder;
        this.idempotentRequests = idempotentRequests;
    }

    @PostMapping("/sync")
    public ResponseEntity<?> sync(@Valid @RequestBody SyncRequest body,
                                  @RequestHeader(name = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
                                  HttpServletRequest request) {
        DistributionRequest distribution = DistributionRequest.forProject(body.projectId())
                .values(body.values())
                .secretNames(body.secretNames() == null ? null : new LinkedHashSet<>(body.secretNames()))
                .targetScopes(parseScopes(body.targetScopes()))
                .force(Boolean.TRUE.equals(body.force()))
                .dryRun(Boolean.TRUE.equals(body.dryRun()))
                .timeout(body.timeoutSeconds() == null ? null : Duration.ofSeconds(body.timeoutSeconds()))
                .actorId(ActorResolver.resolve(request))
                .correlationId(CorrelationIdFilter.currentOrNew())
                .build();

        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return ResponseEntity.ok(distributionService.distribute(distribution));
        }
        String json = idempotentRequests.execute(idempotencyKey.trim(), body,
                () -> distributionService.distribute(distribution));
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json);
    }

    @GetMapping("/sync/status")
    public StatusResponse status(@RequestParam String projectId) {
        SyncStatusReport report = statusService.status(projectId);
        return new StatusResponse(report.lastSyncAt(), report.status(), report.pendingCount(), report.errorCount(),
                report.conflictCount(), report.nextScheduledSyncAt(),
                new QuotaRemaining(report.coreRemaining(), report.secretsRemaining()));
    }

    @PostMapping("/validate")
    public ValidationResult validate(@Valid @RequestBody ValidateRequest body, HttpServletRequest request) {
        return conflictValidator.validate(body.projectId(), body.requiredSecrets(), parseScopes(body.targetScopes()),
                ActorResolver.resolve(request), CorrelationIdFilter.currentOrNew());
    }

    @GetMapping("/audit")
    public List<AuditEventView> audit(@RequestParam String projectId,
                                      @RequestParam(defaultValue = "50") int limit) {
        return auditRecorder.recent(projectId, limit).stream().map(this::toView).toList();
    }

    @GetMapping("/audit/{correlationId}")
    public List<AuditEventView> auditByCorrelation(@PathVariable String correlationId) {
        return auditRecorder.byCorrelationId(correlationId).stream().map(this::toView).toList();
    }

    private AuditEventView toView(SyncEvent event) {
        return new AuditEventView(event.getId(), event.getProjectId(), event.getActorId(),
                event.getOperation().name().toLowerCase(), event.getSecretName(), event.getAffectedScopes(),
                event.getStatus().name().toLowerCase(), event.getSuccessCount(), event.getFailureCount(),
                event.getCorrelationId(), event.getDurationMs(), auditRecorder.metadataOf(event), event.getCreatedAt());
    }

    static List<SecretScope> parseScopes(List<String> labels) {
        if (labels == null || labels.isEmpty()) return null;
        List<SecretScope> scopes = new ArrayList<>();
        for (String label : labels) {
            try {
                scopes.add(SecretScope.parse(label));
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException(e.getMessage());
            }
        }
        return scopes;
    }

    public record SyncRequest(@NotBlank String projectId, List<String> secretNames, List<String> targetScopes,
                              Boolean force, Boolean dryRun, Map<String, String> values,
                              @Min(1) @Max(3600) Integer timeoutSeconds) {

        @Override
        public String toString() {
            return "SyncRequest[" + projectId + ", names=" + secretNames + ", scopes=" + targetScopes + "]";
        }
    }

    public record ValidateRequest(@NotBlank String projectId, List<String> requiredSecrets, List<String> targetScopes) {}

    public record QuotaRemaining(int core, int secrets) {}

    public record StatusResponse(Instant lastSyncAt, String status, long pendingCount, long errorCount,
                                 long conflictCount, Instant nextScheduledSyncAt, QuotaRemaining quotaRemaining) {}

    public record AuditEventView(Long id, String projectId, String actorId, String operation, String secretName,
                                 List<String> affectedScopes, String status, int successCount, int failureCount,
                                 String correlationId, long durationMs, Map<String, Object> metadata,
                                 Instant createdAt) {}
}
