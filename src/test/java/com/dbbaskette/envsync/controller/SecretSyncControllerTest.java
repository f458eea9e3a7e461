package com.dbbaskette.envsync.controller;

import com.dbbaskette.envsync.MutableClock;
import com.dbbaskette.envsync.error.ProjectNotConfiguredException;
import com.dbbaskette.envsync.error.RateLimitExhaustedException;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.model.SyncEvent;
import com.dbbaskette.envsync.model.SyncEventStatus;
import com.dbbaskette.envsync.model.SyncOperation;
import com.dbbaskette.envsync.service.audit.AuditRecorder;
import com.dbbaskette.envsync.service.conflict.ConflictValidator;
import com.dbbaskette.envsync.service.conflict.ValidationResult;
import com.dbbaskette.envsync.service.distribution.DistributionRequest;
import com.dbbaskette.envsync.service.distribution.DistributionResult;
import com.dbbaskette.envsync.service.distribution.SecretDistributionService;
import com.dbbaskette.envsync.service.distribution.SyncError;
import com.dbbaskette.envsync.service.distribution.SyncStatusReport;
import com.dbbaskette.envsync.service.distribution.SyncStatusService;
import com.dbbaskette.envsync.service.idempotency.IdempotencyGate;
import com.dbbaskette.envsync.service.idempotency.IdempotentRequests;
import com.dbbaskette.envsync.service.idempotency.InMemoryIdempotencyStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SecretSyncControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SecretDistributionService distributionService;
    private SyncStatusService statusService;
    private ConflictValidator conflictValidator;
    private AuditRecorder auditRecorder;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        distributionService = mock(SecretDistributionService.class);
        statusService = mock(SyncStatusService.class);
        conflictValidator = mock(ConflictValidator.class);
        auditRecorder = mock(AuditRecorder.class);
        MutableClock clock = new MutableClock(NOW);
        IdempotentRequests idempotentRequests = new IdempotentRequests(
                new IdempotencyGate(new InMemoryIdempotencyStore(clock), true), new ObjectMapper());

        SecretSyncController controller = new SecretSyncController(distributionService, statusService,
                conflictValidator, auditRecorder, idempotentRequests);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(clock))
                .build();
    }

    @Test
    void syncMapsRequestAndReturnsResult() throws Exception {
        when(distributionService.distribute(any())).thenReturn(result(3));

        mockMvc.perform(post("/secrets/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Actor-Id", "ops@acme")
                        .content("{\"projectId\":\"demo\",\"secretNames\":[\"API_KEY\"],"
                                + "\"targetScopes\":[\"actions\",\"environment:dev\"],\"force\":true,\"timeoutSeconds\":30}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.syncedCount").value(3))
                .andExpect(jsonPath("$.projectId").value("demo"));

        ArgumentCaptor<DistributionRequest> captor = ArgumentCaptor.forClass(DistributionRequest.class);
        verify(distributionService).distribute(captor.capture());
        DistributionRequest request = captor.getValue();
        assertEquals("demo", request.projectId());
        assertEquals(List.of(SecretScope.ACTIONS, SecretScope.parse("environment:dev")), request.targetScopes());
        assertTrue(request.force());
        assertFalse(request.dryRun());
        assertEquals(Duration.ofSeconds(30), request.timeout());
        assertEquals("ops@acme", request.actorId());
    }

    @Test
    void idempotencyKeyReplaysFirstResult() throws Exception {
        when(distributionService.distribute(any())).thenReturn(result(3), result(7));
        String body = "{\"projectId\":\"demo\"}";

        String first = mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON)
                        .header(SecretSyncController.IDEMPOTENCY_HEADER, "run-42").content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String second = mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON)
                        .header(SecretSyncController.IDEMPOTENCY_HEADER, "run-42").content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        assertEquals(first, second);
        verify(distributionService, times(1)).distribute(any());
    }

    @Test
    void reusedKeyWithDifferentBodyIsRejected() throws Exception {
        when(distributionService.distribute(any())).thenReturn(result(1));
        mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON)
                .header(SecretSyncController.IDEMPOTENCY_HEADER, "run-1").content("{\"projectId\":\"demo\"}"));

        mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON)
                        .header(SecretSyncController.IDEMPOTENCY_HEADER, "run-1")
                        .content("{\"projectId\":\"demo\",\"force\":true}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("IDEMPOTENCY_PAYLOAD_DIVERGENCE"));
    }

    @Test
    void blankProjectIsValidationError() throws Exception {
        mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON).content("{\"projectId\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(distributionService);
    }

    @Test
    void unknownScopeIsValidationError() throws Exception {
        mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"demo\",\"targetScopes\":[\"pages\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void malformedJsonIsValidationError() throws Exception {
        mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Request body is not valid JSON"));
    }

    @Test
    void quotaAbortIs429WithRetryAfter() throws Exception {
        when(distributionService.distribute(any()))
                .thenThrow(new RateLimitExhaustedException(QuotaType.SECRETS, 5, 20, NOW.plusSeconds(120)));

        mockMvc.perform(post("/secrets/sync").contentType(MediaType.APPLICATION_JSON).content("{\"projectId\":\"demo\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "120"))
                .andExpect(jsonPath("$.error.code").value("GITHUB_SECRETS_RATE_LIMIT_EXHAUSTED"))
                .andExpect(jsonPath("$.error.retryAfter").value(120));
    }

    @Test
    void unknownProjectIs400() throws Exception {
        when(statusService.status("nope")).thenThrow(new ProjectNotConfiguredException("nope"));

        mockMvc.perform(get("/secrets/sync/status").param("projectId", "nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("PROJECT_NOT_CONFIGURED"));
    }

    @Test
    void statusIncludesQuota() throws Exception {
        when(statusService.status("demo")).thenReturn(new SyncStatusReport("demo", NOW, "synced", 0, 0, 1,
                NOW.plus(Duration.ofHours(6)), 4900, 95));

        mockMvc.perform(get("/secrets/sync/status").param("projectId", "demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("synced"))
                .andExpect(jsonPath("$.conflictCount").value(1))
                .andExpect(jsonPath("$.quotaRemaining.core").value(4900))
                .andExpect(jsonPath("$.quotaRemaining.secrets").value(95));
    }

    @Test
    void missingProjectParamIs400() throws Exception {
        mockMvc.perform(get("/secrets/sync/status"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void validateDelegates() throws Exception {
        when(conflictValidator.validate(eq("demo"), anyList(), isNull(), anyString(), anyString()))
                .thenReturn(new ValidationResult(true, List.of(), List.of(),
                        new ValidationResult.Summary(1, 0, 0, 1), List.of("All secrets valid. No action required."),
                        "corr", 2));

        mockMvc.perform(post("/secrets/validate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"demo\",\"requiredSecrets\":[\"API_KEY\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.summary.validCount").value(1));
    }

    @Test
    void auditListsEvents() throws Exception {
        SyncEvent event = new SyncEvent("demo", "api", SyncOperation.SYNC_ALL, "corr-9", NOW);
        event.setAffectedScopes(List.of("actions"));
        event.setStatus(SyncEventStatus.SUCCESS);
        event.setSuccessCount(1);
        when(auditRecorder.recent("demo", 50)).thenReturn(List.of(event));
        when(auditRecorder.metadataOf(event)).thenReturn(Map.of("written", 1));

        mockMvc.perform(get("/secrets/audit").param("projectId", "demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].operation").value("sync_all"))
                .andExpect(jsonPath("$[0].status").value("success"))
                .andExpect(jsonPath("$[0].correlationId").value("corr-9"))
                .andExpect(jsonPath("$[0].metadata.written").value(1));
    }

    private static DistributionResult result(int synced) {
        return new DistributionResult("demo", synced, 0, 0,
                List.of(new SyncError("X", "actions", "GITHUB_API_ERROR", "GitHub 502")), List.of(), List.of(),
                "corr-1", 12, false);
    }
}
