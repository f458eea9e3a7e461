package com.dbbaskette.envsync.controller;

import com.dbbaskette.envsync.MutableClock;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.service.environment.EnvironmentService;
import com.dbbaskette.envsync.service.environment.EnvironmentSpec;
import com.dbbaskette.envsync.service.environment.ProvisionReport;
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

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EnvironmentControllerTest {

    private EnvironmentService environmentService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        environmentService = mock(EnvironmentService.class);
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        IdempotentRequests idempotentRequests = new IdempotentRequests(
                new IdempotencyGate(new InMemoryIdempotencyStore(clock), true), new ObjectMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(new EnvironmentController(environmentService, idempotentRequests))
                .setControllerAdvice(new GlobalExceptionHandler(clock))
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void createsEnvironmentsFromRequest() throws Exception {
        when(environmentService.provision(eq("demo"), anyList(), anyBoolean(), anyString(), anyString()))
                .thenReturn(new ProvisionReport(List.of("production"), List.of(), List.of(), "corr"));

        mockMvc.perform(post("/environments").contentType(MediaType.APPLICATION_JSON).content("""
                        {"projectId":"demo","environments":[{"name":"production",
                          "protectionRules":{"requiredReviewers":1,"reviewerIds":[42],"restrictToMainBranch":true,"waitTimer":10},
                          "secrets":[{"name":"DATABASE_URL","value":"postgres://prod"}],
                          "linkedResources":{"database":"prod-db"}}]}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created[0]").value("production"));

        ArgumentCaptor<List<EnvironmentSpec>> captor = ArgumentCaptor.forClass(List.class);
        verify(environmentService).provision(eq("demo"), captor.capture(), eq(false), anyString(), anyString());
        EnvironmentSpec spec = captor.getValue().get(0);
        assertEquals(CanonicalEnvironment.PRODUCTION, spec.environment());
        assertEquals(List.of(42L), spec.rules().getReviewerIds());
        assertEquals(10, spec.rules().getWaitTimerMinutes());
        assertTrue(spec.rules().isRestrictToMainBranch());
        assertEquals(Map.of("DATABASE_URL", "postgres://prod"), spec.secrets());
        assertEquals(Map.of("database", "prod-db"), spec.linkedResources());
    }

    @Test
    void partialFailureIsMultiStatus() throws Exception {
        when(environmentService.provision(anyString(), anyList(), anyBoolean(), anyString(), anyString()))
                .thenReturn(new ProvisionReport(List.of("dev"), List.of(),
                        List.of(new ProvisionReport.EnvironmentError("production", "Reviewer not found",
                                "GITHUB_ENV_REVIEWER_NOT_FOUND")), "corr"));

        mockMvc.perform(post("/environments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"demo\",\"environments\":[{\"name\":\"dev\"},{\"name\":\"production\"}]}"))
                .andExpect(status().isMultiStatus())
                .andExpect(jsonPath("$.errors[0].code").value("GITHUB_ENV_REVIEWER_NOT_FOUND"));
    }

    @Test
    void unknownEnvironmentNameIsRejected() throws Exception {
        mockMvc.perform(post("/environments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"demo\",\"environments\":[{\"name\":\"qa\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(environmentService);
    }

    @Test
    void tooManyReviewersIsRejected() throws Exception {
        mockMvc.perform(post("/environments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"demo\",\"environments\":[{\"name\":\"dev\","
                                + "\"protectionRules\":{\"requiredReviewers\":7}}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void idempotentCreateReplaysReport() throws Exception {
        when(environmentService.provision(anyString(), anyList(), anyBoolean(), anyString(), anyString()))
                .thenReturn(new ProvisionReport(List.of("dev"), List.of(), List.of(), "corr"));
        String body = "{\"projectId\":\"demo\",\"environments\":[{\"name\":\"dev\"}]}";

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/environments").contentType(MediaType.APPLICATION_JSON)
                            .header(SecretSyncController.IDEMPOTENCY_HEADER, "env-1").content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.created[0]").value("dev"));
        }
        verify(environmentService, times(1)).provision(any(), any(), anyBoolean(), any(), any());
    }
}
