package com.dbbaskette.envsync.service.environment;

import com.dbbaskette.envsync.MutableClock;
import com.dbbaskette.envsync.error.ErrorCode;
import com.dbbaskette.envsync.error.ReviewerNotFoundException;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.EnvironmentRecord;
import com.dbbaskette.envsync.model.EnvironmentStatus;
import com.dbbaskette.envsync.model.ProtectionRules;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.observability.EnvSyncMetrics;
import com.dbbaskette.envsync.repository.EnvironmentRecordRepository;
import com.dbbaskette.envsync.service.distribution.ScopeWriter;
import com.dbbaskette.envsync.service.distribution.WriteOutcome;
import com.dbbaskette.envsync.service.distribution.WriteRequest;
import com.dbbaskette.envsync.service.distribution.WriteStatus;
import com.dbbaskette.envsync.service.github.GitHubSecretsClient;
import com.dbbaskette.envsync.service.github.RepoRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EnvironmentProvisionerTest {

    private static final RepoRef REPO = new RepoRef("demo", "acme", "demo-app");

    private final Map<CanonicalEnvironment, EnvironmentRecord> rows = new EnumMap<>(CanonicalEnvironment.class);
    private GitHubSecretsClient client;
    private ScopeWriter scopeWriter;
    private EnvironmentProvisioner provisioner;

    @BeforeEach
    void setUp() {
        client = mock(GitHubSecretsClient.class);
        scopeWriter = mock(ScopeWriter.class);
        EnvironmentRecordRepository repository = mock(EnvironmentRecordRepository.class);
        when(repository.findByProjectIdAndEnvironmentName(eq("demo"), any()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<CanonicalEnvironment>getArgument(1))));
        when(repository.save(any(EnvironmentRecord.class))).thenAnswer(inv -> {
            EnvironmentRecord record = inv.getArgument(0);
            rows.put(record.getEnvironmentName(), record);
            return record;
        });
        when(client.putEnvironment(any(), anyString(), any()))
                .thenReturn(new ObjectMapper().createObjectNode().put("id", 77L));
        when(scopeWriter.upsert(any())).thenAnswer(inv -> {
            WriteRequest req = inv.getArgument(0);
            return WriteOutcome.written(req, "hash", false, 1);
        });

        provisioner = new EnvironmentProvisioner(client, scopeWriter, repository,
                new EnvSyncMetrics(new SimpleMeterRegistry()), new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    void firstEnsureCreatesAndSecondUpdates() {
        when(client.getEnvironment(REPO, "staging")).thenReturn(Optional.empty());
        EnsureResult first = provisioner.ensure(REPO, spec(CanonicalEnvironment.STAGING, Map.of()), false);

        when(client.getEnvironment(REPO, "staging"))
                .thenReturn(Optional.of(new ObjectMapper().createObjectNode().put("id", 77L)));
        EnsureResult second = provisioner.ensure(REPO, spec(CanonicalEnvironment.STAGING, Map.of()), false);

        assertEquals(ProvisionAction.CREATED, first.action());
        assertEquals(ProvisionAction.UPDATED, second.action());
        assertTrue(second.isActive());
        assertEquals(1, rows.size());
        assertEquals(77L, rows.get(CanonicalEnvironment.STAGING).getRemoteEnvironmentId());
        verify(client, times(2)).putEnvironment(eq(REPO), eq("staging"), any());
    }

    @Test
    void secretsAreWrittenUnderBaseName() {
        when(client.getEnvironment(REPO, "dev")).thenReturn(Optional.empty());

        EnsureResult result = provisioner.ensure(REPO,
                spec(CanonicalEnvironment.DEV, Map.of("DATABASE_URL_DEV", "postgres://dev")), true);

        ArgumentCaptor<WriteRequest> captor = ArgumentCaptor.forClass(WriteRequest.class);
        verify(scopeWriter).upsert(captor.capture());
        WriteRequest req = captor.getValue();
        assertEquals(SecretScope.environment(CanonicalEnvironment.DEV), req.scope());
        assertEquals("DATABASE_URL", req.remoteName());
        assertEquals("DATABASE_URL_DEV", req.mappingName());
        assertTrue(req.force());
        assertEquals(1, result.writes().size());
        assertTrue(rows.get(CanonicalEnvironment.DEV).hasSecret("DATABASE_URL"));
    }

    @Test
    void unsuffixedSecretGetsEnvironmentMappingName() {
        when(client.getEnvironment(REPO, "production")).thenReturn(Optional.empty());

        provisioner.ensure(REPO, spec(CanonicalEnvironment.PRODUCTION, Map.of("API_KEY", "v")), false);

        ArgumentCaptor<WriteRequest> captor = ArgumentCaptor.forClass(WriteRequest.class);
        verify(scopeWriter).upsert(captor.capture());
        assertEquals("API_KEY", captor.getValue().remoteName());
        assertEquals("API_KEY_PROD", captor.getValue().mappingName());
    }

    @Test
    void unknownReviewerFailsEnvironmentWithoutSecrets() {
        when(client.getEnvironment(REPO, "production")).thenReturn(Optional.empty());
        doThrow(new ReviewerNotFoundException("Reviewer not found"))
                .when(client).putEnvironment(eq(REPO), eq("production"), any());

        EnsureResult result = provisioner.ensure(REPO,
                new EnvironmentSpec(CanonicalEnvironment.PRODUCTION, new ProtectionRules(1, List.of(99L), true, 0),
                        Map.of("API_KEY", "v"), null), false);

        assertEquals(EnvironmentStatus.FAILED, result.status());
        assertEquals(ErrorCode.GITHUB_ENV_REVIEWER_NOT_FOUND.name(), result.errors().get(0).code());
        assertEquals(EnvironmentStatus.FAILED, rows.get(CanonicalEnvironment.PRODUCTION).getStatus());
        verifyNoInteractions(scopeWriter);
    }

    @Test
    void secretFailureKeepsEnvironmentActive() {
        when(client.getEnvironment(REPO, "dev")).thenReturn(Optional.empty());
        doAnswer(inv -> WriteOutcome.failed(inv.getArgument(0), "hash", ErrorCode.GITHUB_API_ERROR, "GitHub 500", 3))
                .when(scopeWriter).upsert(any());

        EnsureResult result = provisioner.ensure(REPO, spec(CanonicalEnvironment.DEV, Map.of("API_KEY", "v")), false);

        assertTrue(result.isActive());
        assertEquals(1, result.errors().size());
        assertEquals("environment:dev", result.errors().get(0).scope());
        assertFalse(rows.get(CanonicalEnvironment.DEV).hasSecret("API_KEY"));
    }

    @Test
    void excludedSecretIsSkippedWithoutError() {
        when(client.getEnvironment(REPO, "dev")).thenReturn(Optional.empty());
        doAnswer(inv -> {
            WriteRequest req = inv.getArgument(0);
            return req.excluded() ? WriteOutcome.skipped(req, "hash") : WriteOutcome.written(req, "hash", false, 1);
        }).when(scopeWriter).upsert(any());

        EnsureResult result = provisioner.ensure(REPO,
                spec(CanonicalEnvironment.DEV, Map.of("GITHUB_TOKEN", "ghp_x", "API_KEY", "v")), false,
                Set.of("GITHUB_TOKEN"));

        ArgumentCaptor<WriteRequest> captor = ArgumentCaptor.forClass(WriteRequest.class);
        verify(scopeWriter, times(2)).upsert(captor.capture());
        assertTrue(captor.getAllValues().stream()
                .allMatch(req -> req.excluded() == req.remoteName().equals("GITHUB_TOKEN")));
        assertTrue(result.errors().isEmpty());
        assertTrue(result.writes().stream().anyMatch(w -> w.status() == WriteStatus.SKIPPED
                && w.secretName().equals("GITHUB_TOKEN_DEV")));
        assertFalse(rows.get(CanonicalEnvironment.DEV).hasSecret("GITHUB_TOKEN"));
        assertTrue(rows.get(CanonicalEnvironment.DEV).hasSecret("API_KEY"));
    }

    @Test
    void linkedResourcesAreStored() {
        when(client.getEnvironment(REPO, "dev")).thenReturn(Optional.empty());

        provisioner.ensure(REPO, new EnvironmentSpec(CanonicalEnvironment.DEV, null, Map.of(),
                Map.of("database", "dev-db")), false);

        assertEquals(Map.of("database", "dev-db"), rows.get(CanonicalEnvironment.DEV).getLinkedResources());
    }

    @Test
    void distributionWritesAreNoted() {
        when(client.getEnvironment(REPO, "dev")).thenReturn(Optional.empty());
        provisioner.ensure(REPO, spec(CanonicalEnvironment.DEV, Map.of()), false);

        provisioner.recordSecretWrites("demo", CanonicalEnvironment.DEV, List.of("REDIS_URL"));

        assertTrue(rows.get(CanonicalEnvironment.DEV).hasSecret("REDIS_URL"));
    }

    private static EnvironmentSpec spec(CanonicalEnvironment env, Map<String, String> secrets) {
        return new EnvironmentSpec(env, EnvironmentPolicies.defaults(env), secrets, null);
    }
}
