package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.MutableClock;
import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.CredentialMissingException;
import com.dbbaskette.envsync.error.ErrorCode;
import com.dbbaskette.envsync.error.RateLimitExhaustedException;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.EnvironmentStatus;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.model.SyncOperation;
import com.dbbaskette.envsync.observability.EnvSyncMetrics;
import com.dbbaskette.envsync.repository.ExclusionPatternRepository;
import com.dbbaskette.envsync.repository.QuotaRecordRepository;
import com.dbbaskette.envsync.service.audit.AuditEntry;
import com.dbbaskette.envsync.service.audit.AuditRecorder;
import com.dbbaskette.envsync.service.classify.ExclusionService;
import com.dbbaskette.envsync.service.environment.EnsureResult;
import com.dbbaskette.envsync.service.environment.EnvironmentPolicies;
import com.dbbaskette.envsync.service.environment.EnvironmentProvisioner;
import com.dbbaskette.envsync.service.environment.EnvironmentSpec;
import com.dbbaskette.envsync.service.environment.ProvisionAction;
import com.dbbaskette.envsync.service.quota.QuotaTracker;
import com.dbbaskette.envsync.service.values.SecretValueSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SecretDistributionServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private SecretValueSource valueSource;
    private EnvironmentProvisioner provisioner;
    private ScopeWriter scopeWriter;
    private SecretMappingStore mappingStore;
    private BoundedWriteExecutor executor;
    private AuditRecorder auditRecorder;
    private QuotaTracker quotaTracker;
    private EnvSyncProperties properties;
    private SecretDistributionService service;
    private List<WriteRequest> submitted;

    @BeforeEach
    void setUp() {
        properties = new EnvSyncProperties();
        properties.getGithub().setToken("test-token");
        MutableClock clock = new MutableClock(START);

        ProjectResolver resolver = mock(ProjectResolver.class);
        when(resolver.require("demo")).thenReturn(new ProjectRepo("demo", "acme", "demo-app"));
        valueSource = mock(SecretValueSource.class);
        when(valueSource.load(any(ProjectRepo.class))).thenReturn(sampleValues());
        provisioner = mock(EnvironmentProvisioner.class);
        when(provisioner.ensure(any(), any(), anyBoolean())).thenAnswer(inv -> {
            EnvironmentSpec spec = inv.getArgument(1);
            return new EnsureResult(spec.environment(), ProvisionAction.CREATED, EnvironmentStatus.ACTIVE,
                    List.of(), List.of());
        });
        submitted = new CopyOnWriteArrayList<>();
        scopeWriter = mock(ScopeWriter.class);
        when(scopeWriter.upsert(any())).thenAnswer(inv -> {
            WriteRequest req = inv.getArgument(0);
            submitted.add(req);
            return req.dryRun() ? WriteOutcome.planned(req, "h") : WriteOutcome.written(req, "h", false, 1);
        });
        mappingStore = mock(SecretMappingStore.class);
        executor = new BoundedWriteExecutor(properties);
        auditRecorder = mock(AuditRecorder.class);
        quotaTracker = new QuotaTracker(mock(QuotaRecordRepository.class), properties, clock);

        service = new SecretDistributionService(resolver, valueSource,
                new ExclusionService(mock(ExclusionPatternRepository.class)), quotaTracker, provisioner,
                new EnvironmentPolicies(properties), scopeWriter, mappingStore, executor, auditRecorder, properties,
                new EnvSyncMetrics(new SimpleMeterRegistry()), clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void fullCycleRoutesGlobalAndEnvironmentSecrets() {
        DistributionResult result = service.distribute(request().build());

        assertEquals(5, result.syncedCount());
        assertEquals(1, result.skippedCount());
        assertTrue(result.errors().isEmpty());
        assertEquals(3, result.environments().size());
        assertEquals("corr-1", result.correlationId());

        assertEquals(Set.of("actions", "codespaces", "dependabot"), scopesFor("API_KEY"));
        assertEquals(Set.of("environment:dev"), scopesFor("DATABASE_URL_DEV"));
        assertEquals(Set.of("environment:staging"), scopesFor("DATABASE_URL_STAGING"));
        assertTrue(submitted.stream().filter(r -> r.mappingName().startsWith("DATABASE_URL_"))
                .allMatch(r -> r.remoteName().equals("DATABASE_URL")));
        assertTrue(submitted.stream().noneMatch(r -> r.mappingName().equals("GITHUB_TOKEN")));

        verify(mappingStore).recordExcluded(eq("demo"), eq("GITHUB_TOKEN"), anyString());
        verify(provisioner, times(3)).ensure(any(), any(), anyBoolean());
        verify(provisioner).recordSecretWrites("demo", CanonicalEnvironment.DEV, List.of("DATABASE_URL"));
        // 5 writes, 5 public keys, 3 environment GET/PUT pairs
        assertEquals(5000 - 16, quotaTracker.snapshot("demo", QuotaType.CORE).remaining());
        assertEquals(100, quotaTracker.snapshot("demo", QuotaType.SECRETS).remaining());

        AuditEntry audit = auditedEntries().get(0);
        assertEquals(SyncOperation.SYNC_ALL, audit.operation());
        assertEquals(5, audit.scopeOutcomes().size());
        assertTrue(audit.scopeOutcomes().values().stream().allMatch(Boolean::booleanValue));
    }

    @Test
    void insufficientQuotaAbortsBeforeAnyCall() {
        quotaTracker.refresh("demo", QuotaType.CORE, 110, 5000, START.plus(Duration.ofMinutes(20)));

        RateLimitExhaustedException e = assertThrows(RateLimitExhaustedException.class,
                () -> service.distribute(request().build()));

        assertEquals(QuotaType.CORE, e.getQuotaType());
        verifyNoInteractions(scopeWriter, provisioner);
        assertEquals(110, quotaTracker.snapshot("demo", QuotaType.CORE).remaining());
        AuditEntry audit = auditedEntries().get(0);
        assertEquals(ErrorCode.GITHUB_SECRETS_RATE_LIMIT_EXHAUSTED.name(), audit.metadata().get("aborted"));
        assertTrue(audit.scopeOutcomes().values().stream().noneMatch(Boolean::booleanValue));
    }

    @Test
    void batchOfMoreThanNinetyWritesIsNotBlocked() {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < 31; i++) {
            values.put(String.format("SERVICE_KEY_%02d", i), "value-" + i);
        }

        for (int run = 0; run < 2; run++) {
            DistributionResult result = service.distribute(request().values(values).build());
            assertEquals(93, result.syncedCount());
        }

        // 93 writes plus 3 public keys, per run
        assertEquals(5000 - 192, quotaTracker.snapshot("demo", QuotaType.CORE).remaining());
        assertEquals(100, quotaTracker.snapshot("demo", QuotaType.SECRETS).remaining());
    }

    @Test
    void dryRunPlansWithoutSideEffects() {
        properties.getGithub().setToken(null);

        DistributionResult result = service.distribute(request().dryRun(true).build());

        assertTrue(result.dryRun());
        assertEquals(0, result.syncedCount());
        assertEquals(5, result.plannedCount());
        assertTrue(result.environments().stream().allMatch(env -> env.status().equals("planned")));
        verify(provisioner, never()).ensure(any(), any(), anyBoolean());
        verify(mappingStore, never()).recordExcluded(anyString(), anyString(), anyString());
        assertEquals(5000, quotaTracker.snapshot("demo", QuotaType.CORE).remaining());
    }

    @Test
    void missingTokenFailsRealRun() {
        properties.getGithub().setToken("");

        assertThrows(CredentialMissingException.class, () -> service.distribute(request().build()));
        verifyNoInteractions(scopeWriter);
    }

    @Test
    void failedEnvironmentSkipsItsWritesOnly() {
        SyncError reviewer = new SyncError(null, "environment:dev",
                ErrorCode.GITHUB_ENV_REVIEWER_NOT_FOUND.name(), "Reviewer not found");
        doReturn(new EnsureResult(CanonicalEnvironment.DEV, ProvisionAction.CREATED, EnvironmentStatus.FAILED,
                List.of(reviewer), List.of()))
                .when(provisioner).ensure(any(), argThatEnv(CanonicalEnvironment.DEV), anyBoolean());

        DistributionResult result = service.distribute(request().build());

        assertEquals(4, result.syncedCount());
        assertTrue(submitted.stream().noneMatch(r -> r.mappingName().equals("DATABASE_URL_DEV")));
        assertTrue(result.errors().stream().anyMatch(e -> "DATABASE_URL_DEV".equals(e.secretName())
                && ErrorCode.GITHUB_ENV_REVIEWER_NOT_FOUND.name().equals(e.code())));
        assertTrue(result.hasFailures());
        assertFalse(auditedEntries().get(0).scopeOutcomes().get("environment:dev"));
    }

    @Test
    void explicitScopesLimitTargets() {
        DistributionResult result = service.distribute(request().targetScopes(List.of(SecretScope.ACTIONS)).build());

        assertEquals(1, result.syncedCount());
        assertEquals(Set.of("actions"), scopesFor("API_KEY"));
        assertTrue(result.environments().isEmpty());
        verifyNoInteractions(provisioner);
    }

    @Test
    void singleSecretSelectsSuffixedVariantsAndAuditsCreate() {
        DistributionResult result = service.distribute(request().secretNames(Set.of("DATABASE_URL")).build());

        assertEquals(2, result.syncedCount());
        verify(provisioner, times(2)).ensure(any(), any(), anyBoolean());
        List<AuditEntry> audits = auditedEntries();
        assertEquals(2, audits.size());
        assertEquals(SyncOperation.CREATE, audits.get(1).operation());
    }

    @Test
    void singleExistingSecretAuditsUpdate() {
        when(mappingStore.exists("demo", "API_KEY")).thenReturn(true);

        service.distribute(request().secretNames(Set.of("API_KEY")).build());

        AuditEntry secretAudit = auditedEntries().get(1);
        assertEquals(SyncOperation.UPDATE, secretAudit.operation());
        assertEquals("API_KEY", secretAudit.secretName());
        assertEquals(3, secretAudit.scopeOutcomes().size());
    }

    @Test
    void invalidNamesAreReportedAndOthersProceed() {
        Map<String, String> values = new LinkedHashMap<>(sampleValues());
        values.put("lower_case", "x");

        DistributionResult result = service.distribute(request().values(values).build());

        assertEquals(5, result.syncedCount());
        assertEquals(1, result.errors().size());
        assertEquals(ErrorCode.VALIDATION_ERROR.name(), result.errors().get(0).code());
        verifyNoInteractions(valueSource);
    }

    @Test
    void runLocalExclusionSkipsName() {
        DistributionResult result = service.distribute(request().extraExclusions(List.of("^API_")).build());

        assertEquals(2, result.syncedCount());
        assertEquals(2, result.skippedCount());
    }

    @Test
    void conflictsAreSurfaced() {
        doAnswer(inv -> {
            WriteRequest req = inv.getArgument(0);
            return WriteOutcome.written(req, "h", req.scope().equals(SecretScope.ACTIONS), 1);
        }).when(scopeWriter).upsert(any());

        DistributionResult result = service.distribute(request().build());

        assertEquals(1, result.conflicts().size());
        assertEquals("API_KEY", result.conflicts().get(0).secretName());
        assertEquals(ErrorCode.CONFLICT_DETECTED.name(), result.conflicts().get(0).code());
    }

    @Test
    void slowWritesTimeOut() {
        doAnswer(inv -> {
            WriteRequest req = inv.getArgument(0);
            if (req.scope().equals(SecretScope.DEPENDABOT)) {
                Thread.sleep(5_000);
            }
            return WriteOutcome.written(req, "h", false, 1);
        }).when(scopeWriter).upsert(any());

        DistributionResult result = service.distribute(request().timeout(Duration.ofMillis(300)).build());

        assertEquals(4, result.syncedCount());
        assertEquals(1, result.errors().size());
        assertEquals(ErrorCode.WRITE_TIMED_OUT.name(), result.errors().get(0).code());
        verify(mappingStore).recordFailure(eq("demo"), eq("API_KEY"), eq("dependabot"), anyString(), anyString());
    }

    private DistributionRequest.Builder request() {
        return DistributionRequest.forProject("demo").actorId("test").correlationId("corr-1");
    }

    private Set<String> scopesFor(String mappingName) {
        return submitted.stream()
                .filter(r -> r.mappingName().equals(mappingName))
                .map(r -> r.scope().label())
                .collect(Collectors.toSet());
    }

    private List<AuditEntry> auditedEntries() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditRecorder, atLeastOnce()).record(captor.capture());
        return captor.getAllValues();
    }

    private static EnvironmentSpec argThatEnv(CanonicalEnvironment env) {
        return argThat(spec -> spec != null && spec.environment() == env);
    }

    private static Map<String, String> sampleValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("DATABASE_URL_DEV", "postgres://dev-host/app");
        values.put("DATABASE_URL_STAGING", "postgres://staging-host/app");
        values.put("API_KEY", "k-123456");
        values.put("GITHUB_TOKEN", "ghp_notforwarded");
        return Collections.unmodifiableMap(values);
    }
}
