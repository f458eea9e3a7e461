package com.dbbaskette.envsync.service.conflict;

import com.dbbaskette.envsync.MutableClock;
import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.model.ScopeSyncState;
import com.dbbaskette.envsync.model.SecretMapping;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.model.SyncOperation;
import com.dbbaskette.envsync.model.SyncStatus;
import com.dbbaskette.envsync.repository.SecretMappingRepository;
import com.dbbaskette.envsync.service.audit.AuditEntry;
import com.dbbaskette.envsync.service.audit.AuditRecorder;
import com.dbbaskette.envsync.service.distribution.ProjectResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConflictValidatorTest {

    private static final Instant T1 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant T2 = T1.plus(Duration.ofHours(2));
    private static final String HASH_A = "aaaaaaaa11111111aaaaaaaa11111111aaaaaaaa11111111aaaaaaaa11111111";
    private static final String HASH_B = "bbbbbbbb22222222bbbbbbbb22222222bbbbbbbb22222222bbbbbbbb22222222";

    private SecretMappingRepository repository;
    private AuditRecorder auditRecorder;
    private ConflictValidator validator;

    @BeforeEach
    void setUp() {
        repository = mock(SecretMappingRepository.class);
        auditRecorder = mock(AuditRecorder.class);
        ProjectResolver resolver = mock(ProjectResolver.class);
        when(resolver.require("demo")).thenReturn(new ProjectRepo("demo", "acme", "demo-app"));
        validator = new ConflictValidator(repository, resolver, auditRecorder, new EnvSyncProperties(),
                new MutableClock(T2));
    }

    @Test
    void fullySyncedMappingsAreValid() {
        when(repository.findByProjectId("demo")).thenReturn(List.of(
                mapping("API_KEY", "actions", HASH_A, T1, "codespaces", HASH_A, T1, "dependabot", HASH_A, T1)));

        ValidationResult result = validator.validate("demo", null, null, "api", "corr-1");

        assertTrue(result.valid());
        assertEquals(new ValidationResult.Summary(1, 0, 0, 1), result.summary());
        assertEquals(List.of(ConflictValidator.ALL_VALID), result.remediationSteps());
    }

    @Test
    void missingScopesAreListedWithRemediation() {
        when(repository.findByProjectIdAndSecretNameIn(eq("demo"), anyList())).thenReturn(List.of(
                mapping("API_KEY", "actions", HASH_A, T1)));

        ValidationResult result = validator.validate("demo", List.of("API_KEY", "REDIS_URL_DEV"), null, "api", "corr-2");

        assertFalse(result.valid());
        assertEquals(List.of(
                new MissingEntry("API_KEY", "codespaces"),
                new MissingEntry("API_KEY", "dependabot"),
                new MissingEntry("REDIS_URL_DEV", "environment:dev")), result.missing());
        assertEquals(2, result.summary().totalSecrets());
        assertEquals(0, result.summary().validCount());
        assertEquals("Add secret API_KEY to scopes: codespaces, dependabot (re-run distribution with these scopes included).",
                result.remediationSteps().get(0));
    }

    @Test
    void explicitTargetScopesNarrowTheCheck() {
        when(repository.findByProjectIdAndSecretNameIn(eq("demo"), anyList())).thenReturn(List.of(
                mapping("API_KEY", "actions", HASH_A, T1)));

        ValidationResult result = validator.validate("demo", List.of("API_KEY"), List.of(SecretScope.ACTIONS),
                "api", "corr-3");

        assertTrue(result.valid());
    }

    @Test
    void flaggedScopeIsConflict() {
        SecretMapping mapping = mapping("API_KEY", "actions", HASH_A, T1, "codespaces", HASH_B, T2, "dependabot", HASH_A, T1);
        mapping.getScopeStates().get("codespaces").setStatus(SyncStatus.CONFLICT);
        when(repository.findByProjectId("demo")).thenReturn(List.of(mapping));

        ValidationResult result = validator.validate("demo", null, null, "api", "corr-4");

        assertFalse(result.valid());
        ConflictEntry conflict = result.conflicts().get(0);
        assertEquals("API_KEY", conflict.secretName());
        assertEquals(List.of("actions", "codespaces", "dependabot"), conflict.scopes());
        assertEquals("aaaaaaaa", conflict.valueHashes().get("actions"));
        assertEquals("bbbbbbbb", conflict.valueHashes().get("codespaces"));
        assertTrue(result.remediationSteps().get(0).startsWith("Resolve conflict for API_KEY"));
    }

    @Test
    void differentHashesAtSameInstantAreNotConflict() {
        assertNull(ConflictValidator.conflictOf(mapping("API_KEY", "actions", HASH_A, T1, "codespaces", HASH_B, T1)));
        assertNotNull(ConflictValidator.conflictOf(mapping("API_KEY", "actions", HASH_A, T1, "codespaces", HASH_B, T2)));
    }

    @Test
    void excludedMappingsAreIgnoredByDefault() {
        SecretMapping excluded = new SecretMapping("demo", "GITHUB_TOKEN", HASH_A);
        excluded.setExcluded(true);
        when(repository.findByProjectId("demo")).thenReturn(List.of(excluded));

        ValidationResult result = validator.validate("demo", null, null, "api", "corr-5");

        assertTrue(result.valid());
        assertEquals(0, result.summary().totalSecrets());
    }

    @Test
    void validationIsAudited() {
        when(repository.findByProjectIdAndSecretNameIn(eq("demo"), anyList())).thenReturn(List.of());

        validator.validate("demo", List.of("API_KEY"), List.of(SecretScope.ACTIONS), "api", "corr-6");

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditRecorder).record(captor.capture());
        assertEquals(SyncOperation.VALIDATE, captor.getValue().operation());
        assertEquals(false, captor.getValue().scopeOutcomes().get("actions"));
        assertEquals(1, captor.getValue().metadata().get("missingCount"));
    }

    private static SecretMapping mapping(String name, Object... scopeHashTime) {
        SecretMapping mapping = new SecretMapping("demo", name, (String) scopeHashTime[1]);
        for (int i = 0; i < scopeHashTime.length; i += 3) {
            mapping.getScopeStates().put((String) scopeHashTime[i],
                    new ScopeSyncState((String) scopeHashTime[i + 1], SyncStatus.SYNCED, (Instant) scopeHashTime[i + 2], null));
        }
        mapping.recomputeStatus();
        return mapping;
    }
}
