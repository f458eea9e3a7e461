package com.dbbaskette.envsync.service.environment;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.CredentialMissingException;
import com.dbbaskette.envsync.error.InvalidRequestException;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.model.SyncOperation;
import com.dbbaskette.envsync.security.SecretNameValidator;
import com.dbbaskette.envsync.service.audit.AuditEntry;
import com.dbbaskette.envsync.service.audit.AuditRecorder;
import com.dbbaskette.envsync.service.classify.ExclusionRules;
import com.dbbaskette.envsync.service.classify.ExclusionService;
import com.dbbaskette.envsync.service.distribution.ProjectResolver;
import com.dbbaskette.envsync.service.distribution.SecretMappingStore;
import com.dbbaskette.envsync.service.distribution.SyncError;
import com.dbbaskette.envsync.service.distribution.ValueHasher;
import com.dbbaskette.envsync.service.github.RepoRef;
import com.dbbaskette.envsync.service.quota.QuotaTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provisions a caller-described set of environments: validates the batch, preflights the quota
 * for all of it, then ensures each environment and audits it individually.
 *
 * <p>Secrets matching an exclusion rule, by supplied or suffixed name, are never written. They
 * are recorded as excluded and come back as skipped writes.
 */
@Service
public class EnvironmentService {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentService.class);

    private final ProjectResolver projects;
    private final EnvironmentProvisioner provisioner;
    private final ExclusionService exclusionService;
    private final SecretMappingStore mappingStore;
    private final QuotaTracker quotaTracker;
    private final AuditRecorder auditRecorder;
    private final EnvSyncProperties properties;
    private final Clock clock;

    public EnvironmentService(ProjectResolver projects, EnvironmentProvisioner provisioner,
                              ExclusionService exclusionService, SecretMappingStore mappingStore,
                              QuotaTracker quotaTracker, AuditRecorder auditRecorder, EnvSyncProperties properties,
                              Clock clock) {
        this.projects = projects;
        this.provisioner = provisioner;
        this.exclusionService = exclusionService;
        this.mappingStore = mappingStore;
        this.quotaTracker = quotaTracker;
        this.auditRecorder = auditRecorder;
        this.properties = properties;
        this.clock = clock;
    }

    public ProvisionReport provision(String projectId, List<EnvironmentSpec> specs, boolean force,
                                     String actorId, String correlationId) {
        ProjectRepo project = projects.require(projectId);
        validate(specs);
        if (!properties.getGithub().hasToken()) {
            throw new CredentialMissingException();
        }
        RepoRef repo = RepoRef.of(project);

        ExclusionRules rules = exclusionService.rulesFor(projectId, List.of());
        Map<CanonicalEnvironment, Set<String>> excluded = new EnumMap<>(CanonicalEnvironment.class);
        int secretCount = 0;
        long scopesWithSecrets = 0;
        for (EnvironmentSpec spec : specs) {
            Set<String> names = excludedNames(spec, rules);
            excluded.put(spec.environment(), names);
            int writable = spec.secrets().size() - names.size();
            secretCount += writable;
            if (writable > 0) scopesWithSecrets++;
        }
        Map<QuotaType, Integer> estimate = new EnumMap<>(QuotaType.class);
        estimate.put(QuotaType.CORE, specs.size() * 2 + secretCount + (int) scopesWithSecrets);
        quotaTracker.reserveBatch(projectId, estimate);

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<ProvisionReport.EnvironmentError> errors = new ArrayList<>();
        for (EnvironmentSpec spec : specs) {
            long started = clock.millis();
            String name = spec.environment().remoteName();
            Set<String> skipped = excluded.get(spec.environment());
            recordExclusions(projectId, spec, skipped);
            EnsureResult result = provisioner.ensure(repo, spec, force, skipped);
            if (result.isActive()) {
                (result.action() == ProvisionAction.CREATED ? created : updated).add(name);
            }
            for (SyncError error : result.errors()) {
                String message = error.secretName() != null ? error.secretName() + ": " + error.message() : error.message();
                errors.add(new ProvisionReport.EnvironmentError(name, message, error.code()));
            }
            audit(projectId, actorId, correlationId, spec, skipped, result, clock.millis() - started);
        }
        log.info("Provisioned {} environments for {}: {} created, {} updated, {} errors", specs.size(), projectId,
                created.size(), updated.size(), errors.size());
        return new ProvisionReport(created, updated, errors, correlationId);
    }

    private static Set<String> excludedNames(EnvironmentSpec spec, ExclusionRules rules) {
        Set<String> names = new TreeSet<>();
        for (String name : spec.secrets().keySet()) {
            if (rules.isExcluded(name) || rules.isExcluded(suffixedName(name, spec.environment()))) {
                names.add(name);
            }
        }
        return names;
    }

    private void recordExclusions(String projectId, EnvironmentSpec spec, Set<String> names) {
        for (String name : names) {
            String mappingName = suffixedName(name, spec.environment());
            log.info("Excluded {} from environment {}", mappingName, spec.environment().remoteName());
            mappingStore.recordExcluded(projectId, mappingName, ValueHasher.sha256Hex(spec.secrets().get(name)));
        }
    }

    private static String suffixedName(String name, CanonicalEnvironment env) {
        return EnvironmentProvisioner.baseNameFor(name, env) + env.suffix();
    }

    private void audit(String projectId, String actorId, String correlationId, EnvironmentSpec spec,
                       Set<String> excludedNames, EnsureResult result, long durationMs) {
        Map<String, Boolean> scopeOutcomes = new LinkedHashMap<>();
        scopeOutcomes.put(SecretScope.environment(spec.environment()).label(),
                result.isActive() && result.errors().isEmpty());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("environment", spec.environment().remoteName());
        metadata.put("action", result.action().name().toLowerCase());
        metadata.put("status", result.status().name().toLowerCase());
        metadata.put("requiredReviewers", spec.rules().getRequiredReviewers());
        metadata.put("restrictToMainBranch", spec.rules().isRestrictToMainBranch());
        metadata.put("waitTimerMinutes", spec.rules().getWaitTimerMinutes());
        metadata.put("secretNames", List.copyOf(spec.secrets().keySet()));
        metadata.put("excludedSecrets", List.copyOf(excludedNames));
        metadata.put("errorCodes", result.errors().stream().map(SyncError::code).toList());
        SyncOperation operation = result.action() == ProvisionAction.CREATED ? SyncOperation.CREATE : SyncOperation.UPDATE;
        auditRecorder.record(new AuditEntry(projectId, actorId, operation, null, scopeOutcomes, correlationId,
                durationMs, metadata));
    }

    static void validate(List<EnvironmentSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new InvalidRequestException("At least one environment is required");
        }
        Set<CanonicalEnvironment> seen = new HashSet<>();
        for (EnvironmentSpec spec : specs) {
            if (spec.environment() == null) {
                throw new InvalidRequestException("Environment name must be one of dev, staging, production");
            }
            if (!seen.add(spec.environment())) {
                throw new InvalidRequestException("Environment " + spec.environment().remoteName() + " listed twice");
            }
            for (String secretName : spec.secrets().keySet()) {
                if (!SecretNameValidator.isValid(secretName)) {
                    throw new InvalidRequestException("Invalid secret name " + secretName
                            + " for " + spec.environment().remoteName());
                }
            }
            if (spec.rules().getRequiredReviewers() < 0 || spec.rules().getWaitTimerMinutes() < 0) {
                throw new InvalidRequestException("Protection rule values must not be negative");
            }
        }
    }
}
