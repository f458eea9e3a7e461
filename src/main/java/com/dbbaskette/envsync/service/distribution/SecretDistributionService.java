package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.CredentialMissingException;
import com.dbbaskette.envsync.error.ErrorCode;
import com.dbbaskette.envsync.error.RateLimitExhaustedException;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.model.SyncOperation;
import com.dbbaskette.envsync.observability.CorrelationIdFilter;
import com.dbbaskette.envsync.observability.EnvSyncMetrics;
import com.dbbaskette.envsync.security.SecretNameValidator;
import com.dbbaskette.envsync.service.audit.AuditEntry;
import com.dbbaskette.envsync.service.audit.AuditRecorder;
import com.dbbaskette.envsync.service.classify.ExclusionRules;
import com.dbbaskette.envsync.service.classify.ExclusionService;
import com.dbbaskette.envsync.service.classify.NameClassifier;
import com.dbbaskette.envsync.service.classify.SecretKey;
import com.dbbaskette.envsync.service.environment.EnsureResult;
import com.dbbaskette.envsync.service.environment.EnvironmentPolicies;
import com.dbbaskette.envsync.service.environment.EnvironmentProvisioner;
import com.dbbaskette.envsync.service.environment.EnvironmentSpec;
import com.dbbaskette.envsync.service.github.RepoRef;
import com.dbbaskette.envsync.service.quota.QuotaTracker;
import com.dbbaskette.envsync.service.values.SecretValueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Runs one distribution cycle for a project:
 * exclude and classify names, preflight the quota, ensure environments, write every
 * (name, scope) pair with bounded parallelism, then audit the aggregate.
 *
 * <p>Only the quota preflight and a missing credential abort a run; everything else is
 * collected into the result.
 */
@Service
public class SecretDistributionService {

    private static final Logger log = LoggerFactory.getLogger(SecretDistributionService.class);

    private final ProjectResolver projects;
    private final SecretValueSource valueSource;
    private final ExclusionService exclusionService;
    private final QuotaTracker quotaTracker;
    private final EnvironmentProvisioner provisioner;
    private final EnvironmentPolicies policies;
    private final ScopeWriter scopeWriter;
    private final SecretMappingStore mappingStore;
    private final BoundedWriteExecutor executor;
    private final AuditRecorder auditRecorder;
    private final EnvSyncProperties properties;
    private final EnvSyncMetrics metrics;
    private final Clock clock;

    public SecretDistributionService(ProjectResolver projects, SecretValueSource valueSource,
                                     ExclusionService exclusionService, QuotaTracker quotaTracker,
                                     EnvironmentProvisioner provisioner, EnvironmentPolicies policies,
                                     ScopeWriter scopeWriter, SecretMappingStore mappingStore,
                                     BoundedWriteExecutor executor, AuditRecorder auditRecorder,
                                     EnvSyncProperties properties, EnvSyncMetrics metrics, Clock clock) {
        this.projects = projects;
        this.valueSource = valueSource;
        this.exclusionService = exclusionService;
        this.quotaTracker = quotaTracker;
        this.provisioner = provisioner;
        this.policies = policies;
        this.scopeWriter = scopeWriter;
        this.mappingStore = mappingStore;
        this.executor = executor;
        this.auditRecorder = auditRecorder;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public DistributionResult distribute(DistributionRequest request) {
        long started = clock.millis();
        String correlationId = request.correlationId() != null ? request.correlationId() : CorrelationIdFilter.currentOrNew();
        ProjectRepo project = projects.require(request.projectId());
        RepoRef repo = RepoRef.of(project);
        if (!request.dryRun() && !properties.getGithub().hasToken()) {
            throw new CredentialMissingException();
        }

        Map<String, String> values = new TreeMap<>(request.values() != null ? request.values() : valueSource.load(project));
        ExclusionRules rules = exclusionService.rulesFor(project.getProjectId(), request.extraExclusions());
        List<SecretScope> targets = resolveTargets(request.targetScopes());

        List<SyncError> errors = new ArrayList<>();
        List<WriteRequest> writes = new ArrayList<>();
        int skipped = 0;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String name = entry.getKey();
            if (!selected(name, request.secretNames())) continue;
            if (!SecretNameValidator.isValid(name)) {
                errors.add(new SyncError(name, null, ErrorCode.VALIDATION_ERROR.name(),
                        "Secret name must match ^[A-Z][A-Z0-9_]*$"));
                continue;
            }
            String value = entry.getValue();
            if (value == null || value.isEmpty()) {
                skipped++;
                continue;
            }
            Optional<ExclusionRules.Rule> exclusion = rules.match(name);
            if (exclusion.isPresent()) {
                skipped++;
                metrics.recordSkipped();
                log.info("Excluded {} ({})", name, exclusion.get().reason());
                if (!request.dryRun()) {
                    mappingStore.recordExcluded(project.getProjectId(), name, ValueHasher.sha256Hex(value));
                }
                continue;
            }
            SecretKey key = NameClassifier.classify(name);
            if (key.isGlobal()) {
                for (SecretScope scope : targets) {
                    if (!scope.isEnvironment()) {
                        writes.add(new WriteRequest(repo, scope, name, name, value, false, request.force(), request.dryRun()));
                    }
                }
            } else if (targets.contains(key.environmentScope())) {
                writes.add(new WriteRequest(repo, key.environmentScope(), key.baseName(), name, value, false,
                        request.force(), request.dryRun()));
            }
        }

        Set<CanonicalEnvironment> environments = environmentsToEnsure(targets, writes, request.secretNames() == null);
        Set<String> singleSecretExisted = new LinkedHashSet<>();
        if (request.isSingleSecret()) {
            writes.stream().map(WriteRequest::mappingName).distinct()
                    .filter(name -> mappingStore.exists(project.getProjectId(), name))
                    .forEach(singleSecretExisted::add);
        }

        try {
            preflight(project.getProjectId(), writes, environments, request.dryRun());
        } catch (RateLimitExhaustedException e) {
            metrics.recordQuotaAbort();
            log.error("Distribution for {} aborted before any call: {}", project.getProjectId(), e.getMessage());
            Map<String, Boolean> scopeOutcomes = new LinkedHashMap<>();
            writes.forEach(w -> scopeOutcomes.put(w.scope().label(), false));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("aborted", e.getCode().name());
            metadata.put("quotaType", e.getQuotaType().name());
            metadata.put("remaining", e.getRemaining());
            metadata.put("plannedWrites", writes.size());
            auditRecorder.record(new AuditEntry(project.getProjectId(), request.actorId(), SyncOperation.SYNC_ALL,
                    null, scopeOutcomes, correlationId, clock.millis() - started, metadata));
            throw e;
        }

        List<EnvironmentSummary> environmentSummaries = new ArrayList<>();
        Map<CanonicalEnvironment, SyncError> failedEnvironments = new EnumMap<>(CanonicalEnvironment.class);
        for (CanonicalEnvironment env : environments) {
            if (request.dryRun()) {
                log.info("[DRY RUN] would ensure environment {} of {}", env.remoteName(), repo.fullName());
                environmentSummaries.add(new EnvironmentSummary(env.remoteName(), "planned", "planned"));
                continue;
            }
            EnsureResult ensured = provisioner.ensure(repo, EnvironmentSpec.policyOnly(env,
                    policies.rulesFor(project.getProjectId(), env),
                    policies.linkedResourcesFor(project.getProjectId(), env)), request.force());
            environmentSummaries.add(new EnvironmentSummary(env.remoteName(),
                    ensured.action().name().toLowerCase(), ensured.status().name().toLowerCase()));
            if (!ensured.isActive()) {
                errors.addAll(ensured.errors());
                failedEnvironments.put(env, ensured.errors().isEmpty() ? null : ensured.errors().get(0));
            }
        }

        List<WriteOutcome> outcomes = new ArrayList<>();
        List<WriteRequest> runnable = new ArrayList<>();
        for (WriteRequest write : writes) {
            if (write.scope().isEnvironment() && failedEnvironments.containsKey(write.scope().environment())) {
                SyncError cause = failedEnvironments.get(write.scope().environment());
                outcomes.add(WriteOutcome.failed(write, ValueHasher.sha256Hex(write.value()),
                        cause != null ? ErrorCode.valueOf(cause.code()) : ErrorCode.GITHUB_SCOPE_UNREACHABLE,
                        "Environment " + write.scope().environment().remoteName() + " was not provisioned", 0));
            } else {
                runnable.add(write);
            }
        }

        Duration timeout = request.timeout() != null ? request.timeout()
                : Duration.ofSeconds(properties.getDistribution().getTimeoutSeconds());
        List<Callable<WriteOutcome>> tasks = new ArrayList<>(runnable.size());
        for (WriteRequest write : runnable) {
            tasks.add(() -> scopeWriter.upsert(write));
        }
        outcomes.addAll(executor.runAll(tasks, timeout, (index, failure) -> unfinished(runnable.get(index), failure, timeout)));

        recordEnvironmentSecrets(project.getProjectId(), outcomes);

        int synced = 0;
        int planned = 0;
        List<SyncError> conflicts = new ArrayList<>();
        for (WriteOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case WRITTEN -> synced++;
                case PLANNED -> planned++;
                case SKIPPED -> skipped++;
                case FAILED -> errors.add(SyncError.of(outcome));
            }
            if (outcome.conflict()) {
                conflicts.add(new SyncError(outcome.secretName(), outcome.scope().label(),
                        ErrorCode.CONFLICT_DETECTED.name(), "Stored value differed; write applied and flagged"));
            }
        }

        long durationMs = clock.millis() - started;
        DistributionResult result = new DistributionResult(project.getProjectId(), synced, skipped, planned,
                List.copyOf(errors), List.copyOf(conflicts), List.copyOf(environmentSummaries), correlationId,
                durationMs, request.dryRun());

        audit(request, result, outcomes, failedEnvironments.keySet(), singleSecretExisted);
        metrics.recordDistribution(durationMs);
        log.info("{}Distribution for {} finished in {} ms: {} written, {} planned, {} skipped, {} errors, {} conflicts",
                request.dryRun() ? "[DRY RUN] " : "", project.getProjectId(), durationMs, synced, planned, skipped,
                result.errors().size(), conflicts.size());
        return result;
    }

    private void preflight(String projectId, List<WriteRequest> writes, Set<CanonicalEnvironment> environments,
                           boolean dryRun) {
        long keyFetches = writes.stream().map(WriteRequest::scope).distinct().count();
        Map<QuotaType, Integer> estimate = new EnumMap<>(QuotaType.class);
        estimate.put(QuotaType.CORE, writes.size() + (int) keyFetches + environments.size() * 2);
        if (dryRun) {
            quotaTracker.checkBatch(projectId, estimate);
        } else {
            quotaTracker.reserveBatch(projectId, estimate);
        }
    }

    private WriteOutcome unfinished(WriteRequest write, Throwable failure, Duration timeout) {
        String hash = ValueHasher.sha256Hex(write.value());
        ErrorCode code;
        String message;
        if (failure instanceof CancellationException || failure instanceof InterruptedException) {
            code = ErrorCode.WRITE_TIMED_OUT;
            message = "Write did not finish within " + timeout.toSeconds() + "s";
        } else {
            code = ErrorCode.INTERNAL_ERROR;
            message = failure != null ? failure.getClass().getSimpleName() + ": " + failure.getMessage() : "Unknown failure";
        }
        log.warn("Write of {} to {} did not complete: {}", write.remoteName(), write.scope(), message);
        if (!write.dryRun()) {
            try {
                mappingStore.recordFailure(write.repo().projectId(), write.mappingName(), write.scope().label(), hash, message);
            } catch (RuntimeException e) {
                log.warn("Could not record failure of {} in {}: {}", write.mappingName(), write.scope(), e.getMessage());
            }
        }
        return WriteOutcome.failed(write, hash, code, message, 0);
    }

    private void recordEnvironmentSecrets(String projectId, List<WriteOutcome> outcomes) {
        Map<CanonicalEnvironment, List<String>> written = new EnumMap<>(CanonicalEnvironment.class);
        for (WriteOutcome outcome : outcomes) {
            if (outcome.status() == WriteStatus.WRITTEN && outcome.scope().isEnvironment()) {
                written.computeIfAbsent(outcome.scope().environment(), e -> new ArrayList<>())
                        .add(NameClassifier.classify(outcome.secretName()).baseName());
            }
        }
        written.forEach((env, names) -> provisioner.recordSecretWrites(projectId, env, names));
    }

    private void audit(DistributionRequest request, DistributionResult result, List<WriteOutcome> outcomes,
                       Set<CanonicalEnvironment> failedEnvironments, Set<String> singleSecretExisted) {
        Map<String, Boolean> scopeOutcomes = scopeOutcomes(outcomes);
        failedEnvironments.forEach(env -> scopeOutcomes.put(SecretScope.environment(env).label(), false));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("dryRun", request.dryRun());
        metadata.put("force", request.force());
        metadata.put("written", result.syncedCount());
        metadata.put("planned", result.plannedCount());
        metadata.put("skipped", result.skippedCount());
        metadata.put("failed", result.errors().size());
        metadata.put("conflicts", result.conflicts().size());
        metadata.put("environments", result.environments().stream()
                .map(e -> e.name() + ":" + e.action() + ":" + e.status()).toList());
        metadata.put("errors", result.errors().stream()
                .map(e -> Map.of("secretName", String.valueOf(e.secretName()), "scope", String.valueOf(e.scope()),
                        "code", String.valueOf(e.code())))
                .toList());
        auditRecorder.record(new AuditEntry(request.projectId(), request.actorId(), SyncOperation.SYNC_ALL, null,
                scopeOutcomes, result.correlationId(), result.durationMs(), metadata));

        if (request.isSingleSecret()) {
            String requested = request.secretNames().iterator().next();
            List<WriteOutcome> own = outcomes.stream()
                    .filter(o -> o.secretName().equals(requested)
                            || NameClassifier.classify(o.secretName()).baseName().equals(requested))
                    .toList();
            String secretName = own.isEmpty() ? requested : own.get(0).secretName();
            SyncOperation operation = singleSecretExisted.contains(secretName) ? SyncOperation.UPDATE : SyncOperation.CREATE;
            Map<String, Object> secretMetadata = new LinkedHashMap<>();
            secretMetadata.put("dryRun", request.dryRun());
            secretMetadata.put("force", request.force());
            secretMetadata.put("conflict", own.stream().anyMatch(WriteOutcome::conflict));
            auditRecorder.record(new AuditEntry(request.projectId(), request.actorId(), operation, secretName,
                    scopeOutcomes(own), result.correlationId(), result.durationMs(), secretMetadata));
        }
    }

    static Map<String, Boolean> scopeOutcomes(List<WriteOutcome> outcomes) {
        Map<String, Boolean> scopes = new LinkedHashMap<>();
        for (WriteOutcome outcome : outcomes) {
            if (outcome.status() == WriteStatus.SKIPPED) continue;
            scopes.merge(outcome.scope().label(), outcome.succeeded(), Boolean::logicalAnd);
        }
        return scopes;
    }

    List<SecretScope> resolveTargets(List<SecretScope> requested) {
        if (requested != null) return requested;
        List<SecretScope> targets = new ArrayList<>();
        for (String label : properties.getDistribution().getDefaultScopes()) {
            targets.add(SecretScope.parse(label));
        }
        for (CanonicalEnvironment env : CanonicalEnvironment.values()) {
            SecretScope scope = SecretScope.environment(env);
            if (!targets.contains(scope)) targets.add(scope);
        }
        return targets;
    }

    private static Set<CanonicalEnvironment> environmentsToEnsure(List<SecretScope> targets, List<WriteRequest> writes,
                                                                  boolean fullCycle) {
        Set<CanonicalEnvironment> envs = new LinkedHashSet<>();
        for (SecretScope scope : targets) {
            if (!scope.isEnvironment()) continue;
            boolean hasWrites = writes.stream().anyMatch(w -> scope.equals(w.scope()));
            if (fullCycle || hasWrites) envs.add(scope.environment());
        }
        return envs;
    }

    private static boolean selected(String name, Set<String> filter) {
        if (filter == null) return true;
        return filter.contains(name) || filter.contains(NameClassifier.classify(name).baseName());
    }
}
