package com.dbbaskette.envsync.service.environment;

import com.dbbaskette.envsync.error.EnvSyncException;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.EnvironmentRecord;
import com.dbbaskette.envsync.model.EnvironmentStatus;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.observability.EnvSyncMetrics;
import com.dbbaskette.envsync.repository.EnvironmentRecordRepository;
import com.dbbaskette.envsync.service.classify.NameClassifier;
import com.dbbaskette.envsync.service.classify.SecretKey;
import com.dbbaskette.envsync.service.distribution.ScopeWriter;
import com.dbbaskette.envsync.service.distribution.SyncError;
import com.dbbaskette.envsync.service.distribution.WriteOutcome;
import com.dbbaskette.envsync.service.distribution.WriteRequest;
import com.dbbaskette.envsync.service.distribution.WriteStatus;
import com.dbbaskette.envsync.service.github.GitHubSecretsClient;
import com.dbbaskette.envsync.service.github.RepoRef;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converges one canonical environment: exists remotely, carries the requested protection
 * policy and holds its secrets.
 *
 * <p>State moves {@code provisioning -> active}, or to {@code failed} when the policy cannot be
 * applied (an unknown reviewer, for instance). A failed policy skips the environment's secrets;
 * individual secret failures are collected and leave the environment active.
 */
@Service
public class EnvironmentProvisioner {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentProvisioner.class);

    private final GitHubSecretsClient client;
    private final ScopeWriter scopeWriter;
    private final EnvironmentRecordRepository repository;
    private final EnvSyncMetrics metrics;
    private final Clock clock;

    public EnvironmentProvisioner(GitHubSecretsClient client, ScopeWriter scopeWriter,
                                  EnvironmentRecordRepository repository, EnvSyncMetrics metrics, Clock clock) {
        this.client = client;
        this.scopeWriter = scopeWriter;
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    public EnsureResult ensure(RepoRef repo, EnvironmentSpec spec, boolean force) {
        return ensure(repo, spec, force, Set.of());
    }

    /**
     * @param excludedNames keys of {@code spec.secrets()} that are reported as skipped instead of written
     */
    public EnsureResult ensure(RepoRef repo, EnvironmentSpec spec, boolean force, Set<String> excludedNames) {
        CanonicalEnvironment env = spec.environment();
        EnvironmentRecord record = repository.findByProjectIdAndEnvironmentName(repo.projectId(), env)
                .orElseGet(() -> new EnvironmentRecord(repo.projectId(), env));
        List<SyncError> errors = new ArrayList<>();
        String scopeLabel = SecretScope.environment(env).label();

        ProvisionAction action = record.getRemoteEnvironmentId() == null ? ProvisionAction.CREATED : ProvisionAction.UPDATED;
        try {
            action = client.getEnvironment(repo, env.remoteName()).isPresent()
                    ? ProvisionAction.UPDATED : ProvisionAction.CREATED;
            record.setStatus(EnvironmentStatus.PROVISIONING);
            repository.save(record);

            JsonNode remote = client.putEnvironment(repo, env.remoteName(), spec.rules());
            if (remote != null && remote.hasNonNull("id")) {
                record.setRemoteEnvironmentId(remote.get("id").asLong());
            }
            record.setProtectionRules(spec.rules().copy());
        } catch (EnvSyncException e) {
            log.warn("Environment {} of {} failed: {}", env.remoteName(), repo.fullName(), e.getMessage());
            record.setStatus(EnvironmentStatus.FAILED);
            record.setLastError(e.getMessage());
            repository.save(record);
            metrics.recordEnvironment(false);
            errors.add(SyncError.of(null, scopeLabel, e));
            return new EnsureResult(env, action, EnvironmentStatus.FAILED, errors, List.of());
        }

        List<WriteOutcome> writes = new ArrayList<>();
        for (Map.Entry<String, String> secret : spec.secrets().entrySet()) {
            String baseName = baseNameFor(secret.getKey(), env);
            boolean excluded = excludedNames.contains(secret.getKey());
            WriteOutcome outcome = scopeWriter.upsert(new WriteRequest(repo, SecretScope.environment(env), baseName,
                    baseName + env.suffix(), secret.getValue(), excluded, force, false));
            writes.add(outcome);
            if (outcome.succeeded()) {
                record.touchSecret(baseName, clock.instant());
            } else if (outcome.status() != WriteStatus.SKIPPED) {
                errors.add(SyncError.of(outcome));
            }
        }

        if (spec.linkedResources() != null) {
            record.setLinkedResources(spec.linkedResources());
        }
        record.setStatus(EnvironmentStatus.ACTIVE);
        record.setLastError(null);
        repository.save(record);
        metrics.recordEnvironment(true);
        log.info("Environment {} of {} {} ({} secrets, {} errors)", env.remoteName(), repo.fullName(),
                action == ProvisionAction.CREATED ? "created" : "updated", writes.size(), errors.size());
        return new EnsureResult(env, action, EnvironmentStatus.ACTIVE, errors, writes);
    }

    /**
     * Notes secrets written to an environment outside {@link #ensure}, by a distribution run.
     */
    public void recordSecretWrites(String projectId, CanonicalEnvironment env, Collection<String> baseNames) {
        if (baseNames.isEmpty()) return;
        Instant now = clock.instant();
        repository.findByProjectIdAndEnvironmentName(projectId, env).ifPresent(record -> {
            baseNames.forEach(name -> record.touchSecret(name, now));
            repository.save(record);
        });
    }

    static String baseNameFor(String name, CanonicalEnvironment env) {
        SecretKey key = NameClassifier.classify(name);
        return key.environment() == env ? key.baseName() : name;
    }
}
