package com.dbbaskette.envsync.service.conflict;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.model.ScopeSyncState;
import com.dbbaskette.envsync.model.SecretMapping;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.model.SyncOperation;
import com.dbbaskette.envsync.model.SyncStatus;
import com.dbbaskette.envsync.repository.SecretMappingRepository;
import com.dbbaskette.envsync.service.audit.AuditEntry;
import com.dbbaskette.envsync.service.audit.AuditRecorder;
import com.dbbaskette.envsync.service.classify.NameClassifier;
import com.dbbaskette.envsync.service.classify.SecretKey;
import com.dbbaskette.envsync.service.distribution.ProjectResolver;
import com.dbbaskette.envsync.service.distribution.ValueHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reports required secrets that are missing from a target scope and secrets whose recorded
 * hashes disagree across scopes. Works from the mapping table only; GitHub never returns
 * secret values, so edits made directly on GitHub stay invisible until the next write.
 */
@Service
public class ConflictValidator {

    private static final Logger log = LoggerFactory.getLogger(ConflictValidator.class);

    static final String ALL_VALID = "All secrets valid. No action required.";

    private final SecretMappingRepository repository;
    private final ProjectResolver projects;
    private final AuditRecorder auditRecorder;
    private final EnvSyncProperties properties;
    private final Clock clock;

    public ConflictValidator(SecretMappingRepository repository, ProjectResolver projects,
                             AuditRecorder auditRecorder, EnvSyncProperties properties, Clock clock) {
        this.repository = repository;
        this.projects = projects;
        this.auditRecorder = auditRecorder;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param requiredNames names to check; null or empty means every non-excluded recorded mapping
     * @param targetScopes  repository-level scopes global names must reach; null means the configured defaults.
     *                      Environment-suffixed names are always checked against their own environment.
     */
    public ValidationResult validate(String projectId, List<String> requiredNames, List<SecretScope> targetScopes,
                                     String actorId, String correlationId) {
        long started = clock.millis();
        projects.require(projectId);

        List<SecretMapping> mappings = requiredNames == null || requiredNames.isEmpty()
                ? repository.findByProjectId(projectId)
                : repository.findByProjectIdAndSecretNameIn(projectId, requiredNames);
        Map<String, SecretMapping> byName = mappings.stream()
                .collect(Collectors.toMap(SecretMapping::getSecretName, Function.identity(), (a, b) -> a));
        Set<String> required = new TreeSet<>();
        if (requiredNames == null || requiredNames.isEmpty()) {
            mappings.stream().filter(m -> !m.isExcluded()).map(SecretMapping::getSecretName).forEach(required::add);
        } else {
            required.addAll(requiredNames);
        }
        List<String> repoScopes = repositoryScopes(targetScopes);

        List<MissingEntry> missing = new ArrayList<>();
        List<ConflictEntry> conflicts = new ArrayList<>();
        Set<String> invalidNames = new HashSet<>();
        Map<String, Boolean> scopeOutcomes = new LinkedHashMap<>();

        for (String name : required) {
            List<String> expected = expectedScopes(name, repoScopes);
            expected.forEach(scope -> scopeOutcomes.putIfAbsent(scope, true));
            SecretMapping mapping = byName.get(name);
            for (String scope : expected) {
                ScopeSyncState state = mapping == null ? null : mapping.getScopeStates().get(scope);
                if (state == null || state.getValueHash() == null) {
                    missing.add(new MissingEntry(name, scope));
                    scopeOutcomes.put(scope, false);
                    invalidNames.add(name);
                }
            }
            if (mapping != null) {
                ConflictEntry conflict = conflictOf(mapping);
                if (conflict != null) {
                    conflicts.add(conflict);
                    conflict.scopes().forEach(scope -> scopeOutcomes.put(scope, false));
                    invalidNames.add(name);
                }
            }
        }

        List<String> steps = remediationSteps(missing, conflicts);
        boolean valid = missing.isEmpty() && conflicts.isEmpty();
        ValidationResult.Summary summary = new ValidationResult.Summary(required.size(), missing.size(),
                conflicts.size(), required.size() - invalidNames.size());
        long durationMs = clock.millis() - started;
        ValidationResult result = new ValidationResult(valid, List.copyOf(missing), List.copyOf(conflicts), summary,
                steps, correlationId, durationMs);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("totalSecrets", summary.totalSecrets());
        metadata.put("missingCount", summary.missingCount());
        metadata.put("conflictCount", summary.conflictCount());
        auditRecorder.record(new AuditEntry(projectId, actorId, SyncOperation.VALIDATE, null, scopeOutcomes,
                correlationId, durationMs, metadata));
        log.info("Validated {} secrets of {}: {} missing, {} conflicts", required.size(), projectId,
                missing.size(), conflicts.size());
        return result;
    }

    /**
     * A mapping conflicts when a scope is flagged as conflicting or when two scopes hold different
     * hashes recorded at different times.
     */
    static ConflictEntry conflictOf(SecretMapping mapping) {
        boolean flagged = false;
        Set<String> hashes = new HashSet<>();
        Set<Instant> times = new HashSet<>();
        Map<String, String> fingerprints = new LinkedHashMap<>();
        for (Map.Entry<String, ScopeSyncState> entry : new TreeMap<>(mapping.getScopeStates()).entrySet()) {
            ScopeSyncState state = entry.getValue();
            if (state.getStatus() == SyncStatus.CONFLICT) flagged = true;
            if (state.getValueHash() == null) continue;
            hashes.add(state.getValueHash());
            if (state.getLastSyncedAt() != null) times.add(state.getLastSyncedAt());
            fingerprints.put(entry.getKey(), ValueHasher.fingerprint(state.getValueHash()));
        }
        boolean diverged = hashes.size() > 1 && times.size() > 1;
        if (!flagged && !diverged) return null;
        return new ConflictEntry(mapping.getSecretName(), List.copyOf(fingerprints.keySet()), fingerprints);
    }

    static List<String> remediationSteps(List<MissingEntry> missing, List<ConflictEntry> conflicts) {
        List<String> steps = new ArrayList<>();
        Map<String, List<String>> missingBySecret = new LinkedHashMap<>();
        for (MissingEntry entry : missing) {
            missingBySecret.computeIfAbsent(entry.secretName(), k -> new ArrayList<>()).add(entry.scope());
        }
        missingBySecret.forEach((secret, scopes) -> steps.add("Add secret " + secret + " to scopes: "
                + String.join(", ", scopes) + " (re-run distribution with these scopes included)."));
        for (ConflictEntry conflict : conflicts) {
            steps.add("Resolve conflict for " + conflict.secretName()
                    + ": re-run distribution with force=true so the source of truth overwrites every scope.");
        }
        if (steps.isEmpty()) {
            steps.add(ALL_VALID);
        }
        return List.copyOf(steps);
    }

    private List<String> repositoryScopes(List<SecretScope> targetScopes) {
        Set<String> labels = new LinkedHashSet<>();
        if (targetScopes == null || targetScopes.isEmpty()) {
            for (String label : properties.getDistribution().getDefaultScopes()) {
                SecretScope scope = SecretScope.parse(label);
                if (!scope.isEnvironment()) labels.add(scope.label());
            }
        } else {
            targetScopes.stream().filter(s -> !s.isEnvironment()).map(SecretScope::label).forEach(labels::add);
        }
        return new ArrayList<>(labels);
    }

    private static List<String> expectedScopes(String name, List<String> repoScopes) {
        SecretKey key = NameClassifier.classify(name);
        return key.isGlobal() ? repoScopes : List.of(key.environmentScope().label());
    }
}
