package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.model.SecretScope;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One distribution run.
 *
 * @param values          inline values; null means load them from the project's values file
 * @param secretNames     restricts the run to these names (suffixed or base); null means all
 * @param targetScopes    null means the configured default scopes plus every environment
 * @param timeout         null means the configured distribution timeout
 * @param extraExclusions run-local exclusion patterns
 */
public record DistributionRequest(String projectId, Map<String, String> values, Set<String> secretNames,
                                  List<SecretScope> targetScopes, boolean force, boolean dryRun, Duration timeout,
                                  List<String> extraExclusions, String actorId, String correlationId) {

    public DistributionRequest {
        values = values == null ? null : new LinkedHashMap<>(values);
        secretNames = secretNames == null || secretNames.isEmpty() ? null : new LinkedHashSet<>(secretNames);
        targetScopes = targetScopes == null || targetScopes.isEmpty() ? null : List.copyOf(targetScopes);
        extraExclusions = extraExclusions == null ? List.of() : List.copyOf(extraExclusions);
    }

    public static Builder forProject(String projectId) {
        return new Builder(projectId);
    }

    public boolean isSingleSecret() {
        return secretNames != null && secretNames.size() == 1;
    }

    @Override
    public String toString() {
        return "DistributionRequest[" + projectId + ", names=" + secretNames + ", scopes=" + targetScopes
                + ", force=" + force + ", dryRun=" + dryRun + "]";
    }

    public static final class Builder {
        private final String projectId;
        private Map<String, String> values;
        private Set<String> secretNames;
        private List<SecretScope> targetScopes;
        private boolean force;
        private boolean dryRun;
        private Duration timeout;
        private List<String> extraExclusions;
        private String actorId = "system";
        private String correlationId;

        private Builder(String projectId) {
            this.projectId = projectId;
        }

        public Builder values(Map<String, String> values) { this.values = values; return this; }
        public Builder secretNames(Set<String> secretNames) { this.secretNames = secretNames; return this; }
        public Builder targetScopes(List<SecretScope> targetScopes) { this.targetScopes = targetScopes; return this; }
        public Builder force(boolean force) { this.force = force; return this; }
        public Builder dryRun(boolean dryRun) { this.dryRun = dryRun; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder extraExclusions(List<String> extraExclusions) { this.extraExclusions = extraExclusions; return this; }
        public Builder actorId(String actorId) { this.actorId = actorId; return this; }
        public Builder correlationId(String correlationId) { this.correlationId = correlationId; return this; }

        public DistributionRequest build() {
            return new DistributionRequest(projectId, values, secretNames, targetScopes, force, dryRun, timeout,
                    extraExclusions, actorId, correlationId);
        }
    }
}
