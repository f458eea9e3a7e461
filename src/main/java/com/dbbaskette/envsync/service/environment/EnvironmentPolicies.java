package com.dbbaskette.envsync.service.environment;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.ProtectionRules;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Configured protection policy per project and environment. Environments without configuration
 * get the defaults: no protection for dev and staging, main-branch-only deployments for production.
 */
@Component
public class EnvironmentPolicies {

    private final EnvSyncProperties properties;

    public EnvironmentPolicies(EnvSyncProperties properties) {
        this.properties = properties;
    }

    public ProtectionRules rulesFor(String projectId, CanonicalEnvironment env) {
        return config(projectId, env)
                .map(cfg -> new ProtectionRules(cfg.getRequiredReviewers(), cfg.getReviewerIds(),
                        cfg.isRestrictToMainBranch(), cfg.getWaitTimerMinutes()))
                .orElseGet(() -> defaults(env));
    }

    /** Configured linked resources, or null to leave the stored map untouched. */
    public Map<String, String> linkedResourcesFor(String projectId, CanonicalEnvironment env) {
        return config(projectId, env)
                .map(EnvSyncProperties.EnvironmentConfig::getLinkedResources)
                .filter(resources -> !resources.isEmpty())
                .orElse(null);
    }

    static ProtectionRules defaults(CanonicalEnvironment env) {
        ProtectionRules rules = ProtectionRules.none();
        if (env == CanonicalEnvironment.PRODUCTION) {
            rules.setRestrictToMainBranch(true);
        }
        return rules;
    }

    private Optional<EnvSyncProperties.EnvironmentConfig> config(String projectId, CanonicalEnvironment env) {
        return properties.getProjects().stream()
                .filter(p -> p.getId().equals(projectId))
                .findFirst()
                .map(p -> p.getEnvironments().get(env.remoteName()));
    }
}
