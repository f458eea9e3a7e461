package com.dbbaskette.envsync.observability;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.service.github.GitHubSecretsClient;
import com.dbbaskette.envsync.service.github.RepoRef;
import com.dbbaskette.envsync.service.quota.QuotaSnapshot;
import com.dbbaskette.envsync.service.quota.QuotaTracker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Calls {@code GET /rate_limit} with the configured token. The call doubles as a quota
 * refresh for the first configured project.
 */
@Component("gitHub")
public class GitHubHealthIndicator implements HealthIndicator {

    private static final String HEALTH_PROJECT = "_health";

    private final GitHubSecretsClient client;
    private final QuotaTracker quotaTracker;
    private final EnvSyncProperties properties;

    public GitHubHealthIndicator(GitHubSecretsClient client, QuotaTracker quotaTracker, EnvSyncProperties properties) {
        this.client = client;
        this.quotaTracker = quotaTracker;
        this.properties = properties;
    }

    @Override
    public Health health() {
        if (!properties.getGithub().hasToken()) {
            return Health.down().withDetail("reason", "GitHub token not configured").build();
        }
        RepoRef target = properties.getProjects().isEmpty()
                ? new RepoRef(HEALTH_PROJECT, "", "")
                : toRepoRef(properties.getProjects().get(0));
        try {
            client.refreshRateLimits(target);
        } catch (RuntimeException e) {
            return Health.down()
                    .withDetail("reason", "GitHub API unreachable")
                    .withDetail("error", e.getMessage())
                    .build();
        }
        QuotaSnapshot core = quotaTracker.snapshot(target.projectId(), QuotaType.CORE);
        return Health.up()
                .withDetail("apiUrl", properties.getGithub().getApiUrl())
                .withDetail("coreRemaining", core.remaining() + "/" + core.limit())
                .build();
    }

    private static RepoRef toRepoRef(EnvSyncProperties.ProjectConfig project) {
        return new RepoRef(project.getId(), project.getOwner(), project.getRepo());
    }
}
