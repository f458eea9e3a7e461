package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.EnvSyncException;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.model.SecretMapping;
import com.dbbaskette.envsync.model.SyncStatus;
import com.dbbaskette.envsync.repository.SecretMappingRepository;
import com.dbbaskette.envsync.service.github.GitHubSecretsClient;
import com.dbbaskette.envsync.service.github.RepoRef;
import com.dbbaskette.envsync.service.quota.QuotaTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Service
public class SyncStatusService {

    private static final Logger log = LoggerFactory.getLogger(SyncStatusService.class);

    private final ProjectResolver projects;
    private final SecretMappingRepository mappings;
    private final QuotaTracker quotaTracker;
    private final GitHubSecretsClient client;
    private final EnvSyncProperties properties;
    private final Clock clock;

    public SyncStatusService(ProjectResolver projects, SecretMappingRepository mappings, QuotaTracker quotaTracker,
                             GitHubSecretsClient client, EnvSyncProperties properties, Clock clock) {
        this.projects = projects;
        this.mappings = mappings;
        this.quotaTracker = quotaTracker;
        this.client = client;
        this.properties = properties;
        this.clock = clock;
    }

    public SyncStatusReport status(String projectId) {
        ProjectRepo project = projects.require(projectId);
        refreshFromRemote(project);

        List<SecretMapping> all = mappings.findByProjectId(projectId);
        long pending = all.stream().filter(m -> m.getSyncStatus() == SyncStatus.PENDING).count();
        long failed = all.stream().filter(m -> m.getSyncStatus() == SyncStatus.FAILED).count();
        long conflicts = all.stream().filter(m -> m.getSyncStatus() == SyncStatus.CONFLICT).count();
        Instant lastSyncAt = all.stream()
                .map(SecretMapping::getLastSyncedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);

        String status;
        if (all.isEmpty()) {
            status = "never_synced";
        } else if (failed > 0) {
            status = "error";
        } else if (pending > 0) {
            status = "pending";
        } else {
            status = "synced";
        }

        Duration interval = Duration.ofHours(properties.getSchedule().getIntervalHours());
        Instant next = (lastSyncAt != null ? lastSyncAt : clock.instant()).plus(interval);
        return new SyncStatusReport(projectId, lastSyncAt, status, pending, failed, conflicts, next,
                quotaTracker.snapshot(projectId, QuotaType.CORE).remaining(),
                quotaTracker.snapshot(projectId, QuotaType.SECRETS).remaining());
    }

    /**
     * Pulls the current core and GraphQL windows from {@code GET /rate_limit}. A failed refresh
     * leaves the locally tracked counters in place.
     */
    public void refreshFromRemote(ProjectRepo project) {
        if (!properties.getGithub().hasToken()) return;
        try {
            client.refreshRateLimits(RepoRef.of(project));
        } catch (EnvSyncException e) {
            log.warn("Rate limit refresh for {} failed: {}", project.getProjectId(), e.getMessage());
        }
    }
}
