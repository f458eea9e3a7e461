package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.EnvSyncException;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.observability.CorrelationIdFilter;
import com.dbbaskette.envsync.repository.ProjectRepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-distributes every project that has a values file on a fixed interval.
 */
@Component
public class ScheduledDistributionJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledDistributionJob.class);

    private final ProjectRepoRepository projects;
    private final SecretDistributionService distributionService;
    private final EnvSyncProperties properties;

    public ScheduledDistributionJob(ProjectRepoRepository projects, SecretDistributionService distributionService,
                                    EnvSyncProperties properties) {
        this.projects = projects;
        this.distributionService = distributionService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "#{${envsync.schedule.interval-hours:6} * 3600000}",
            initialDelayString = "#{${envsync.schedule.interval-hours:6} * 3600000}")
    public int runScheduled() {
        if (!properties.getSchedule().isEnabled()) {
            return 0;
        }
        int completed = 0;
        for (ProjectRepo project : projects.findByValuesFileIsNotNull()) {
            String correlationId = CorrelationIdFilter.newCorrelationId();
            MDC.put(CorrelationIdFilter.MDC_KEY, correlationId);
            try {
                DistributionResult result = distributionService.distribute(DistributionRequest
                        .forProject(project.getProjectId())
                        .actorId("scheduler")
                        .correlationId(correlationId)
                        .build());
                completed++;
                if (result.hasFailures()) {
                    log.warn("Scheduled distribution for {} finished with {} errors",
                            project.getProjectId(), result.errors().size());
                }
            } catch (EnvSyncException e) {
                log.error("Scheduled distribution for {} aborted: {} ({})", project.getProjectId(),
                        e.getMessage(), e.getCode());
            } finally {
                MDC.remove(CorrelationIdFilter.MDC_KEY);
            }
        }
        return completed;
    }
}
