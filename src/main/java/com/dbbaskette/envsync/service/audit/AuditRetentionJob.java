package com.dbbaskette.envsync.service.audit;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.repository.SyncEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drops audit events older than the retention period.
 */
@Component
public class AuditRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(AuditRetentionJob.class);

    private final SyncEventRepository repository;
    private final EnvSyncProperties properties;
    private final Clock clock;

    public AuditRetentionJob(SyncEventRepository repository, EnvSyncProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${envsync.audit.retention-cron:0 30 3 * * *}")
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getAudit().getRetentionDays()));
        int deleted = repository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged {} audit events older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
