package com.dbbaskette.envsync.service.distribution;

import java.time.Instant;

/**
 * Point-in-time sync state of a project.
 *
 * @param status one of {@code synced}, {@code pending}, {@code error}, {@code never_synced}
 */
public record SyncStatusReport(String projectId, Instant lastSyncAt, String status, long pendingCount,
                               long errorCount, long conflictCount, Instant nextScheduledSyncAt,
                               int coreRemaining, int secretsRemaining) {
}
