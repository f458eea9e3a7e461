package com.dbbaskette.envsync.service.distribution;

import java.util.List;

/**
 * Aggregate outcome of a distribution run. Partial failure is a normal result, not an exception.
 */
public record DistributionResult(String projectId, int syncedCount, int skippedCount, int plannedCount,
                                 List<SyncError> errors, List<SyncError> conflicts,
                                 List<EnvironmentSummary> environments, String correlationId,
                                 long durationMs, boolean dryRun) {

    public boolean hasFailures() {
        return !errors.isEmpty();
    }
}
