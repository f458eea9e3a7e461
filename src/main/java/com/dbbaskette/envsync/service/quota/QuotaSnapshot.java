package com.dbbaskette.envsync.service.quota;

import com.dbbaskette.envsync.model.QuotaType;
import java.time.Instant;

public record QuotaSnapshot(String projectId, QuotaType quotaType, int remaining, int limit,
                            Instant resetAt, Instant lastCheckedAt, int safetyMargin) {

    public boolean belowMargin() {
        return remaining < safetyMargin;
    }
}
