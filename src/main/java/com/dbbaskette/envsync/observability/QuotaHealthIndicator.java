package com.dbbaskette.envsync.observability;

import com.dbbaskette.envsync.service.quota.QuotaSnapshot;
import com.dbbaskette.envsync.service.quota.QuotaTracker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Down while any tracked quota class sits below its safety margin, since every batch would abort.
 */
@Component("quota")
public class QuotaHealthIndicator implements HealthIndicator {

    private final QuotaTracker quotaTracker;

    public QuotaHealthIndicator(QuotaTracker quotaTracker) {
        this.quotaTracker = quotaTracker;
    }

    @Override
    public Health health() {
        List<QuotaSnapshot> low = quotaTracker.belowMargin();
        if (low.isEmpty()) {
            return Health.up().build();
        }
        Health.Builder builder = Health.down();
        for (QuotaSnapshot snapshot : low) {
            builder.withDetail(snapshot.projectId() + "." + snapshot.quotaType().name().toLowerCase(),
                    snapshot.remaining() + "/" + snapshot.limit() + " (resets " + snapshot.resetAt() + ")");
        }
        return builder.build();
    }
}
