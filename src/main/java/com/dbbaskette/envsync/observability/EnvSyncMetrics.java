package com.dbbaskette.envsync.observability;

import com.dbbaskette.envsync.model.SecretScope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized Micrometer metrics for secret distribution.
 */
@Component
public class EnvSyncMetrics {

    private final Counter secretsSkipped;
    private final Counter conflicts;
    private final Counter quotaAborts;
    private final Counter githubApiCalls;
    private final Counter environmentsProvisioned;
    private final Counter environmentsFailed;
    private final Timer distributionDuration;
    private final MeterRegistry registry;

    public EnvSyncMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.secretsSkipped = Counter.builder("envsync.secrets.skipped")
                .description("Secrets skipped because they matched an exclusion pattern")
                .register(registry);

        this.conflicts = Counter.builder("envsync.secrets.conflicts")
                .description("Writes that replaced a different stored value without force")
                .register(registry);

        this.quotaAborts = Counter.builder("envsync.runs.quota_aborted")
                .description("Distribution runs aborted by the quota preflight")
                .register(registry);

        this.githubApiCalls = Counter.builder("envsync.github.api.calls")
                .description("Total GitHub API calls made")
                .register(registry);

        this.environmentsProvisioned = Counter.builder("envsync.environments.provisioned")
                .description("Environments created or updated")
                .register(registry);

        this.environmentsFailed = Counter.builder("envsync.environments.failed")
                .description("Environments whose protection policy could not be applied")
                .register(registry);

        this.distributionDuration = Timer.builder("envsync.distribution.duration")
                .description("Duration of a full distribution run")
                .register(registry);
    }

    public void recordWritten(SecretScope scope) {
        Counter.builder("envsync.secrets.written")
                .description("Secrets written to a scope")
                .tag("scope", scope.kind().label())
                .register(registry)
                .increment();
    }

    public void recordFailed(SecretScope scope) {
        Counter.builder("envsync.secrets.failed")
                .description("Secret writes that failed after retries")
                .tag("scope", scope.kind().label())
                .register(registry)
                .increment();
    }

    public void recordSkipped() { secretsSkipped.increment(); }
    public void recordConflict() { conflicts.increment(); }
    public void recordQuotaAbort() { quotaAborts.increment(); }
    public void recordGitHubApiCall() { githubApiCalls.increment(); }

    public void recordEnvironment(boolean success) {
        if (success) {
            environmentsProvisioned.increment();
        } else {
            environmentsFailed.increment();
        }
    }

    public void recordDistribution(long durationMs) {
        distributionDuration.record(Duration.ofMillis(durationMs));
    }
}
