package com.dbbaskette.envsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "envsync")
@Validated
public class EnvSyncProperties {

    @Valid
    private GitHubConfig github = new GitHubConfig();

    @Valid
    private DistributionConfig distribution = new DistributionConfig();

    @Valid
    private QuotaConfig quota = new QuotaConfig();

    @Valid
    private IdempotencyConfig idempotency = new IdempotencyConfig();

    @Valid
    private AuditConfig audit = new AuditConfig();

    @Valid
    private ScheduleConfig schedule = new ScheduleConfig();

    @Valid
    private ApiConfig api = new ApiConfig();

    private List<@Valid ExclusionConfig> exclusions = new ArrayList<>();

    private List<@Valid ProjectConfig> projects = new ArrayList<>();

    // Getters and setters

    public GitHubConfig getGithub() { return github; }
    public void setGithub(GitHubConfig github) { this.github = github; }

    public DistributionConfig getDistribution() { return distribution; }
    public void setDistribution(DistributionConfig distribution) { this.distribution = distribution; }

    public QuotaConfig getQuota() { return quota; }
    public void setQuota(QuotaConfig quota) { this.quota = quota; }

    public IdempotencyConfig getIdempotency() { return idempotency; }
    public void setIdempotency(IdempotencyConfig idempotency) { this.idempotency = idempotency; }

    public AuditConfig getAudit() { return audit; }
    public void setAudit(AuditConfig audit) { this.audit = audit; }

    public ScheduleConfig getSchedule() { return schedule; }
    public void setSchedule(ScheduleConfig schedule) { this.schedule = schedule; }

    public ApiConfig getApi() { return api; }
    public void setApi(ApiConfig api) { this.api = api; }

    public List<ExclusionConfig> getExclusions() { return exclusions; }
    public void setExclusions(List<ExclusionConfig> exclusions) { this.exclusions = exclusions; }

    public List<ProjectConfig> getProjects() { return projects; }
    public void setProjects(List<ProjectConfig> projects) { this.projects = projects; }

    public static class GitHubConfig {
        private String token;
        @NotBlank
        private String apiUrl = "https://api.github.com";
        @NotNull
        private Duration keyCacheTtl = Duration.ofMinutes(5);
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public Duration getKeyCacheTtl() { return keyCacheTtl; }
        public void setKeyCacheTtl(Duration keyCacheTtl) { this.keyCacheTtl = keyCacheTtl; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public boolean hasToken() { return token != null && !token.isBlank(); }
    }

    public static class DistributionConfig {
        @Min(1)
        private int concurrency = 10;
        @Min(1)
        private int timeoutSeconds = 120;
        private List<String> defaultScopes = new ArrayList<>(List.of("actions", "codespaces", "dependabot"));
        @Valid
        private RetryConfig retry = new RetryConfig();

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public List<String> getDefaultScopes() { return defaultScopes; }
        public void setDefaultScopes(List<String> defaultScopes) { this.defaultScopes = defaultScopes; }
        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }
    }

    public static class RetryConfig {
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long baseDelayMs = 1000;
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        @Min(0)
        private int secondaryRateLimitDelaySeconds = 60;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public int getSecondaryRateLimitDelaySeconds() { return secondaryRateLimitDelaySeconds; }
        public void setSecondaryRateLimitDelaySeconds(int v) { this.secondaryRateLimitDelaySeconds = v; }
    }

    public static class QuotaConfig {
        @Min(0)
        private int coreSafetyMargin = 100;
        @Min(0)
        private int secretsSafetyMargin = 10;
        @Min(0)
        private int graphqlSafetyMargin = 100;

        public int getCoreSafetyMargin() { return coreSafetyMargin; }
        public void setCoreSafetyMargin(int coreSafetyMargin) { this.coreSafetyMargin = coreSafetyMargin; }
        public int getSecretsSafetyMargin() { return secretsSafetyMargin; }
        public void setSecretsSafetyMargin(int secretsSafetyMargin) { this.secretsSafetyMargin = secretsSafetyMargin; }
        public int getGraphqlSafetyMargin() { return graphqlSafetyMargin; }
        public void setGraphqlSafetyMargin(int graphqlSafetyMargin) { this.graphqlSafetyMargin = graphqlSafetyMargin; }
    }

    public static class IdempotencyConfig {
        private boolean strictChecksum = true;
        /** {@code jpa} or {@code memory}. */
        @NotBlank
        private String store = "jpa";

        public boolean isStrictChecksum() { return strictChecksum; }
        public void setStrictChecksum(boolean strictChecksum) { this.strictChecksum = strictChecksum; }
        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
    }

    public static class AuditConfig {
        @Min(1)
        private int retentionDays = 90;
        private String retentionCron = "0 30 3 * * *";

        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
        public String getRetentionCron() { return retentionCron; }
        public void setRetentionCron(String retentionCron) { this.retentionCron = retentionCron; }
    }

    public static class ScheduleConfig {
        private boolean enabled = false;
        @Min(1)
        private int intervalHours = 6;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getIntervalHours() { return intervalHours; }
        public void setIntervalHours(int intervalHours) { this.intervalHours = intervalHours; }
    }

    public static class ApiConfig {
        private String token;

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public boolean isSecured() { return token != null && !token.isBlank(); }
    }

    public static class ExclusionConfig {
        @NotBlank
        private String pattern;
        private String reason;

        public ExclusionConfig() {}

        public ExclusionConfig(String pattern, String reason) {
            this.pattern = pattern;
            this.reason = reason;
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
    }

    public static class ProjectConfig {
        @NotBlank
        private String id;
        @NotBlank
        private String owner;
        @NotBlank
        private String repo;
        private String valuesFile;
        private List<@Valid ExclusionConfig> exclusions = new ArrayList<>();
        private Map<String, @Valid EnvironmentConfig> environments = new LinkedHashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }
        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }
        public String getValuesFile() { return valuesFile; }
        public void setValuesFile(String valuesFile) { this.valuesFile = valuesFile; }
        public List<ExclusionConfig> getExclusions() { return exclusions; }
        public void setExclusions(List<ExclusionConfig> exclusions) { this.exclusions = exclusions; }
        public Map<String, EnvironmentConfig> getEnvironments() { return environments; }
        public void setEnvironments(Map<String, EnvironmentConfig> environments) { this.environments = environments; }

        public String fullName() { return owner + "/" + repo; }
    }

    /**
     * Protection policy and linked resources for one canonical environment of a project.
     */
    public static class EnvironmentConfig {
        @Min(0)
        private int requiredReviewers;
        private List<Long> reviewerIds = new ArrayList<>();
        private boolean restrictToMainBranch;
        @Min(0)
        private int waitTimerMinutes;
        private Map<String, String> linkedResources = new LinkedHashMap<>();

        public int getRequiredReviewers() { return requiredReviewers; }
        public void setRequiredReviewers(int requiredReviewers) { this.requiredReviewers = requiredReviewers; }
        public List<Long> getReviewerIds() { return reviewerIds; }
        public void setReviewerIds(List<Long> reviewerIds) { this.reviewerIds = reviewerIds; }
        public boolean isRestrictToMainBranch() { return restrictToMainBranch; }
        public void setRestrictToMainBranch(boolean restrictToMainBranch) { this.restrictToMainBranch = restrictToMainBranch; }
        public int getWaitTimerMinutes() { return waitTimerMinutes; }
        public void setWaitTimerMinutes(int waitTimerMinutes) { this.waitTimerMinutes = waitTimerMinutes; }
        public Map<String, String> getLinkedResources() { return linkedResources; }
        public void setLinkedResources(Map<String, String> linkedResources) { this.linkedResources = linkedResources; }
    }
}
