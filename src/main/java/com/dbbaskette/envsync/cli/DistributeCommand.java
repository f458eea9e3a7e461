package com.dbbaskette.envsync.cli;

import com.dbbaskette.envsync.error.EnvSyncException;
import com.dbbaskette.envsync.error.InvalidRequestException;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.observability.CorrelationIdFilter;
import com.dbbaskette.envsync.service.conflict.ConflictValidator;
import com.dbbaskette.envsync.service.conflict.ValidationResult;
import com.dbbaskette.envsync.service.distribution.DistributionRequest;
import com.dbbaskette.envsync.service.distribution.DistributionResult;
import com.dbbaskette.envsync.service.distribution.EnvironmentSummary;
import com.dbbaskette.envsync.service.distribution.SecretDistributionService;
import com.dbbaskette.envsync.service.distribution.SyncError;
import com.dbbaskette.envsync.service.idempotency.IdempotentRequests;
import com.dbbaskette.envsync.service.values.SecretValueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Distributes the values of a local dotenv file through the same pipeline as {@code POST /secrets/sync}.
 */
@Component
@Profile("cli")
@Command(
        name = "envsync",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "Distribute secrets from a dotenv file to GitHub secret scopes and environments."
)
public class DistributeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DistributeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_PARTIAL = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Configured project id")
    String projectId;

    @Option(names = {"-f", "--env-file"}, defaultValue = ".env", description = "Dotenv file to read (default: ${DEFAULT-VALUE})")
    Path envFile;

    @Option(names = {"-s", "--scope"}, description = "Target scope, repeatable: actions, codespaces, dependabot, environment:<name>")
    List<String> scopes = new ArrayList<>();

    @Option(names = {"--secret"}, description = "Only distribute these names, repeatable")
    List<String> secrets = new ArrayList<>();

    @Option(names = {"--force"}, description = "Overwrite values that differ from the recorded ones")
    boolean force;

    @Option(names = {"--dry-run"}, description = "Do everything except the final writes and log them instead")
    boolean dryRun;

    @Option(names = {"-x", "--exclude"}, description = "Extra exclusion regex for this run, repeatable")
    List<String> excludes = new ArrayList<>();

    @Option(names = {"--timeout-seconds"}, description = "Overall write timeout")
    Integer timeoutSeconds;

    @Option(names = {"--idempotency-key"}, description = "Replays the stored result when the key was used before")
    String idempotencyKey;

    @Option(names = {"--validate"}, description = "Report missing and conflicting secrets instead of distributing")
    boolean validate;

    private final SecretDistributionService distributionService;
    private final ConflictValidator conflictValidator;
    private final SecretValueSource valueSource;
    private final IdempotentRequests idempotentRequests;

    public DistributeCommand(SecretDistributionService distributionService, ConflictValidator conflictValidator,
                             SecretValueSource valueSource, IdempotentRequests idempotentRequests) {
        this.distributionService = distributionService;
        this.conflictValidator = conflictValidator;
        this.valueSource = valueSource;
        this.idempotentRequests = idempotentRequests;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        String correlationId = CorrelationIdFilter.newCorrelationId();
        MDC.put(CorrelationIdFilter.MDC_KEY, correlationId);
        try {
            List<SecretScope> targetScopes = parseScopes();
            return validate ? runValidation(out, correlationId, targetScopes) : runDistribution(out, correlationId, targetScopes);
        } catch (EnvSyncException e) {
            log.error("envsync aborted: {} ({})", e.getMessage(), e.getCode());
            spec.commandLine().getErr().println("ERROR " + e.getCode() + ": " + e.getMessage());
            return EXIT_FATAL;
        } finally {
            MDC.remove(CorrelationIdFilter.MDC_KEY);
        }
    }

    private int runDistribution(PrintWriter out, String correlationId, List<SecretScope> targetScopes) {
        Map<String, String> values = valueSource.load(envFile);
        DistributionRequest request = DistributionRequest.forProject(projectId)
                .values(values)
                .secretNames(secrets.isEmpty() ? null : new LinkedHashSet<>(secrets))
                .targetScopes(targetScopes)
                .force(force)
                .dryRun(dryRun)
                .timeout(timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds))
                .extraExclusions(excludes)
                .actorId("cli:" + System.getProperty("user.name", "unknown"))
                .correlationId(correlationId)
                .build();

        DistributionResult result = idempotencyKey == null
                ? distributionService.distribute(request)
                : idempotentRequests.execute(idempotencyKey, payloadOf(values), () -> distributionService.distribute(request),
                        DistributionResult.class);

        out.printf("%s%s: %d written, %d planned, %d skipped, %d errors, %d conflicts (%d ms, correlation %s)%n",
                result.dryRun() ? "[DRY RUN] " : "", result.projectId(), result.syncedCount(), result.plannedCount(),
                result.skippedCount(), result.errors().size(), result.conflicts().size(), result.durationMs(),
                result.correlationId());
        for (EnvironmentSummary env : result.environments()) {
            out.printf("  environment %s: %s (%s)%n", env.name(), env.action(), env.status());
        }
        for (SyncError error : result.errors()) {
            out.printf("  error %s %s: %s %s%n", error.secretName(), error.scope(), error.code(), error.message());
        }
        for (SyncError conflict : result.conflicts()) {
            out.printf("  conflict %s %s%n", conflict.secretName(), conflict.scope());
        }
        out.flush();
        return result.hasFailures() ? EXIT_PARTIAL : EXIT_OK;
    }

    private int runValidation(PrintWriter out, String correlationId, List<SecretScope> targetScopes) {
        List<String> required = new ArrayList<>(secrets);
        if (required.isEmpty() && envFile.toFile().isFile()) {
            required.addAll(valueSource.load(envFile).keySet());
        }
        ValidationResult result = conflictValidator.validate(projectId, required, targetScopes,
                "cli:" + System.getProperty("user.name", "unknown"), correlationId);
        out.printf("%s: %s (%d missing, %d conflicts of %d secrets)%n", projectId,
                result.valid() ? "valid" : "invalid", result.summary().missingCount(),
                result.summary().conflictCount(), result.summary().totalSecrets());
        result.remediationSteps().forEach(step -> out.println("  - " + step));
        out.flush();
        return result.valid() ? EXIT_OK : EXIT_PARTIAL;
    }

    private List<SecretScope> parseScopes() {
        if (scopes.isEmpty()) return null;
        List<SecretScope> parsed = new ArrayList<>();
        for (String label : scopes) {
            try {
                parsed.add(SecretScope.parse(label));
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException(e.getMessage());
            }
        }
        return parsed;
    }

    private Map<String, Object> payloadOf(Map<String, String> values) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", projectId);
        payload.put("values", values);
        payload.put("secretNames", secrets);
        payload.put("targetScopes", scopes);
        payload.put("force", force);
        payload.put("dryRun", dryRun);
        payload.put("excludes", excludes);
        return payload;
    }
}
