package com.dbbaskette.envsync.controller;

import com.dbbaskette.envsync.error.InvalidRequestException;
import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.ProtectionRules;
import com.dbbaskette.envsync.observability.CorrelationIdFilter;
import com.dbbaskette.envsync.security.ActorResolver;
import com.dbbaskette.envsync.service.environment.EnvironmentService;
import com.dbbaskette.envsync.service.environment.EnvironmentSpec;
import com.dbbaskette.envsync.service.environment.ProvisionReport;
import com.dbbaskette.envsync.service.idempotency.IdempotentRequests;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/environments")
public class EnvironmentController {

    private final EnvironmentService environmentService;
    private final IdempotentRequests idempotentRequests;

    public EnvironmentController(EnvironmentService environmentService, IdempotentRequests idempotentRequests) {
        this.environmentService = environmentService;
        this.idempotentRequests = idempotentRequests;
    }

    /**
     * Responds 207 when at least one environment or environment secret failed.
     */
    @PostMapping
    public ResponseEntity<ProvisionReport> create(
            @Valid @RequestBody CreateEnvironmentsRequest body,
            @RequestHeader(name = SecretSyncController.IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            HttpServletRequest request) {
        List<EnvironmentSpec> specs = toSpecs(body.environments());
        String actor = ActorResolver.resolve(request);
        String correlationId = CorrelationIdFilter.currentOrNew();
        boolean force = Boolean.TRUE.equals(body.force());

        ProvisionReport report = idempotencyKey == null || idempotencyKey.isBlank()
                ? environmentService.provision(body.projectId(), specs, force, actor, correlationId)
                : idempotentRequests.execute(idempotencyKey.trim(), body,
                        () -> environmentService.provision(body.projectId(), specs, force, actor, correlationId),
                        ProvisionReport.class);
        return ResponseEntity.status(report.hasErrors() ? HttpStatus.MULTI_STATUS : HttpStatus.OK).body(report);
    }

    static List<EnvironmentSpec> toSpecs(List<EnvironmentRequest> environments) {
        List<EnvironmentSpec> specs = new ArrayList<>();
        for (EnvironmentRequest env : environments) {
            CanonicalEnvironment canonical = CanonicalEnvironment.fromRemoteName(env.name())
                    .orElseThrow(() -> new InvalidRequestException(
                            "Unknown environment " + env.name() + "; expected dev, staging or production"));
            ProtectionRulesRequest rules = env.protectionRules();
            ProtectionRules protection = rules == null ? ProtectionRules.none() : new ProtectionRules(
                    rules.requiredReviewers() == null ? 0 : rules.requiredReviewers(),
                    rules.reviewerIds(),
                    Boolean.TRUE.equals(rules.restrictToMainBranch()),
                    rules.waitTimer() == null ? 0 : rules.waitTimer());
            Map<String, String> secrets = new LinkedHashMap<>();
            if (env.secrets() != null) {
                env.secrets().forEach(s -> secrets.put(s.name(), s.value()));
            }
            specs.add(new EnvironmentSpec(canonical, protection, secrets, env.linkedResources()));
        }
        return specs;
    }

    public record CreateEnvironmentsRequest(@NotBlank String projectId,
                                            @NotEmpty List<@Valid EnvironmentRequest> environments,
                                            Boolean force) {}

    public record EnvironmentRequest(@NotBlank String name, @Valid ProtectionRulesRequest protectionRules,
                                     List<@Valid SecretValue> secrets, Map<String, String> linkedResources) {}

    public record ProtectionRulesRequest(@Min(0) @Max(6) Integer requiredReviewers,
                                         List<Long> reviewerIds, Boolean restrictToMainBranch,
                                         @Min(0) @Max(43200) Integer waitTimer) {}

    public record SecretValue(@NotBlank String name, @NotNull String value) {

        @Override
        public String toString() {
            return "SecretValue[" + name + "]";
        }
    }
}
