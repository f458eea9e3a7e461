package com.dbbaskette.envsync.service.github;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.CredentialMissingException;
import com.dbbaskette.envsync.error.EnvSyncException;
import com.dbbaskette.envsync.error.GitHubApiException;
import com.dbbaskette.envsync.error.RateLimitExhaustedException;
import com.dbbaskette.envsync.error.ReviewerNotFoundException;
import com.dbbaskette.envsync.error.ScopeUnreachableException;
import com.dbbaskette.envsync.error.SecondaryRateLimitException;
import com.dbbaskette.envsync.error.StaleKeyException;
import com.dbbaskette.envsync.model.ProtectionRules;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.observability.EnvSyncMetrics;
import com.dbbaskette.envsync.security.Redactor;
import com.dbbaskette.envsync.service.quota.QuotaTracker;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Thin wrapper over the GitHub REST endpoints for secrets, environments and rate limits.
 *
 * <p>Every response, successful or not, is handed to the {@link QuotaTracker}. Failures are
 * translated into the domain exception taxonomy; retry decisions belong to the callers.
 */
@Service
public class GitHubSecretsClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubSecretsClient.class);
    private static final int MAX_ERROR_BODY = 300;

    private final WebClient webClient;
    private final QuotaTracker quotaTracker;
    private final EnvSyncProperties properties;
    private final EnvSyncMetrics metrics;

    public GitHubSecretsClient(WebClient gitHubWebClient, QuotaTracker quotaTracker, EnvSyncProperties properties,
                               EnvSyncMetrics metrics) {
        this.webClient = gitHubWebClient;
        this.quotaTracker = quotaTracker;
        this.properties = properties;
        this.metrics = metrics;
    }

    // --- Secrets ---

    public ScopePublicKey getPublicKey(RepoRef repo, SecretScope scope) {
        log.debug("Fetching public key for {} scope {}", repo.fullName(), scope);
        JsonNode body = exchange(repo, HttpMethod.GET, uri -> scopePath(uri, repo, scope, "public-key"), null,
                "public key for " + scope).getBody();
        if (body == null || !body.hasNonNull("key_id") || !body.hasNonNull("key")) {
            throw new GitHubApiException(200, "Public key response for " + scope + " is missing key_id or key");
        }
        return new ScopePublicKey(body.get("key_id").asText(), body.get("key").asText());
    }

    /**
     * Creates or updates one secret. A 422 naming the key id means the value was sealed for a
     * rotated key and surfaces as {@link StaleKeyException}.
     */
    public void putSecret(RepoRef repo, SecretScope scope, String name, String encryptedValue, String keyId) {
        log.debug("Writing secret {} to {} scope {}", name, repo.fullName(), scope);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("encrypted_value", encryptedValue);
        payload.put("key_id", keyId);
        try {
            exchange(repo, HttpMethod.PUT, uri -> scopePath(uri, repo, scope, name), payload, "secret " + name + " in " + scope);
        } catch (GitHubApiException e) {
            if (e.getStatus() == 422 && e.getMessage() != null && e.getMessage().toLowerCase().contains("key")) {
                throw new StaleKeyException("GitHub rejected key id " + keyId + " for " + scope);
            }
            throw e;
        }
    }

    // --- Environments ---

    public Optional<JsonNode> getEnvironment(RepoRef repo, String environmentName) {
        log.debug("Getting environment {} of {}", environmentName, repo.fullName());
        try {
            return Optional.ofNullable(exchange(repo, HttpMethod.GET,
                    uri -> uri.path("/repos/{owner}/{repo}/environments/{env}").build(repo.owner(), repo.name(), environmentName),
                    null, "environment " + environmentName).getBody());
        } catch (ScopeUnreachableException e) {
            return Optional.empty();
        }
    }

    /**
     * Creates or updates an environment with the given protection policy. GitHub treats this
     * PUT as an upsert, so repeating it never creates a second environment.
     */
    public JsonNode putEnvironment(RepoRef repo, String environmentName, ProtectionRules rules) {
        log.debug("Putting environment {} of {}", environmentName, repo.fullName());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("wait_timer", rules.getWaitTimerMinutes());
        payload.put("reviewers", rules.getReviewerIds().stream()
                .map(id -> Map.of("type", "User", "id", id))
                .toList());
        payload.put("deployment_branch_policy", rules.isRestrictToMainBranch()
                ? Map.of("protected_branches", true, "custom_branch_policies", false)
                : null);
        try {
            return exchange(repo, HttpMethod.PUT,
                    uri -> uri.path("/repos/{owner}/{repo}/environments/{env}").build(repo.owner(), repo.name(), environmentName),
                    payload, "environment " + environmentName).getBody();
        } catch (GitHubApiException e) {
            if (e.getStatus() == 422 && e.getMessage() != null && e.getMessage().toLowerCase().contains("reviewer")) {
                throw new ReviewerNotFoundException("Reviewer not found for environment " + environmentName
                        + ": " + rules.getReviewerIds());
            }
            throw e;
        }
    }

    // --- Rate limit ---

    /**
     * Reads the authoritative rate-limit state and feeds it to the tracker. Does not count against the quota.
     */
    public void refreshRateLimits(RepoRef repo) {
        JsonNode body = exchange(repo, HttpMethod.GET, uri -> uri.path("/rate_limit").build(), null, "rate limit").getBody();
        JsonNode resources = body != null ? body.path("resources") : null;
        if (resources == null || resources.isMissingNode()) return;
        refreshResource(repo, resources.path("core"), QuotaType.CORE);
        refreshResource(repo, resources.path("graphql"), QuotaType.GRAPHQL);
    }

    private void refreshResource(RepoRef repo, JsonNode node, QuotaType type) {
        if (node.isMissingNode() || !node.has("remaining")) return;
        quotaTracker.refresh(repo.projectId(), type, node.path("remaining").asInt(), node.path("limit").asInt(),
                node.has("reset") ? Instant.ofEpochSecond(node.path("reset").asLong()) : null);
    }

    // --- Plumbing ---

    private URI scopePath(UriBuilder uri, RepoRef repo, SecretScope scope, String leaf) {
        return switch (scope.kind()) {
            case ACTIONS -> uri.path("/repos/{owner}/{repo}/actions/secrets/{leaf}").build(repo.owner(), repo.name(), leaf);
            case CODESPACES -> uri.path("/repos/{owner}/{repo}/codespaces/secrets/{leaf}").build(repo.owner(), repo.name(), leaf);
            case DEPENDABOT -> uri.path("/repos/{owner}/{repo}/dependabot/secrets/{leaf}").build(repo.owner(), repo.name(), leaf);
            case ENVIRONMENT -> uri.path("/repos/{owner}/{repo}/environments/{env}/secrets/{leaf}")
                    .build(repo.owner(), repo.name(), scope.environment().remoteName(), leaf);
        };
    }

    private ResponseEntity<JsonNode> exchange(RepoRef repo, HttpMethod method, Function<UriBuilder, URI> uri,
                                              Object body, String context) {
        if (!properties.getGithub().hasToken()) {
            throw new CredentialMissingException();
        }
        metrics.recordGitHubApiCall();
        WebClient.RequestBodySpec spec = webClient.method(method).uri(uri);
        Mono<ResponseEntity<JsonNode>> call = (body != null ? spec.bodyValue(body) : spec)
                .retrieve()
                .toEntity(JsonNode.class)
                .timeout(properties.getGithub().getRequestTimeout());
        try {
            ResponseEntity<JsonNode> response = call.block();
            if (response != null) {
                quotaTracker.observe(repo.projectId(), response.getHeaders());
            }
            return response != null ? response : ResponseEntity.noContent().build();
        } catch (WebClientResponseException e) {
            quotaTracker.observe(repo.projectId(), e.getHeaders());
            throw translate(e, context);
        } catch (WebClientRequestException e) {
            throw new GitHubApiException(0, "GitHub unreachable while requesting " + context + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new GitHubApiException(0, "GitHub timed out while requesting " + context, e);
            }
            throw e;
        }
    }

    EnvSyncException translate(WebClientResponseException e, String context) {
        int status = e.getStatusCode().value();
        String body = abbreviate(Redactor.redact(e.getResponseBodyAsString()));
        HttpHeaders headers = e.getHeaders();
        String message = "GitHub " + status + " for " + context + (body.isEmpty() ? "" : ": " + body);

        if (status == 429 || (status == 403 && body.toLowerCase().contains("secondary rate limit"))) {
            return new SecondaryRateLimitException(message, retryAfter(headers));
        }
        if (status == 403 && "0".equals(headers.getFirst("x-ratelimit-remaining"))) {
            return new RateLimitExhaustedException(QuotaType.fromResourceHeader(headers.getFirst("x-ratelimit-resource")),
                    0, 1, epochSeconds(headers.getFirst("x-ratelimit-reset")));
        }
        if (status == 404) {
            return new ScopeUnreachableException("Not found or not visible to the token: " + context);
        }
        return new GitHubApiException(status, message, e);
    }

    static Duration retryAfter(HttpHeaders headers) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value == null) return null;
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant epochSeconds(String value) {
        if (value == null) return null;
        try {
            return Instant.ofEpochSecond(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        String trimmed = body.strip();
        return trimmed.length() > MAX_ERROR_BODY ? trimmed.substring(0, MAX_ERROR_BODY) + "..." : trimmed;
    }
}
