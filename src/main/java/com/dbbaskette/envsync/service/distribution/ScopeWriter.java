package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.EnvSyncException;
import com.dbbaskette.envsync.error.ErrorCode;
import com.dbbaskette.envsync.error.SecondaryRateLimitException;
import com.dbbaskette.envsync.observability.EnvSyncMetrics;
import com.dbbaskette.envsync.service.crypto.SealedEncryptor;
import com.dbbaskette.envsync.service.github.GitHubSecretsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Idempotent upsert of one secret into one scope.
 *
 * <p>The value hash is taken before encryption. Callers reserve quota for the batch before
 * any upsert runs. Retryable failures (server errors, transport failures, secondary rate
 * limits) are retried with exponential backoff; other client errors fail immediately.
 */
@Service
public class ScopeWriter {

    private static final Logger log = LoggerFactory.getLogger(ScopeWriter.class);

    private final SealedEncryptor encryptor;
    private final GitHubSecretsClient client;
    private final SecretMappingStore mappingStore;
    private final EnvSyncProperties properties;
    private final EnvSyncMetrics metrics;

    public ScopeWriter(SealedEncryptor encryptor, GitHubSecretsClient client, SecretMappingStore mappingStore,
                       EnvSyncProperties properties, EnvSyncMetrics metrics) {
        this.encryptor = encryptor;
        this.client = client;
        this.mappingStore = mappingStore;
        this.properties = properties;
        this.metrics = metrics;
    }

    public WriteOutcome upsert(WriteRequest req) {
        String hash = ValueHasher.sha256Hex(req.value());
        if (req.excluded()) {
            metrics.recordSkipped();
            return WriteOutcome.skipped(req, hash);
        }
        if (req.dryRun()) {
            log.info("[DRY RUN] would write {} to {} ({})", req.remoteName(), req.scope(), req.repo().fullName());
            return WriteOutcome.planned(req, hash);
        }

        EnvSyncProperties.RetryConfig retry = properties.getDistribution().getRetry();
        AtomicInteger attempts = new AtomicInteger();
        try {
            Mono.fromRunnable(() -> {
                        attempts.incrementAndGet();
                        encryptor.withSealedValue(req.repo(), req.scope(), req.value(), sealed -> {
                            client.putSecret(req.repo(), req.scope(), req.remoteName(), sealed.encryptedValue(), sealed.keyId());
                            return null;
                        });
                    })
                    .retryWhen(retryOnTransientFailure(req, retry))
                    .block();
        } catch (EnvSyncException e) {
            return fail(req, hash, e.getCode(), e.getMessage(), attempts.get());
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return fail(req, hash, ErrorCode.WRITE_TIMED_OUT, "Interrupted while waiting to retry", attempts.get());
            }
            throw e;
        }

        boolean conflict = mappingStore.recordWrite(req.repo().projectId(), req.mappingName(),
                req.scope().label(), hash, req.force());
        metrics.recordWritten(req.scope());
        if (conflict) metrics.recordConflict();
        log.debug("Wrote {} to {} on attempt {}", req.remoteName(), req.scope(), attempts.get());
        return WriteOutcome.written(req, hash, conflict, attempts.get());
    }

    /**
     * Like {@code Retry.backoff} filtered on retryable failures, except that the delay depends on
     * the failure: secondary rate limits wait for {@code Retry-After}. Exhausted or
     * non-retryable failures are re-emitted as they are. Waits run on the bounded elastic
     * scheduler since the next attempt blocks.
     */
    private Retry retryOnTransientFailure(WriteRequest req, EnvSyncProperties.RetryConfig retry) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            long attempt = signal.totalRetries() + 1;
            if (!(signal.failure() instanceof EnvSyncException e) || !e.isRetryable()
                    || attempt >= retry.getMaxAttempts()) {
                return Mono.<Retry.RetrySignal>error(signal.failure());
            }
            Duration delay = backoff(e, attempt, retry);
            log.warn("Write of {} to {} failed (attempt {}/{}), retrying in {} ms: {}",
                    req.remoteName(), req.scope(), attempt, retry.getMaxAttempts(), delay.toMillis(), e.getMessage());
            return Mono.delay(delay, Schedulers.boundedElastic()).thenReturn(signal);
        }));
    }

    static Duration backoff(EnvSyncException e, long attempt, EnvSyncProperties.RetryConfig retry) {
        if (e instanceof SecondaryRateLimitException secondary) {
            return secondary.getRetryAfter() != null
                    ? secondary.getRetryAfter()
                    : Duration.ofSeconds(retry.getSecondaryRateLimitDelaySeconds());
        }
        double factor = Math.pow(retry.getMultiplier(), attempt - 1);
        return Duration.ofMillis((long) (retry.getBaseDelayMs() * factor));
    }

    private WriteOutcome fail(WriteRequest req, String hash, ErrorCode code, String message, int attempts) {
        log.warn("Write of {} to {} failed after {} attempt(s): {}", req.remoteName(), req.scope(), attempts, message);
        mappingStore.recordFailure(req.repo().projectId(), req.mappingName(), req.scope().label(), hash, message);
        metrics.recordFailed(req.scope());
        return WriteOutcome.failed(req, hash, code, message, attempts);
    }
}
