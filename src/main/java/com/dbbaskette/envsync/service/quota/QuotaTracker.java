package com.dbbaskette.envsync.service.quota;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.RateLimitExhaustedException;
import com.dbbaskette.envsync.model.QuotaRecord;
import com.dbbaskette.envsync.model.QuotaType;
import com.dbbaskette.envsync.repository.QuotaRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the remaining-call counters per project and quota class.
 *
 * <p>All reads and writes go through one lock, so a reservation and the header refresh that
 * follows a call never interleave. State lives in memory and is written through to
 * {@link QuotaRecord} rows so a restart starts from the last observation.
 *
 * <p>Classes that were never observed start at their default limit. When a window's reset
 * time passes, its counter rolls back to the limit. Classes that are not
 * {@linkplain QuotaType#isGated() gated} are refreshed from observations but never checked or
 * decremented locally.
 */
@Service
public class QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(QuotaTracker.class);

    static final String HEADER_REMAINING = "x-ratelimit-remaining";
    static final String HEADER_LIMIT = "x-ratelimit-limit";
    static final String HEADER_RESET = "x-ratelimit-reset";
    static final String HEADER_RESOURCE = "x-ratelimit-resource";

    private record Key(String projectId, QuotaType type) {}

    private static final class Window {
        int remaining;
        int limit;
        Instant resetAt;
        Instant lastCheckedAt;
    }

    private final Object lock = new Object();
    private final Map<Key, Window> windows = new HashMap<>();
    private final QuotaRecordRepository repository;
    private final EnvSyncProperties properties;
    private final Clock clock;

    public QuotaTracker(QuotaRecordRepository repository, EnvSyncProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Reserves calls for one class.
     *
     * @throws RateLimitExhaustedException when fewer than {@code estimatedCalls} plus the
     *         safety margin remain; nothing is reserved in that case
     */
    public void checkAndReserve(String projectId, QuotaType type, int estimatedCalls) {
        Map<QuotaType, Integer> estimate = new EnumMap<>(QuotaType.class);
        estimate.put(type, estimatedCalls);
        reserveBatch(projectId, estimate);
    }

    /**
     * Checks every class of the estimate first and reserves only if all of them pass.
     */
    public void reserveBatch(String projectId, Map<QuotaType, Integer> estimate) {
        synchronized (lock) {
            verify(projectId, estimate);
            estimate.forEach((type, calls) -> {
                if (calls <= 0 || !type.isGated()) return;
                Window w = window(projectId, type);
                w.remaining = Math.max(0, w.remaining - calls);
                persist(projectId, type, w);
            });
        }
    }

    /**
     * Same gate as {@link #reserveBatch} without consuming anything. Used by dry runs.
     */
    public void checkBatch(String projectId, Map<QuotaType, Integer> estimate) {
        synchronized (lock) {
            verify(projectId, estimate);
        }
    }

    /**
     * Records an observation from the remote. The latest observation wins.
     */
    public void refresh(String projectId, QuotaType type, int remaining, int limit, Instant resetAt) {
        synchronized (lock) {
            Window w = window(projectId, type);
            w.limit = Math.max(0, limit);
            w.remaining = Math.max(0, Math.min(remaining, w.limit));
            w.resetAt = resetAt;
            w.lastCheckedAt = clock.instant();
            persist(projectId, type, w);
        }
        log.debug("Quota {} for {} refreshed: {}/{} resets {}", type, projectId, remaining, limit, resetAt);
    }

    /**
     * Refreshes from GitHub rate-limit response headers; responses without them are ignored.
     */
    public void observe(String projectId, HttpHeaders headers) {
        if (headers == null) return;
        String remaining = headers.getFirst(HEADER_REMAINING);
        String limit = headers.getFirst(HEADER_LIMIT);
        if (remaining == null || limit == null) return;
        try {
            String reset = headers.getFirst(HEADER_RESET);
            Instant resetAt = reset != null ? Instant.ofEpochSecond(Long.parseLong(reset.trim())) : null;
            refresh(projectId, QuotaType.fromResourceHeader(headers.getFirst(HEADER_RESOURCE)),
                    Integer.parseInt(remaining.trim()), Integer.parseInt(limit.trim()), resetAt);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed rate-limit headers for {}: remaining={}, limit={}", projectId, remaining, limit);
        }
    }

    public QuotaSnapshot snapshot(String projectId, QuotaType type) {
        synchronized (lock) {
            Window w = window(projectId, type);
            return new QuotaSnapshot(projectId, type, w.remaining, w.limit, w.resetAt, w.lastCheckedAt, safetyMargin(type));
        }
    }

    /** Snapshots of every tracked class that is currently below its safety margin. */
    public List<QuotaSnapshot> belowMargin() {
        List<QuotaSnapshot> low = new ArrayList<>();
        synchronized (lock) {
            for (Key key : new ArrayList<>(windows.keySet())) {
                Window w = window(key.projectId(), key.type());
                if (w.remaining < safetyMargin(key.type())) {
                    low.add(new QuotaSnapshot(key.projectId(), key.type(), w.remaining, w.limit,
                            w.resetAt, w.lastCheckedAt, safetyMargin(key.type())));
                }
            }
        }
        return low;
    }

    public int safetyMargin(QuotaType type) {
        EnvSyncProperties.QuotaConfig cfg = properties.getQuota();
        return switch (type) {
            case CORE -> cfg.getCoreSafetyMargin();
            case SECRETS -> cfg.getSecretsSafetyMargin();
            case GRAPHQL -> cfg.getGraphqlSafetyMargin();
        };
    }

    private void verify(String projectId, Map<QuotaType, Integer> estimate) {
        for (Map.Entry<QuotaType, Integer> entry : estimate.entrySet()) {
            QuotaType type = entry.getKey();
            if (!type.isGated()) continue;
            Window w = window(projectId, type);
            int required = Math.max(0, entry.getValue()) + safetyMargin(type);
            if (w.remaining < required) {
                log.warn("Quota preflight failed for {} {}: {} remaining, {} required", projectId, type, w.remaining, required);
                throw new RateLimitExhaustedException(type, w.remaining, required, w.resetAt);
            }
        }
    }

    // Caller holds the lock
    private Window window(String projectId, QuotaType type) {
        Key key = new Key(projectId, type);
        Window w = windows.get(key);
        if (w == null) {
            w = load(projectId, type);
            windows.put(key, w);
        }
        Instant now = clock.instant();
        if (w.resetAt != null && !now.isBefore(w.resetAt)) {
            w.remaining = w.limit;
            w.resetAt = null;
        }
        return w;
    }

    private Window load(String projectId, QuotaType type) {
        Window w = new Window();
        w.limit = type.defaultLimit();
        w.remaining = type.defaultLimit();
        try {
            repository.findByProjectIdAndQuotaType(projectId, type).ifPresent(record -> {
                w.limit = record.getLimit();
                w.remaining = record.getRemaining();
                w.resetAt = record.getResetAt();
                w.lastCheckedAt = record.getLastCheckedAt();
            });
        } catch (DataAccessException e) {
            log.warn("Could not load quota record for {} {}, starting from defaults: {}", projectId, type, e.getMessage());
        }
        return w;
    }

    private void persist(String projectId, QuotaType type, Window w) {
        try {
            QuotaRecord record = repository.findByProjectIdAndQuotaType(projectId, type)
                    .orElseGet(() -> new QuotaRecord(projectId, type));
            record.apply(w.remaining, w.limit, w.resetAt, w.lastCheckedAt);
            repository.save(record);
        } catch (DataAccessException e) {
            log.warn("Could not persist quota record for {} {}: {}", projectId, type, e.getMessage());
        }
    }
}
