package com.dbbaskette.envsync.service.idempotency;

import com.dbbaskette.envsync.error.IdempotencyInProgressException;
import com.dbbaskette.envsync.error.PayloadDivergenceException;
import com.dbbaskette.envsync.model.IdempotencyRecord;
import com.dbbaskette.envsync.model.IdempotencyStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs a mutating operation at most once per key and replays the stored result afterwards.
 *
 * <p>Results are kept as serialized text so every replay is byte-identical to the first answer.
 * A concurrent duplicate in this process waits for the in-flight execution; a duplicate arriving
 * while another process holds the pending record is rejected with
 * {@link IdempotencyInProgressException}. A failed execution releases the key.
 */
public class IdempotencyGate {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyGate.class);

    private final IdempotencyStore store;
    private final boolean strictChecksum;
    private final ConcurrentHashMap<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    public IdempotencyGate(IdempotencyStore store, boolean strictChecksum) {
        this.store = store;
        this.strictChecksum = strictChecksum;
    }

    public String run(String key, String payloadChecksum, Supplier<String> operation) {
        Optional<String> replay = replay(key, payloadChecksum);
        if (replay.isPresent()) {
            return replay.get();
        }

        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.info("Idempotency key {} already executing, waiting for its result", key);
            return join(existing);
        }

        try {
            // re-check after winning the slot: another thread may have completed in between
            Optional<String> late = replay(key, payloadChecksum);
            if (late.isPresent()) {
                mine.complete(late.get());
                return late.get();
            }
            if (!store.createPending(key, payloadChecksum)) {
                throw new IdempotencyInProgressException(key);
            }
            String result;
            try {
                result = operation.get();
            } catch (RuntimeException e) {
                store.release(key);
                throw e;
            }
            store.complete(key, result);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private Optional<String> replay(String key, String payloadChecksum) {
        Optional<IdempotencyRecord> record = store.find(key);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        IdempotencyRecord existing = record.get();
        if (!existing.getPayloadChecksum().equals(payloadChecksum)) {
            if (strictChecksum) {
                throw new PayloadDivergenceException(key);
            }
            log.warn("Idempotency key {} reused with a different payload, replaying the stored result", key);
        }
        if (existing.getStatus() == IdempotencyStatus.COMPLETED) {
            log.info("Replaying stored result for idempotency key {}", key);
            return Optional.of(existing.getResult());
        }
        if (!inFlight.containsKey(key)) {
            throw new IdempotencyInProgressException(key);
        }
        return Optional.empty();
    }

    private static String join(CompletableFuture<String> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    public static String checksum(String canonicalPayload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonicalPayload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
