package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.error.ErrorCode;
import com.dbbaskette.envsync.model.SecretScope;

/**
 * Result of one scope write. {@code hash} is the SHA-256 of the value that was (or would have been) written.
 */
public record WriteOutcome(SecretScope scope, String secretName, WriteStatus status, String hash,
                           boolean conflict, ErrorCode errorCode, String errorMessage, int attempts) {

    public static WriteOutcome written(WriteRequest req, String hash, boolean conflict, int attempts) {
        return new WriteOutcome(req.scope(), req.mappingName(), WriteStatus.WRITTEN, hash, conflict, null, null, attempts);
    }

    public static WriteOutcome skipped(WriteRequest req, String hash) {
        return new WriteOutcome(req.scope(), req.mappingName(), WriteStatus.SKIPPED, hash, false, null, null, 0);
    }

    public static WriteOutcome planned(WriteRequest req, String hash) {
        return new WriteOutcome(req.scope(), req.mappingName(), WriteStatus.PLANNED, hash, false, null, null, 0);
    }

    public static WriteOutcome failed(WriteRequest req, String hash, ErrorCode code, String message, int attempts) {
        return new WriteOutcome(req.scope(), req.mappingName(), WriteStatus.FAILED, hash, false, code, message, attempts);
    }

    public boolean succeeded() {
        return status == WriteStatus.WRITTEN || status == WriteStatus.PLANNED;
    }
}
