package com.dbbaskette.envsync.error;

import java.time.Duration;

public class SecondaryRateLimitException extends EnvSyncException {

    private final Duration retryAfter;

    public SecondaryRateLimitException(String message, Duration retryAfter) {
        super(ErrorCode.GITHUB_SECRETS_SECONDARY_RATE_LIMIT, message);
        this.retryAfter = retryAfter;
    }

    /** Server-provided delay, or null when the response carried no Retry-After. */
    public Duration getRetryAfter() { return retryAfter; }

    @Override
    public boolean isRetryable() { return true; }
}
