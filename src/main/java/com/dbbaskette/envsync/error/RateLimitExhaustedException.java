package com.dbbaskette.envsync.error;

import com.dbbaskette.envsync.model.QuotaType;
import java.time.Instant;

/**
 * Batch-fatal: the quota preflight found too few calls left. Wait until {@link #getResetAt()}.
 */
public class RateLimitExhaustedException extends EnvSyncException {

    private final QuotaType quotaType;
    private final int remaining;
    private final int required;
    private final Instant resetAt;

    public RateLimitExhaustedException(QuotaType quotaType, int remaining, int required, Instant resetAt) {
        super(ErrorCode.GITHUB_SECRETS_RATE_LIMIT_EXHAUSTED,
                "Rate limit for " + quotaType + " exhausted: " + remaining + " remaining, "
                        + required + " required including safety margin"
                        + (resetAt != null ? ", resets at " + resetAt : ""));
        this.quotaType = quotaType;
        this.remaining = remaining;
        this.required = required;
        this.resetAt = resetAt;
    }

    public QuotaType getQuotaType() { return quotaType; }
    public int getRemaining() { return remaining; }
    public int getRequired() { return required; }
    public Instant getResetAt() { return resetAt; }
}
