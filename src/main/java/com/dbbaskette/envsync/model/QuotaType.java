package com.dbbaskette.envsync.model;

/**
 * Rate-limit classes tracked per project. Defaults mirror GitHub's hourly windows.
 *
 * <p>Only classes GitHub reports counters for gate a batch. {@link #SECRETS} is never
 * reported (secret writes count against {@code core}), so it is tracked for display only.
 */
public enum QuotaType {
    CORE(5000, 100, true),
    SECRETS(100, 10, false),
    GRAPHQL(5000, 100, true);

    private final int defaultLimit;
    private final int defaultSafetyMargin;
    private final boolean gated;

    QuotaType(int defaultLimit, int defaultSafetyMargin, boolean gated) {
        this.defaultLimit = defaultLimit;
        this.defaultSafetyMargin = defaultSafetyMargin;
        this.gated = gated;
    }

    public int defaultLimit() { return defaultLimit; }
    public int defaultSafetyMargin() { return defaultSafetyMargin; }

    /** Whether preflight checks and reservations apply to this class. */
    public boolean isGated() { return gated; }

    public static QuotaType fromResourceHeader(String resource) {
        if (resource == null) return CORE;
        return switch (resource.toLowerCase()) {
            case "graphql" -> GRAPHQL;
            case "secrets" -> SECRETS;
            default -> CORE;
        };
    }
}
