package com.dbbaskette.envsync.model;

import java.util.Optional;

/**
 * The three long-lived deployment targets every project carries.
 */
public enum CanonicalEnvironment {
    DEV("dev", "_DEV"),
    STAGING("staging", "_STAGING"),
    PRODUCTION("production", "_PROD");

    private final String remoteName;
    private final String suffix;

    CanonicalEnvironment(String remoteName, String suffix) {
        this.remoteName = remoteName;
        this.suffix = suffix;
    }

    /** Environment name as GitHub knows it. */
    public String remoteName() { return remoteName; }

    /** Secret-name suffix that scopes a value to this environment. */
    public String suffix() { return suffix; }

    public static Optional<CanonicalEnvironment> fromRemoteName(String name) {
        if (name == null) return Optional.empty();
        for (CanonicalEnvironment env : values()) {
            if (env.remoteName.equalsIgnoreCase(name.trim())) {
                return Optional.of(env);
            }
        }
        return Optional.empty();
    }
}
