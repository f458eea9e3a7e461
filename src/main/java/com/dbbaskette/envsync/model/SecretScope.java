package com.dbbaskette.envsync.model;

import java.util.Objects;

/**
 * An isolated secret namespace on GitHub: one of the repository-level scopes or a
 * single deployment environment. Each scope has its own public key.
 */
public final class SecretScope {

    public static final SecretScope ACTIONS = new SecretScope(ScopeKind.ACTIONS, null);
    public static final SecretScope CODESPACES = new SecretScope(ScopeKind.CODESPACES, null);
    public static final SecretScope DEPENDABOT = new SecretScope(ScopeKind.DEPENDABOT, null);

    private static final String ENVIRONMENT_PREFIX = "environment:";

    private final ScopeKind kind;
    private final CanonicalEnvironment environment;

    private SecretScope(ScopeKind kind, CanonicalEnvironment environment) {
        this.kind = kind;
        this.environment = environment;
    }

    public static SecretScope environment(CanonicalEnvironment environment) {
        return new SecretScope(ScopeKind.ENVIRONMENT, Objects.requireNonNull(environment, "environment"));
    }

    /**
     * Parses labels produced by {@link #label()}: {@code actions}, {@code codespaces},
     * {@code dependabot} and {@code environment:<name>}.
     */
    public static SecretScope parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Scope label must not be blank");
        }
        String normalized = label.trim().toLowerCase();
        if (normalized.startsWith(ENVIRONMENT_PREFIX)) {
            String envName = normalized.substring(ENVIRONMENT_PREFIX.length());
            return CanonicalEnvironment.fromRemoteName(envName)
                    .map(SecretScope::environment)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown environment: " + envName));
        }
        return switch (normalized) {
            case "actions" -> ACTIONS;
            case "codespaces" -> CODESPACES;
            case "dependabot" -> DEPENDABOT;
            default -> throw new IllegalArgumentException("Unknown scope: " + label);
        };
    }

    public ScopeKind kind() { return kind; }

    /** The environment for {@link ScopeKind#ENVIRONMENT} scopes, otherwise null. */
    public CanonicalEnvironment environment() { return environment; }

    public boolean isEnvironment() { return kind == ScopeKind.ENVIRONMENT; }

    public String label() {
        return isEnvironment() ? ENVIRONMENT_PREFIX + environment.remoteName() : kind.label();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecretScope other)) return false;
        return kind == other.kind && environment == other.environment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, environment);
    }

    @Override
    public String toString() {
        return label();
    }
}
