package com.dbbaskette.envsync.model;

public enum ScopeKind {
    ACTIONS("actions"),
    CODESPACES("codespaces"),
    DEPENDABOT("dependabot"),
    ENVIRONMENT("environment");

    private final String label;

    ScopeKind(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
