package com.dbbaskette.envsync.service.environment;

import java.util.List;

/**
 * Outcome of provisioning a batch of environments. An environment whose policy failed appears
 * only in {@code errors}; one whose policy applied but had secret failures appears in both.
 */
public record ProvisionReport(List<String> created, List<String> updated, List<EnvironmentError> errors,
                              String correlationId) {

    public record EnvironmentError(String environment, String error, String code) {}

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
