package com.dbbaskette.envsync.service.environment;

import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.ProtectionRules;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Desired state of one environment.
 *
 * @param secrets         environment secret name (suffix optional) to plaintext value
 * @param linkedResources replaces the stored map when non-null
 */
public record EnvironmentSpec(CanonicalEnvironment environment, ProtectionRules rules,
                              Map<String, String> secrets, Map<String, String> linkedResources) {

    public EnvironmentSpec {
        rules = rules == null ? ProtectionRules.none() : rules;
        secrets = secrets == null ? Map.of() : new LinkedHashMap<>(secrets);
    }

    public static EnvironmentSpec policyOnly(CanonicalEnvironment environment, ProtectionRules rules,
                                             Map<String, String> linkedResources) {
        return new EnvironmentSpec(environment, rules, Map.of(), linkedResources);
    }

    @Override
    public String toString() {
        return "EnvironmentSpec[" + environment + ", secrets=" + secrets.keySet() + "]";
    }
}
