package com.dbbaskette.envsync.service.classify;

import com.dbbaskette.envsync.model.CanonicalEnvironment;

import java.util.List;

/**
 * Parses secret names into {@link SecretKey}s using the environment suffix table.
 * The first matching suffix wins and is stripped; no match means the secret is global.
 */
public final class NameClassifier {

    private static final List<CanonicalEnvironment> SUFFIX_ORDER =
            List.of(CanonicalEnvironment.DEV, CanonicalEnvironment.STAGING, CanonicalEnvironment.PRODUCTION);

    private NameClassifier() {}

    public static SecretKey classify(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Secret name must not be blank");
        }
        for (CanonicalEnvironment env : SUFFIX_ORDER) {
            String suffix = env.suffix();
            if (name.endsWith(suffix) && name.length() > suffix.length()) {
                return new SecretKey(name, name.substring(0, name.length() - suffix.length()), env);
            }
        }
        return SecretKey.global(name);
    }
}
