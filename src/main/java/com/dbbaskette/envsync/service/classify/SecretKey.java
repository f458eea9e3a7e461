package com.dbbaskette.envsync.service.classify;

import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.SecretScope;

/**
 * A secret name parsed once into its base name and scope.
 *
 * @param originalName name as supplied, suffix included
 * @param baseName     name written to GitHub
 * @param environment  target environment, or null for a global secret
 */
public record SecretKey(String originalName, String baseName, CanonicalEnvironment environment) {

    public static SecretKey global(String name) {
        return new SecretKey(name, name, null);
    }

    public boolean isGlobal() {
        return environment == null;
    }

    /** The environment scope for environment-scoped keys; global keys have none. */
    public SecretScope environmentScope() {
        return isGlobal() ? null : SecretScope.environment(environment);
    }
}
