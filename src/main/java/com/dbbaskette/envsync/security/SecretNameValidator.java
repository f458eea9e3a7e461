package com.dbbaskette.envsync.security;

import java.util.regex.Pattern;

/**
 * Validates secret names before they are classified or written anywhere.
 */
public final class SecretNameValidator {

    private static final Pattern SECRET_NAME = Pattern.compile("^[A-Z][A-Z0-9_]*$");
    private static final int MAX_LENGTH = 100;

    private SecretNameValidator() {}

    public static boolean isValid(String name) {
        return name != null && name.length() <= MAX_LENGTH && SECRET_NAME.matcher(name).matches();
    }
}
