package com.dbbaskette.envsync.error;

/**
 * The repository or scope does not exist, or the token cannot see it.
 */
public class ScopeUnreachableException extends EnvSyncException {

    public ScopeUnreachableException(String message) {
        super(ErrorCode.GITHUB_SCOPE_UNREACHABLE, message);
    }
}
