package com.dbbaskette.envsync.error;

public class CredentialMissingException extends EnvSyncException {

    public CredentialMissingException() {
        super(ErrorCode.GITHUB_TOKEN_MISSING, "GitHub token is not configured (envsync.github.token)");
    }
}
