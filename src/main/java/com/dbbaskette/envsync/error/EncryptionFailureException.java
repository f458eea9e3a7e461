package com.dbbaskette.envsync.error;

public class EncryptionFailureException extends EnvSyncException {

    public EncryptionFailureException(String message) {
        super(ErrorCode.GITHUB_SECRETS_ENCRYPTION_FAILED, message);
    }

    public EncryptionFailureException(String message, Throwable cause) {
        super(ErrorCode.GITHUB_SECRETS_ENCRYPTION_FAILED, message, cause);
    }
}
