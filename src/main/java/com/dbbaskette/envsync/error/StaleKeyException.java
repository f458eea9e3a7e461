package com.dbbaskette.envsync.error;

/**
 * The remote rejected a ciphertext because the key id it was sealed for is no longer current.
 */
public class StaleKeyException extends EnvSyncException {

    public StaleKeyException(String message) {
        super(ErrorCode.GITHUB_SECRETS_ENCRYPTION_FAILED, message);
    }
}
