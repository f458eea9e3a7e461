package com.dbbaskette.envsync.error;

/**
 * Root of the domain exception taxonomy. Messages must never carry secret values.
 */
public class EnvSyncException extends RuntimeException {

    private final ErrorCode code;

    public EnvSyncException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EnvSyncException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() { return code; }

    /** Whether a retry of the same call may succeed. */
    public boolean isRetryable() { return false; }
}
