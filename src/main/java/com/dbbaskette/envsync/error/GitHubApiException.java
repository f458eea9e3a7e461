package com.dbbaskette.envsync.error;

/**
 * A GitHub call failed with a status that has no more specific mapping.
 * Server errors and transport failures are retryable; client errors are not.
 */
public class GitHubApiException extends EnvSyncException {

    private final int status;

    public GitHubApiException(int status, String message) {
        super(ErrorCode.GITHUB_API_ERROR, message);
        this.status = status;
    }

    public GitHubApiException(int status, String message, Throwable cause) {
        super(ErrorCode.GITHUB_API_ERROR, message, cause);
        this.status = status;
    }

    /** HTTP status, or 0 for transport failures. */
    public int getStatus() { return status; }

    @Override
    public boolean isRetryable() {
        return status == 0 || status >= 500;
    }
}
