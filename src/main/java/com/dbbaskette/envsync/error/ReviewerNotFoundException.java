package com.dbbaskette.envsync.error;

/**
 * Fatal for one environment's protection policy only.
 */
public class ReviewerNotFoundException extends EnvSyncException {

    public ReviewerNotFoundException(String message) {
        super(ErrorCode.GITHUB_ENV_REVIEWER_NOT_FOUND, message);
    }
}
