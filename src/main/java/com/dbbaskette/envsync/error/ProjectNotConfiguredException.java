package com.dbbaskette.envsync.error;

public class ProjectNotConfiguredException extends EnvSyncException {

    public ProjectNotConfiguredException(String projectId) {
        super(ErrorCode.PROJECT_NOT_CONFIGURED, "Project is not configured: " + projectId);
    }
}
