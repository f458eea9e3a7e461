package com.dbbaskette.envsync.service.github;

import com.dbbaskette.envsync.model.ProjectRepo;

public record RepoRef(String projectId, String owner, String name) {

    public static RepoRef of(ProjectRepo project) {
        return new RepoRef(project.getProjectId(), project.getOwner(), project.getName());
    }

    public String fullName() {
        return owner + "/" + name;
    }
}
