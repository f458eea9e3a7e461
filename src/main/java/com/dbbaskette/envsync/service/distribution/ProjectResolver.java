package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.error.ProjectNotConfiguredException;
import com.dbbaskette.envsync.model.ProjectRepo;
import com.dbbaskette.envsync.repository.ProjectRepoRepository;
import org.springframework.stereotype.Component;

@Component
public class ProjectResolver {

    private final ProjectRepoRepository repository;

    public ProjectResolver(ProjectRepoRepository repository) {
        this.repository = repository;
    }

    public ProjectRepo require(String projectId) {
        return repository.findByProjectId(projectId)
                .orElseThrow(() -> new ProjectNotConfiguredException(projectId));
    }
}
