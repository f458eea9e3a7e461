package com.dbbaskette.envsync.repository;

import com.dbbaskette.envsync.model.ProjectRepo;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface ProjectRepoRepository extends JpaRepository<ProjectRepo, Long> {

    Optional<ProjectRepo> findByProjectId(String projectId);

    List<ProjectRepo> findByValuesFileIsNotNull();
}
