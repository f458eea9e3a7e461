package com.dbbaskette.envsync.repository;

import com.dbbaskette.envsync.model.ExclusionPattern;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface ExclusionPatternRepository extends JpaRepository<ExclusionPattern, Long> {

    List<ExclusionPattern> findByGlobalTrue();

    List<ExclusionPattern> findByProjectId(String projectId);

    boolean existsByGlobalTrueAndPattern(String pattern);

    boolean existsByProjectIdAndPattern(String projectId, String pattern);
}
