package com.dbbaskette.envsync.repository;

import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.EnvironmentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface EnvironmentRecordRepository extends JpaRepository<EnvironmentRecord, Long> {

    Optional<EnvironmentRecord> findByProjectIdAndEnvironmentName(String projectId, CanonicalEnvironment environmentName);

    List<EnvironmentRecord> findByProjectId(String projectId);
}
