package com.dbbaskette.envsync.repository;

import com.dbbaskette.envsync.model.SecretMapping;
import com.dbbaskette.envsync.model.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SecretMappingRepository extends JpaRepository<SecretMapping, Long> {

    Optional<SecretMapping> findByProjectIdAndSecretName(String projectId, String secretName);

    List<SecretMapping> findByProjectId(String projectId);

    List<SecretMapping> findByProjectIdAndSecretNameIn(String projectId, Collection<String> secretNames);

    long countByProjectIdAndSyncStatus(String projectId, SyncStatus syncStatus);
}
