package com.dbbaskette.envsync.repository;

import com.dbbaskette.envsync.model.SyncEvent;
import com.dbbaskette.envsync.model.SyncOperation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SyncEventRepository extends JpaRepository<SyncEvent, Long> {

    List<SyncEvent> findByProjectIdOrderByCreatedAtDesc(String projectId, Pageable pageable);

    List<SyncEvent> findByCorrelationIdOrderByCreatedAtAsc(String correlationId);

    Optional<SyncEvent> findFirstByProjectIdAndOperationInOrderByCreatedAtDesc(String projectId,
                                                                               Collection<SyncOperation> operations);

    @Modifying
    @Transactional
    @Query("delete from SyncEvent e where e.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
