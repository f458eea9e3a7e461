package com.dbbaskette.envsync.repository;

import com.dbbaskette.envsync.model.QuotaRecord;
import com.dbbaskette.envsync.model.QuotaType;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;

public interface QuotaRecordRepository extends JpaRepository<QuotaRecord, Long> {

    Optional<QuotaRecord> findByProjectIdAndQuotaType(String projectId, QuotaType quotaType);
}
