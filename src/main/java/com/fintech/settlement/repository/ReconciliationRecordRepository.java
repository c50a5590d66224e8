package com.fintech.settlement.repository;

import com.fintech.settlement.entity.ReconciliationRecord;
import com.fintech.settlement.entity.ResolutionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface ReconciliationRecordRepository extends JpaRepository<ReconciliationRecord, Long> {

    Optional<ReconciliationRecord> findByTenantIdAndProviderAndSettlementDate(String tenantId,
                                                                             String provider,
                                                                             LocalDate settlementDate);

    Page<ReconciliationRecord> findByResolutionStatus(ResolutionStatus resolutionStatus, Pageable pageable);

    long countByResolutionStatus(ResolutionStatus resolutionStatus);
}
