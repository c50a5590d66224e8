package com.fintech.settlement.repository;

import com.fintech.settlement.entity.SettlementStatement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface SettlementStatementRepository extends JpaRepository<SettlementStatement, Long> {

    Optional<SettlementStatement> findByTenantIdAndProviderAndSettlementDate(String tenantId,
                                                                            String provider,
                                                                            LocalDate settlementDate);

    List<SettlementStatement> findBySettlementDate(LocalDate settlementDate);
}
