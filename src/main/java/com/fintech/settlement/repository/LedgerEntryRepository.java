package com.fintech.settlement.repository;

import com.fintech.settlement.entity.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Read and append access to the journal. There are deliberately no update or delete queries.
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    boolean existsByTransactionGroupId(String transactionGroupId);

    boolean existsByReferenceAndTransactionGroupId(String reference, String transactionGroupId);

    List<LedgerEntry> findByTransactionGroupIdOrderByLineNumberAsc(String transactionGroupId);

    List<LedgerEntry> findByReferenceOrderByIdAsc(String reference);

    List<LedgerEntry> findByTenantIdAndAccountOrderByIdAsc(String tenantId, String account);

    @Query("SELECT COALESCE(SUM(e.debitAmount), 0) FROM LedgerEntry e " +
            "WHERE e.tenantId = :tenantId AND e.account = :account AND e.createdAt <= :asOf")
    long sumDebits(@Param("tenantId") String tenantId,
                   @Param("account") String account,
                   @Param("asOf") Instant asOf);

    @Query("SELECT COALESCE(SUM(e.creditAmount), 0) FROM LedgerEntry e " +
            "WHERE e.tenantId = :tenantId AND e.account = :account AND e.createdAt <= :asOf")
    long sumCredits(@Param("tenantId") String tenantId,
                    @Param("account") String account,
                    @Param("asOf") Instant asOf);

    @Query("SELECT COALESCE(SUM(e.debitAmount), 0) FROM LedgerEntry e " +
            "WHERE e.tenantId = :tenantId AND e.account = :account " +
            "AND e.createdAt >= :from AND e.createdAt < :to")
    long sumDebitsBetween(@Param("tenantId") String tenantId,
                          @Param("account") String account,
                          @Param("from") Instant from,
                          @Param("to") Instant to);

    @Query("SELECT COALESCE(SUM(e.creditAmount), 0) FROM LedgerEntry e " +
            "WHERE e.tenantId = :tenantId AND e.account = :account " +
            "AND e.createdAt >= :from AND e.createdAt < :to")
    long sumCreditsBetween(@Param("tenantId") String tenantId,
                           @Param("account") String account,
                           @Param("from") Instant from,
                           @Param("to") Instant to);

    @Query("SELECT DISTINCT e.tenantId FROM LedgerEntry e")
    List<String> findDistinctTenantIds();

    /**
     * Transaction groups whose debits and credits do not match. Must always be empty.
     */
    @Query("SELECT e.transactionGroupId FROM LedgerEntry e GROUP BY e.transactionGroupId " +
            "HAVING SUM(e.debitAmount) <> SUM(e.creditAmount)")
    List<String> findUnbalancedGroups();

    /**
     * Tenant/account pairs with activity in a time window, used to drive reconciliation.
     */
    @Query("SELECT DISTINCT e.tenantId, e.account FROM LedgerEntry e " +
            "WHERE e.account LIKE 'cash:%' AND e.createdAt >= :from AND e.createdAt < :to")
    List<Object[]> findActiveCashAccounts(@Param("from") Instant from, @Param("to") Instant to);
}
