package com.fintech.settlement.repository;

import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.entity.PaymentIntentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentIntentRepository extends JpaRepository<PaymentIntent, Long> {

    Optional<PaymentIntent> findByIdempotencyKey(String idempotencyKey);

    Optional<PaymentIntent> findByIdAndTenantId(Long id, String tenantId);

    /**
     * Intents in the given status that have not moved since {@code updatedBefore}.
     * Feeds the expiry sweep.
     */
    @Query("SELECT i FROM PaymentIntent i WHERE i.status = :status " +
            "AND i.updatedAt < :updatedBefore ORDER BY i.updatedAt ASC")
    List<PaymentIntent> findStale(@Param("status") PaymentIntentStatus status,
                                  @Param("updatedBefore") Instant updatedBefore);

    List<PaymentIntent> findByReversalOf(Long reversalOf);

    @Query("SELECT DISTINCT i.tenantId FROM PaymentIntent i")
    List<String> findDistinctTenantIds();

    long countByStatus(PaymentIntentStatus status);
}
