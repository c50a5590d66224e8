package com.fintech.settlement.repository;

import com.fintech.settlement.entity.Subscription;
import com.fintech.settlement.entity.SubscriptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByIdAndTenantId(Long id, String tenantId);

    /**
     * Billable subscriptions whose renewal date has passed and that have no renewal in flight.
     */
    @Query("SELECT s FROM Subscription s WHERE s.status = :status AND s.billable = true " +
            "AND s.nextRenewalAt <= :now AND s.pendingRenewalIntentId IS NULL ORDER BY s.nextRenewalAt ASC")
    List<Subscription> findDueForRenewal(@Param("status") SubscriptionStatus status,
                                         @Param("now") Instant now);

    /**
     * Subscriptions still waiting on a renewal intent; the renewal sweep uses it to catch up on
     * outcomes whose event was not applied.
     */
    List<Subscription> findByStatusAndPendingRenewalIntentIdIsNotNull(SubscriptionStatus status);

    long countByStatus(SubscriptionStatus status);
}
