package com.fintech.settlement.repository;

import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByProviderAndProviderReference(String provider, String providerReference);

    boolean existsByProviderAndProviderEventId(String provider, String providerEventId);

    List<Payment> findByIntentIdOrderByCreatedAtAsc(Long intentId);

    long countByIntentIdAndStatus(Long intentId, PaymentStatus status);
}
