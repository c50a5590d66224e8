package com.fintech.settlement.repository;

import com.fintech.settlement.entity.RenewalAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RenewalAttemptRepository extends JpaRepository<RenewalAttempt, Long> {

    List<RenewalAttempt> findByScheduleIdOrderBySequenceNumberAsc(Long scheduleId);

    Optional<RenewalAttempt> findByIntentId(Long intentId);
}
