package com.fintech.settlement.repository;

import com.fintech.settlement.entity.DunningSchedule;
import com.fintech.settlement.entity.DunningStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DunningScheduleRepository extends JpaRepository<DunningSchedule, Long> {

    List<DunningSchedule> findByStatusOrderByFailedAtAsc(DunningStatus status);

    Optional<DunningSchedule> findFirstBySubscriptionIdAndStatus(Long subscriptionId, DunningStatus status);

    List<DunningSchedule> findBySubscriptionIdOrderByCreatedAtDesc(Long subscriptionId);
}
