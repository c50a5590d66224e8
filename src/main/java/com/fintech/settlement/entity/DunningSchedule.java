package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Retry plan for one PAST_DUE episode of a subscription.
 */
@Entity
@Table(name = "dunning_schedules", indexes = {
        @Index(name = "idx_dunning_status", columnList = "status"),
        @Index(name = "idx_dunning_subscription", columnList = "subscription_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DunningSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subscription_id", nullable = false)
    private Long subscriptionId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    /**
     * T: the moment the renewal failed. Attempt offsets and the grace deadline are relative to it.
     */
    @Column(name = "failed_at", nullable = false)
    private Instant failedAt;

    @Column(name = "grace_deadline", nullable = false)
    private Instant graceDeadline;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DunningStatus status;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;
}
