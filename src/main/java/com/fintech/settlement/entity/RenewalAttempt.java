package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One scheduled retry inside a {@link DunningSchedule}.
 */
@Entity
@Table(name = "renewal_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_attempt_schedule_sequence",
                columnNames = {"schedule_id", "sequence_number"}),
        indexes = {
                @Index(name = "idx_attempt_intent", columnList = "intent_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenewalAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_id", nullable = false)
    private Long scheduleId;

    @Column(name = "subscription_id", nullable = false)
    private Long subscriptionId;

    @Column(name = "sequence_number", nullable = false)
    private Integer sequenceNumber;

    @Column(name = "offset_days", nullable = false)
    private Integer offsetDays;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RenewalAttemptStatus status;

    @Column(name = "intent_id")
    private Long intentId;

    @Column(name = "attempted_at")
    private Instant attemptedAt;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Version
    private Long version;
}
