package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Recurring billing agreement between a tenant and one of its subjects.
 */
@Entity
@Table(name = "subscriptions", indexes = {
        @Index(name = "idx_subscription_status_renewal", columnList = "status, next_renewal_at"),
        @Index(name = "idx_subscription_subject", columnList = "tenant_id, subject_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "subject_id", nullable = false, length = 64)
    private String subjectId;

    @Column(name = "payer_account", nullable = false, length = 32)
    private String payerAccount;

    @Column(nullable = false, length = 30)
    private String provider;

    @Column(name = "plan_code", nullable = false, length = 50)
    private String planCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "billing_interval", nullable = false, length = 10)
    private BillingInterval interval;

    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status;

    /**
     * Start of the first period. Every period boundary is derived from it.
     */
    @Column(name = "billing_anchor", nullable = false, updatable = false)
    private Instant billingAnchor;

    /**
     * Zero-based number of the current period.
     */
    @Builder.Default
    @Column(name = "period_number", nullable = false)
    private long periodNumber = 0;

    @Column(name = "current_period_start", nullable = false)
    private Instant currentPeriodStart;

    @Column(name = "current_period_end", nullable = false)
    private Instant currentPeriodEnd;

    @Column(name = "next_renewal_at", nullable = false)
    private Instant nextRenewalAt;

    /**
     * Free plan to fall back to when dunning is exhausted. Null means cancel instead.
     */
    @Column(name = "downgrade_plan_code", length = 50)
    private String downgradePlanCode;

    @Builder.Default
    @Column(nullable = false)
    private boolean billable = true;

    @Column(name = "pending_renewal_intent_id")
    private Long pendingRenewalIntentId;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public void transitionTo(SubscriptionStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Subscription " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        this.updatedAt = at;
    }

    /**
     * Rolls the billing period forward by one interval, measured from the billing anchor.
     */
    public void advancePeriod(Instant at) {
        this.periodNumber++;
        this.currentPeriodStart = currentPeriodEnd;
        this.currentPeriodEnd = interval.periodEnd(billingAnchor, periodNumber + 1);
        this.nextRenewalAt = currentPeriodEnd;
        this.pendingRenewalIntentId = null;
        this.updatedAt = at;
    }
}
