package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A request to collect money from a subject through one provider.
 * <p>
 * The idempotency key is supplied by the caller (or derived deterministically by the
 * subscription engine) and is unique across all intents.
 */
@Entity
@Table(name = "payment_intents", indexes = {
        @Index(name = "idx_intent_idempotency_key", columnList = "idempotency_key", unique = true),
        @Index(name = "idx_intent_status_updated_at", columnList = "status, updated_at"),
        @Index(name = "idx_intent_subscription", columnList = "subscription_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "subject_id", nullable = false, length = 64)
    private String subjectId;

    @Column(name = "subscription_id")
    private Long subscriptionId;

    /**
     * Provider-side account charged, e.g. an MSISDN in 2547XXXXXXXX form.
     */
    @Column(name = "payer_account", length = 32)
    private String payerAccount;

    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "idempotency_key", nullable = false, unique = true, length = 150)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PaymentPurpose purpose;

    @Column(name = "reversal_of")
    private Long reversalOf;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PaymentIntentStatus status;

    @Column(nullable = false, length = 30)
    private String provider;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public void transitionTo(PaymentIntentStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Payment intent " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        this.updatedAt = at;
    }
}
