package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The provider-side record of one attempt to settle a {@link PaymentIntent}.
 * <p>
 * provider_event_id is unique per provider: a second callback carrying the same id can never
 * be attached to another payment.
 */
@Entity
@Table(name = "payments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_payment_provider_event", columnNames = {"provider", "provider_event_id"}),
                @UniqueConstraint(name = "uk_payment_provider_reference", columnNames = {"provider", "provider_reference"})
        },
        indexes = {
                @Index(name = "idx_payment_intent", columnList = "intent_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "intent_id", nullable = false)
    private Long intentId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 30)
    private String provider;

    @Column(name = "provider_reference", length = 100)
    private String providerReference;

    @Column(name = "provider_event_id", length = 200)
    private String providerEventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false)
    private Long amount;

    @Column(name = "receipt_number", length = 100)
    private String receiptNumber;

    /**
     * JSON of the normalized event that settled this payment. Raw provider bodies are never stored here.
     */
    @Lob
    @Column(name = "normalized_payload")
    private String normalizedPayload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
