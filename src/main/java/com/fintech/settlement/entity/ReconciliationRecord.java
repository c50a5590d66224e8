package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Daily comparison of the ledger's confirmed inbound total against the provider's settlement total.
 * <p>
 * Advisory only: a discrepancy is never auto-corrected in the ledger.
 */
@Entity
@Table(name = "reconciliation_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_reconciliation_day",
                columnNames = {"tenant_id", "provider", "settlement_date"}),
        indexes = {
                @Index(name = "idx_reconciliation_resolution", columnList = "resolution_status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 30)
    private String provider;

    @Column(name = "settlement_date", nullable = false)
    private LocalDate settlementDate;

    @Column(name = "expected_total", nullable = false)
    private Long expectedTotal;

    @Column(name = "reported_total")
    private Long reportedTotal;

    @Column(nullable = false)
    private Long discrepancy;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_status", nullable = false, length = 20)
    private ResolutionStatus resolutionStatus;

    @Column(name = "resolution_note", length = 500)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
