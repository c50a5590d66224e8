package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Settlement total taken from a provider statement export, for providers without a report API.
 */
@Entity
@Table(name = "settlement_statements",
        uniqueConstraints = @UniqueConstraint(name = "uk_statement_day",
                columnNames = {"tenant_id", "provider", "settlement_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementStatement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 30)
    private String provider;

    @Column(name = "settlement_date", nullable = false)
    private LocalDate settlementDate;

    @Column(name = "reported_total", nullable = false)
    private Long reportedTotal;

    @Column(name = "source_reference", length = 200)
    private String sourceReference;

    @Column(name = "imported_at", nullable = false)
    private Instant importedAt;
}
