package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One line of the double-entry journal.
 * <p>
 * Rows are written once and never updated or deleted. Exactly one of debitAmount and
 * creditAmount is non-zero. All lines sharing a transaction group balance.
 */
@Entity
@Immutable
@Table(name = "ledger_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_ledger_group_line",
                columnNames = {"transaction_group_id", "line_number"}),
        indexes = {
                @Index(name = "idx_ledger_account_created", columnList = "tenant_id, account, created_at"),
                @Index(name = "idx_ledger_reference", columnList = "reference")
        })
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_group_id", nullable = false, length = 100, updatable = false)
    private String transactionGroupId;

    @Column(name = "line_number", nullable = false, updatable = false)
    private Integer lineNumber;

    @Column(name = "tenant_id", nullable = false, length = 64, updatable = false)
    private String tenantId;

    @Column(nullable = false, length = 64, updatable = false)
    private String account;

    @Column(name = "debit_amount", nullable = false, updatable = false)
    private long debitAmount;

    @Column(name = "credit_amount", nullable = false, updatable = false)
    private long creditAmount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(nullable = false, length = 150, updatable = false)
    private String reference;

    @Column(name = "reverses_group_id", length = 100, updatable = false)
    private String reversesGroupId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isDebit() {
        return debitAmount > 0;
    }
}
