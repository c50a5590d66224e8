package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of a reconciliation run over one settlement date.
 * Used for reporting, monitoring, and audit trails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationRunResult {

    private LocalDate settlementDate;
    private Instant startedAt;
    private Instant completedAt;

    @Builder.Default
    private int pairsProcessed = 0;

    @Builder.Default
    private int matched = 0;

    @Builder.Default
    private int discrepancies = 0;

    @Builder.Default
    private int reportsMissing = 0;

    /**
     * Records already RESOLVED by an operator, left untouched.
     */
    @Builder.Default
    private int skippedResolved = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<ReconciliationError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReconciliationError {
        private String tenantId;
        private String provider;
        private String errorMessage;
        private Instant occurredAt;
    }

    public void incrementPairsProcessed() {
        this.pairsProcessed++;
    }

    public void incrementMatched() {
        this.matched++;
    }

    public void incrementDiscrepancies() {
        this.discrepancies++;
    }

    public void incrementReportsMissing() {
        this.reportsMissing++;
    }

    public void incrementSkippedResolved() {
        this.skippedResolved++;
    }

    public void addError(String tenantId, String provider, String errorMessage, Instant occurredAt) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(ReconciliationError.builder()
                .tenantId(tenantId)
                .provider(provider)
                .errorMessage(errorMessage)
                .occurredAt(occurredAt)
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
