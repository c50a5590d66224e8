package com.fintech.settlement.entity;

/**
 * Outcome of comparing ledger and provider totals for one provider-day.
 */
public enum ResolutionStatus {
    /**
     * Totals agree.
     */
    MATCHED,

    /**
     * Totals differ; waiting for an operator.
     */
    PENDING,

    /**
     * The provider had no settlement total for the day.
     */
    REPORT_MISSING,

    /**
     * An operator investigated and closed the discrepancy.
     */
    RESOLVED
}
