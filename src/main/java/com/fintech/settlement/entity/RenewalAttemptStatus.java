package com.fintech.settlement.entity;

public enum RenewalAttemptStatus {
    PENDING,
    /**
     * Collection initiated, outcome not known yet.
     */
    SENT,
    FAILED,
    SUCCEEDED,
    CANCELLED
}
