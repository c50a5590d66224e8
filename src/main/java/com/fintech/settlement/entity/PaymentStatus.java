package com.fintech.settlement.entity;

/**
 * Provider-side state of a single collection attempt.
 */
public enum PaymentStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    REVERSED
}
