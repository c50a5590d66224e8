package com.fintech.settlement.entity;

public enum IdempotencyStatus {
    IN_FLIGHT,
    COMPLETED
}
