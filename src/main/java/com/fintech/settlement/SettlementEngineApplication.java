package com.fintech.settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Payment and Subscription Settlement Engine
 * <p>
 * Collects mobile-money payments (M-Pesa STK push, Airtel Money), settles them into a
 * double-entry ledger exactly once and runs subscription renewals with dunning.
 * <p>
 * Key Features:
 * - Idempotent intent creation, initiation, callback handling and refunds
 * - Resilient provider API communication with retry and circuit breaker
 * - Renewal and dunning sweeps driven only by time and persisted state
 * - Daily reconciliation of ledger cash against provider settlement totals
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class SettlementEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SettlementEngineApplication.class, args);
    }
}
