package com.fintech.settlement.scheduler;

import com.fintech.settlement.dto.ReconciliationRunResult;
import com.fintech.settlement.dto.SweepResult;
import com.fintech.settlement.exception.ReconciliationException;
import com.fintech.settlement.service.PaymentIntentService;
import com.fintech.settlement.service.ReconciliationService;
import com.fintech.settlement.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Triggers the time-driven sweeps. Each sweep only reads {@code now} and persisted state, so a
 * missed, late or doubled trigger is harmless; the same sweeps are exposed over HTTP for an
 * external scheduler.
 * <p>
 * Defaults: renewals hourly, dunning every six hours, expiry every 15 minutes, reconciliation
 * daily at 02:00 UTC for the previous day.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementScheduler {

    private final SubscriptionService subscriptionService;
    private final PaymentIntentService paymentIntentService;
    private final ReconciliationService reconciliationService;
    private final Clock clock;

    @Value("${settlement.scheduler.renewals.enabled:true}")
    private boolean renewalsEnabled;

    @Value("${settlement.scheduler.dunning.enabled:true}")
    private boolean dunningEnabled;

    @Value("${settlement.scheduler.expiry.enabled:true}")
    private boolean expiryEnabled;

    @Value("${settlement.scheduler.reconciliation.enabled:true}")
    private boolean reconciliationEnabled;

    @Scheduled(cron = "${settlement.scheduler.renewals.cron:0 0 * * * *}", zone = "UTC")
    public void runRenewals() {
        if (!renewalsEnabled) {
            log.debug("Renewal scheduler is disabled, skipping run");
            return;
        }
        try {
            logSweep(subscriptionService.processDueRenewals(clock.instant()));
        } catch (Exception e) {
            log.error("Scheduled renewal sweep failed with unexpected error", e);
        }
    }

    @Scheduled(cron = "${settlement.scheduler.dunning.cron:0 0 */6 * * *}", zone = "UTC")
    public void runDunning() {
        if (!dunningEnabled) {
            log.debug("Dunning scheduler is disabled, skipping run");
            return;
        }
        try {
            logSweep(subscriptionService.processDunning(clock.instant()));
        } catch (Exception e) {
            log.error("Scheduled dunning sweep failed with unexpected error", e);
        }
    }

    @Scheduled(cron = "${settlement.scheduler.expiry.cron:0 */15 * * * *}", zone = "UTC")
    public void runExpiry() {
        if (!expiryEnabled) {
            log.debug("Expiry scheduler is disabled, skipping run");
            return;
        }
        try {
            logSweep(paymentIntentService.expireOverdue(clock.instant()));
        } catch (Exception e) {
            log.error("Scheduled expiry sweep failed with unexpected error", e);
        }
    }

    @Scheduled(cron = "${settlement.scheduler.reconciliation.cron:0 0 2 * * *}", zone = "UTC")
    public void runReconciliation() {
        if (!reconciliationEnabled) {
            log.debug("Reconciliation scheduler is disabled, skipping run");
            return;
        }
        LocalDate yesterday = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1);
        try {
            ReconciliationRunResult result = reconciliationService.reconcileAll(yesterday);
            if (result.getDiscrepancies() > 0 || result.getReportsMissing() > 0) {
                log.warn("Reconciliation for {} needs review: {} discrepancies, {} missing reports",
                        yesterday, result.getDiscrepancies(), result.getReportsMissing());
            }
        } catch (ReconciliationException e) {
            log.warn("Reconciliation skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed with unexpected error", e);
        }
    }

    private void logSweep(SweepResult result) {
        if (result.getExamined() == 0) {
            log.debug("Sweep {} found nothing to do", result.getSweep());
        } else {
            log.info("Sweep {} completed in {}ms: {} examined, {} acted, {} errors",
                    result.getSweep(), result.getDurationMs(), result.getExamined(),
                    result.getActed(), result.getErrors());
        }
    }
}
