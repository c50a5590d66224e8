package com.fintech.settlement.integration;

import com.fintech.settlement.dto.PaymentIntentCommand;
import com.fintech.settlement.dto.ProviderOutcome;
import com.fintech.settlement.dto.WebhookOutcome;
import com.fintech.settlement.dto.WebhookResult;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.entity.PaymentIntentStatus;
import com.fintech.settlement.entity.PaymentStatus;
import com.fintech.settlement.service.LedgerService;
import com.fintech.settlement.service.PaymentIntentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentFlowIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private PaymentIntentService paymentIntentService;

    @Autowired
    private LedgerService ledgerService;

    private PaymentIntent createAndInitiate(String idempotencyKey, long amount) {
        PaymentIntent intent = paymentIntentService.createIntent(PaymentIntentCommand.builder()
                .tenantId(TENANT)
                .subjectId("customer-1")
                .payerAccount("254712345678")
                .amount(amount)
                .currency("KES")
                .provider("sandbox")
                .idempotencyKey(idempotencyKey)
                .build());
        return paymentIntentService.initiate(TENANT, intent.getId());
    }

    private String referenceOf(PaymentIntent intent) {
        return paymentRepository.findByIntentIdOrderByCreatedAtAsc(intent.getId()).get(0).getProviderReference();
    }

    @Test
    @DisplayName("Collection flow - callback settles the intent and books balanced ledger entries once")
    void collectionFlow() {
        // Given
        PaymentIntent initiated = createAndInitiate("order-1", 50_000L);
        assertThat(initiated.getStatus()).isEqualTo(PaymentIntentStatus.PROVIDER_INITIATED);
        String reference = referenceOf(initiated);
        sandbox.completeTransaction(reference, ProviderOutcome.SUCCESS);
        String payload = sandbox.callbackPayload(reference);

        // When
        WebhookResult first = paymentIntentService.handleCallback("sandbox", payload);
        WebhookResult replay = paymentIntentService.handleCallback("sandbox", payload);

        // Then
        assertThat(first.getOutcome()).isEqualTo(WebhookOutcome.PROCESSED);
        assertThat(first.getResult()).isEqualTo("SUCCEEDED");
        assertThat(replay.getOutcome()).isEqualTo(WebhookOutcome.DUPLICATE);
        assertThat(replay.isAckRequired()).isTrue();

        PaymentIntent settled = paymentIntentService.getIntent(TENANT, initiated.getId());
        assertThat(settled.getStatus()).isEqualTo(PaymentIntentStatus.SUCCEEDED);

        List<Payment> payments = paymentRepository.findByIntentIdOrderByCreatedAtAsc(initiated.getId());
        assertThat(payments).hasSize(1);
        assertThat(payments.get(0).getStatus()).isEqualTo(PaymentStatus.CONFIRMED);
        assertThat(payments.get(0).getReceiptNumber()).isEqualTo("RCPT-" + reference);

        assertThat(ledgerEntryRepository.count()).isEqualTo(2);
        assertThat(ledgerService.balanceOf(TENANT, "cash:sandbox", clock.instant())).isEqualTo(50_000L);
        assertThat(ledgerService.balanceOf(TENANT, "revenue:payments", clock.instant())).isEqualTo(50_000L);
        assertThat(ledgerService.unbalancedGroups()).isEmpty();
    }

    @Test
    @DisplayName("Repeated create with the same key returns the existing intent and never re-contacts the provider")
    void idempotentCreateAndInitiate() {
        // Given
        PaymentIntent initiated = createAndInitiate("order-2", 10_000L);

        // When
        PaymentIntent again = createAndInitiate("order-2", 10_000L);

        // Then
        assertThat(again.getId()).isEqualTo(initiated.getId());
        assertThat(intentRepository.count()).isEqualTo(1);
        assertThat(paymentRepository.count()).isEqualTo(1);
        assertThat(sandbox.getInitiateCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent deliveries of one callback - exactly one is processed")
    void concurrentCallbacks() throws Exception {
        // Given
        PaymentIntent initiated = createAndInitiate("order-3", 75_000L);
        String reference = referenceOf(initiated);
        sandbox.completeTransaction(reference, ProviderOutcome.SUCCESS);
        String payload = sandbox.callbackPayload(reference);

        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WebhookResult>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Callable<WebhookResult> delivery = () -> {
                start.await();
                return paymentIntentService.handleCallback("sandbox", payload);
            };
            futures.add(executor.submit(delivery));
        }

        // When
        start.countDown();
        int processed = 0;
        for (Future<WebhookResult> future : futures) {
            try {
                if (future.get(30, TimeUnit.SECONDS).getOutcome() == WebhookOutcome.PROCESSED) {
                    processed++;
                }
            } catch (ExecutionException e) {
                // a delivery that lost a database race fails; the provider would redeliver it
            }
        }
        executor.shutdown();

        // Then
        assertThat(processed).isEqualTo(1);
        assertThat(ledgerEntryRepository.findByTransactionGroupIdOrderByLineNumberAsc(
                LedgerService.settlementGroup(paymentRepository.findByIntentIdOrderByCreatedAtAsc(initiated.getId())
                        .get(0).getId())))
                .hasSize(2);
        assertThat(ledgerEntryRepository.count()).isEqualTo(2);
        assertThat(ledgerService.balanceOf(TENANT, "cash:sandbox", clock.instant())).isEqualTo(75_000L);
    }

    @Test
    @DisplayName("Failure callback fails the intent without touching the ledger")
    void failureCallback() {
        // Given
        PaymentIntent initiated = createAndInitiate("order-4", 20_000L);
        String reference = referenceOf(initiated);
        sandbox.completeTransaction(reference, ProviderOutcome.FAILURE);

        // When
        WebhookResult result = paymentIntentService.handleCallback("sandbox", sandbox.callbackPayload(reference));

        // Then
        assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.PROCESSED);
        assertThat(paymentIntentService.getIntent(TENANT, initiated.getId()).getStatus())
                .isEqualTo(PaymentIntentStatus.FAILED);
        assertThat(ledgerEntryRepository.count()).isZero();
    }

    @Test
    @DisplayName("Malformed and unmatched callbacks are acknowledged without side effects")
    void malformedAndUnmatched() {
        // When
        WebhookResult malformed = paymentIntentService.handleCallback("sandbox", "not json");
        WebhookResult unmatched = paymentIntentService.handleCallback("sandbox",
                "{\"eventId\":\"EVT-X\",\"reference\":\"SBX-unknown\",\"status\":\"SUCCESS\",\"amount\":100}");

        // Then
        assertThat(malformed.getOutcome()).isEqualTo(WebhookOutcome.MALFORMED);
        assertThat(malformed.isAckRequired()).isTrue();
        assertThat(unmatched.getOutcome()).isEqualTo(WebhookOutcome.UNMATCHED);
        assertThat(ledgerEntryRepository.count()).isZero();
        assertThat(idempotencyRecordRepository.findByIdempotencyKey("webhook:sandbox:EVT-X")).isEmpty();
    }

    @Test
    @DisplayName("Expiry sweep settles a silent intent from the provider status query")
    void expirySweepUsesStatusQuery() {
        // Given
        PaymentIntent confirmedLate = createAndInitiate("order-5", 30_000L);
        sandbox.completeTransaction(referenceOf(confirmedLate), ProviderOutcome.SUCCESS);
        PaymentIntent silent = createAndInitiate("order-6", 40_000L);
        clock.advance(Duration.ofMinutes(11));

        // When
        paymentIntentService.expireOverdue(clock.instant());

        // Then
        assertThat(paymentIntentService.getIntent(TENANT, confirmedLate.getId()).getStatus())
                .isEqualTo(PaymentIntentStatus.SUCCEEDED);
        assertThat(paymentIntentService.getIntent(TENANT, silent.getId()).getStatus())
                .isEqualTo(PaymentIntentStatus.EXPIRED);
        assertThat(ledgerService.balanceOf(TENANT, "cash:sandbox", clock.instant())).isEqualTo(30_000L);
    }

    @Test
    @DisplayName("Refund reverses the settlement and nets the cash account to zero")
    void refundFlow() {
        // Given
        PaymentIntent initiated = createAndInitiate("order-7", 50_000L);
        String reference = referenceOf(initiated);
        sandbox.completeTransaction(reference, ProviderOutcome.SUCCESS);
        paymentIntentService.handleCallback("sandbox", sandbox.callbackPayload(reference));

        // When
        PaymentIntent reversal = paymentIntentService.refund(TENANT, initiated.getId(), "customer request");
        PaymentIntent again = paymentIntentService.refund(TENANT, initiated.getId(), "customer request");

        // Then
        assertThat(again.getId()).isEqualTo(reversal.getId());
        assertThat(sandbox.getReverseCalls()).isEqualTo(1);
        assertThat(paymentIntentService.getIntent(TENANT, initiated.getId()).getStatus())
                .isEqualTo(PaymentIntentStatus.REVERSED);
        assertThat(ledgerService.balanceOf(TENANT, "cash:sandbox", clock.instant())).isZero();
        assertThat(ledgerService.balanceOf(TENANT, "revenue:payments", clock.instant())).isZero();
        assertThat(ledgerEntryRepository.count()).isEqualTo(4);
        assertThat(ledgerService.unbalancedGroups()).isEmpty();
    }
}
