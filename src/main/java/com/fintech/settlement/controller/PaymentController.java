package com.fintech.settlement.controller;

import com.fintech.settlement.dto.CreatePaymentIntentRequest;
import com.fintech.settlement.dto.PaymentIntentCommand;
import com.fintech.settlement.dto.RefundRequest;
import com.fintech.settlement.dto.SweepResult;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.service.PaymentIntentService;
import com.fintech.settlement.service.PaymentIntentService.IntentStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

/**
 * REST API for payment intents.
 * <p>
 * Provides endpoints for:
 * - Creating and initiating collections
 * - Manual status refresh, cancellation and refunds
 * - Triggering the expiry sweep from an external scheduler
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Payments", description = "Payment intent lifecycle API")
public class PaymentController {

    static final String TENANT_HEADER = "X-Tenant-ID";

    private final PaymentIntentService paymentIntentService;
    private final Clock clock;

    @Operation(
            summary = "Create a payment intent",
            description = "Creates an intent in CREATED state. Repeating the idempotency key returns the existing intent."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Intent created or returned",
                    content = @Content(schema = @Schema(implementation = PaymentIntent.class))),
            @ApiResponse(responseCode = "400", description = "Invalid amount, currency or provider"),
            @ApiResponse(responseCode = "409", description = "Same idempotency key is being processed")
    })
    @PostMapping
    public ResponseEntity<PaymentIntent> create(@RequestHeader(TENANT_HEADER) String tenantId,
                                                @Valid @RequestBody CreatePaymentIntentRequest request) {
        PaymentIntent intent = paymentIntentService.createIntent(PaymentIntentCommand.builder()
                .tenantId(tenantId)
                .subjectId(request.getSubjectId())
                .payerAccount(request.getPayerAccount())
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .provider(request.getProvider())
                .idempotencyKey(request.getIdempotencyKey())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(intent);
    }

    @Operation(summary = "Initiate collection", description = "Sends the collection request to the provider once.")
    @PostMapping("/{id}/initiate")
    public ResponseEntity<PaymentIntent> initiate(@RequestHeader(TENANT_HEADER) String tenantId,
                                                  @Parameter(description = "Intent ID") @PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.initiate(tenantId, id));
    }

    @Operation(summary = "Get payment intent")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Intent found"),
            @ApiResponse(responseCode = "404", description = "Intent not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<PaymentIntent> get(@RequestHeader(TENANT_HEADER) String tenantId,
                                             @PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.getIntent(tenantId, id));
    }

    @Operation(summary = "List provider payments of an intent")
    @GetMapping("/{id}/payments")
    public ResponseEntity<List<Payment>> payments(@RequestHeader(TENANT_HEADER) String tenantId,
                                                  @PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.getPayments(tenantId, id));
    }

    @Operation(
            summary = "Refresh status from provider",
            description = "Queries the provider for an intent whose callback is overdue and settles a final answer."
    )
    @PostMapping("/{id}/refresh")
    public ResponseEntity<PaymentIntent> refresh(@RequestHeader(TENANT_HEADER) String tenantId,
                                                 @PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.refreshStatus(tenantId, id));
    }

    @Operation(summary = "Cancel an intent that was not initiated")
    @PostMapping("/{id}/cancel")
    public ResponseEntity<PaymentIntent> cancel(@RequestHeader(TENANT_HEADER) String tenantId,
                                                @PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.cancel(tenantId, id));
    }

    @Operation(
            summary = "Refund a settled intent",
            description = "Reverses the payment at the provider and posts offsetting ledger entries. Returns the reversal intent."
    )
    @PostMapping("/{id}/refund")
    public ResponseEntity<PaymentIntent> refund(@RequestHeader(TENANT_HEADER) String tenantId,
                                                @PathVariable Long id,
                                                @Valid @RequestBody RefundRequest request) {
        log.info("Refund of intent {} requested: {}", id, request.getReason());
        return ResponseEntity.ok(paymentIntentService.refund(tenantId, id, request.getReason()));
    }

    @Operation(summary = "Run the expiry sweep", description = "Finalizes intents whose callback or initiation is overdue.")
    @PostMapping("/expiry/run")
    public ResponseEntity<SweepResult> runExpiry() {
        log.info("Manual expiry sweep triggered via API");
        return ResponseEntity.ok(paymentIntentService.expireOverdue(clock.instant()));
    }

    @Operation(summary = "Get payment intent statistics")
    @GetMapping("/stats")
    public ResponseEntity<IntentStats> stats() {
        return ResponseEntity.ok(paymentIntentService.getStats());
    }
}
