package com.fintech.settlement.controller;

import com.fintech.settlement.dto.CreateSubscriptionRequest;
import com.fintech.settlement.dto.DunningScheduleView;
import com.fintech.settlement.dto.SweepResult;
import com.fintech.settlement.entity.Subscription;
import com.fintech.settlement.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Subscriptions", description = "Subscription renewals and dunning")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final Clock clock;

    @Operation(summary = "Create a subscription", description = "The first period is treated as paid; renewal happens at its end.")
    @PostMapping
    public ResponseEntity<Subscription> create(@RequestHeader(PaymentController.TENANT_HEADER) String tenantId,
                                               @Valid @RequestBody CreateSubscriptionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(subscriptionService.createSubscription(tenantId, request));
    }

    @Operation(summary = "Get subscription")
    @GetMapping("/{id}")
    public ResponseEntity<Subscription> get(@RequestHeader(PaymentController.TENANT_HEADER) String tenantId,
                                            @PathVariable Long id) {
        return ResponseEntity.ok(subscriptionService.getSubscription(tenantId, id));
    }

    @Operation(summary = "Cancel subscription", description = "Operator cancellation; closes any open dunning schedule.")
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Subscription> cancel(@RequestHeader(PaymentController.TENANT_HEADER) String tenantId,
                                               @PathVariable Long id) {
        return ResponseEntity.ok(subscriptionService.cancel(tenantId, id));
    }

    @Operation(summary = "Dunning schedules of a subscription", description = "Newest first, with their attempts.")
    @GetMapping("/{id}/dunning")
    public ResponseEntity<List<DunningScheduleView>> dunning(@RequestHeader(PaymentController.TENANT_HEADER) String tenantId,
                                                             @PathVariable Long id) {
        return ResponseEntity.ok(subscriptionService.getDunningSchedules(tenantId, id));
    }

    @Operation(summary = "Run the renewal sweep")
    @PostMapping("/renewals/run")
    public ResponseEntity<SweepResult> runRenewals() {
        log.info("Manual renewal sweep triggered via API");
        return ResponseEntity.ok(subscriptionService.processDueRenewals(clock.instant()));
    }

    @Operation(summary = "Run the dunning sweep")
    @PostMapping("/dunning/run")
    public ResponseEntity<SweepResult> runDunning() {
        log.info("Manual dunning sweep triggered via API");
        return ResponseEntity.ok(subscriptionService.processDunning(clock.instant()));
    }
}
