package com.fintech.settlement.controller;

import com.fintech.settlement.dto.ReconciliationRunResult;
import com.fintech.settlement.dto.ResolveDiscrepancyRequest;
import com.fintech.settlement.dto.StatementImportRequest;
import com.fintech.settlement.entity.ReconciliationRecord;
import com.fintech.settlement.entity.ResolutionStatus;
import com.fintech.settlement.entity.SettlementStatement;
import com.fintech.settlement.service.ReconciliationService;
import com.fintech.settlement.service.ReconciliationService.ReconciliationStats;
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
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * REST API for settlement reconciliation.
 * <p>
 * Provides endpoints for:
 * - Triggering a reconciliation run for a settlement date
 * - Reviewing and resolving discrepancies
 * - Importing provider statement totals
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Settlement reconciliation operations API")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final Clock clock;

    @Operation(
            summary = "Trigger reconciliation",
            description = "Reconciles every tenant/provider pair with cash movement on the date (default yesterday, UTC)."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciliation completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationRunResult.class))),
            @ApiResponse(responseCode = "409", description = "Reconciliation already in progress")
    })
    @PostMapping("/run")
    public ResponseEntity<ReconciliationRunResult> run(
            @Parameter(description = "Settlement date (UTC)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate settlementDate = date != null ? date
                : LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1);
        log.info("Manual reconciliation for {} triggered via API", settlementDate);
        return ResponseEntity.ok(reconciliationService.reconcileAll(settlementDate));
    }

    @Operation(summary = "List reconciliation records", description = "Optionally filtered by resolution status.")
    @GetMapping("/records")
    public ResponseEntity<Page<ReconciliationRecord>> records(
            @RequestParam(required = false) ResolutionStatus status,
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(reconciliationService.listRecords(status, PageRequest.of(page, size)));
    }

    @Operation(summary = "Resolve a discrepancy", description = "Operator sign-off; the ledger is not changed.")
    @PostMapping("/records/{id}/resolve")
    public ResponseEntity<ReconciliationRecord> resolve(@PathVariable Long id,
                                                        @Valid @RequestBody ResolveDiscrepancyRequest request) {
        return ResponseEntity.ok(reconciliationService.resolve(id, request.getNote()));
    }

    @Operation(summary = "Import a provider statement total")
    @PostMapping("/statements")
    public ResponseEntity<SettlementStatement> importStatement(
            @RequestHeader(PaymentController.TENANT_HEADER) String tenantId,
            @Valid @RequestBody StatementImportRequest request) {
        return ResponseEntity.ok(reconciliationService.importStatement(tenantId, request));
    }

    @Operation(summary = "Get reconciliation statistics")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = ReconciliationStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<ReconciliationStats> getStats() {
        return ResponseEntity.ok(reconciliationService.getStats());
    }

    @Operation(summary = "Health check", description = "Used by load balancers and monitoring systems.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        ReconciliationStats stats = reconciliationService.getStats();
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "reconciliation", Map.of(
                        "isRunning", stats.isReconciliationRunning(),
                        "pendingDiscrepancies", stats.getPendingCount(),
                        "reportsMissing", stats.getReportMissingCount())));
    }
}
