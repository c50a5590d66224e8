package com.fintech.settlement.controller;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.BalanceResponse;
import com.fintech.settlement.entity.LedgerEntry;
import com.fintech.settlement.service.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the journal.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Double-entry journal queries")
public class LedgerController {

    private final LedgerService ledgerService;
    private final SettlementProperties properties;
    private final Clock clock;

    @Operation(summary = "Account balance", description = "Natural balance of an account as of an instant (default now).")
    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> balance(
            @RequestHeader(PaymentController.TENANT_HEADER) String tenantId,
            @Parameter(description = "Account, e.g. cash:mpesa or revenue:payments") @RequestParam String account,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        Instant at = asOf != null ? asOf : clock.instant();
        return ResponseEntity.ok(BalanceResponse.builder()
                .tenantId(tenantId)
                .account(account)
                .asOf(at)
                .balance(ledgerService.balanceOf(tenantId, account, at))
                .currency(properties.getCurrency())
                .build());
    }

    @Operation(summary = "Entries of an account, oldest first")
    @GetMapping("/entries")
    public ResponseEntity<List<LedgerEntry>> entries(@RequestHeader(PaymentController.TENANT_HEADER) String tenantId,
                                                     @RequestParam String account) {
        return ResponseEntity.ok(ledgerService.entries(tenantId, account));
    }

    @Operation(summary = "Integrity check", description = "Lists every transaction group whose debits and credits differ.")
    @GetMapping("/integrity")
    public ResponseEntity<Map<String, Object>> integrity() {
        List<String> unbalanced = ledgerService.unbalancedGroups();
        return ResponseEntity.ok(Map.of(
                "balanced", unbalanced.isEmpty(),
                "unbalancedGroups", unbalanced));
    }
}
