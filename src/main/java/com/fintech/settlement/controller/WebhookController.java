package com.fintech.settlement.controller;

import com.fintech.settlement.dto.WebhookResult;
import com.fintech.settlement.service.PaymentIntentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Provider callback endpoint. Every delivery is answered with HTTP 200 and the provider's
 * acknowledgement body, including malformed payloads and replays, so providers stop retrying.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Payment provider callbacks")
public class WebhookController {

    private final PaymentIntentService paymentIntentService;

    @Operation(
            summary = "Receive a provider callback",
            description = "Parses, deduplicates and applies a provider callback. Always acknowledged."
    )
    @ApiResponse(responseCode = "200", description = "Callback acknowledged")
    @PostMapping("/{provider}")
    public ResponseEntity<Map<String, Object>> receive(
            @Parameter(description = "Provider name, e.g. mpesa or airtel") @PathVariable String provider,
            @RequestBody(required = false) String payload) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("provider", provider)) {
            WebhookResult result = paymentIntentService.handleCallback(provider, payload);
            log.info("Callback from {} handled: outcome={}, intent={}",
                    provider, result.getOutcome(), result.getIntentId());
            return ResponseEntity.ok(result.getAcknowledgement());
        }
    }
}
