package com.fintech.settlement.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.settlement.dto.InitiationRequest;
import com.fintech.settlement.dto.NormalizedEvent;
import com.fintech.settlement.dto.ProviderOutcome;
import com.fintech.settlement.dto.ProviderReference;
import com.fintech.settlement.exception.MalformedCallbackException;
import com.fintech.settlement.exception.ProviderRejectedException;
import com.fintech.settlement.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process payment provider for development and tests.
 * <p>
 * Simulates realistic provider behavior including:
 * - collection requests that stay pending until completed
 * - callbacks in a small JSON dialect built by {@link #callbackPayload(String)}
 * - intermittent failures and outages (for testing resilience)
 * - a per-day settlement report
 */
@Component
@ConditionalOnProperty(prefix = "settlement.providers.sandbox", name = "enabled", havingValue = "true")
@Slf4j
public class SandboxProviderAdapter implements PaymentProviderAdapter {

    public static final String PROVIDER_NAME = "sandbox";

    private final Map<String, SandboxTransaction> transactions = new ConcurrentHashMap<>();
    private final Map<String, Long> settledTotals = new ConcurrentHashMap<>();
    private final AtomicInteger initiateCalls = new AtomicInteger();
    private final AtomicInteger reverseCalls = new AtomicInteger();
    private final Random random = new Random();

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${settlement.providers.sandbox.failure-rate:0.0}")
    private double failureRate;

    private volatile boolean simulateOutage = false;
    private volatile String rejectionCode;

    public SandboxProviderAdapter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public CollectionMode collectionMode() {
        return CollectionMode.PUSH_APPROVAL;
    }

    @Override
    @Retryable(
            retryFor = ProviderUnavailableException.class,
            maxAttemptsExpression = "${settlement.http.retry-max-attempts:3}",
            backoff = @Backoff(delayExpression = "${settlement.http.retry-delay-ms:1000}", multiplier = 2)
    )
    public ProviderReference initiate(InitiationRequest request) {
        initiateCalls.incrementAndGet();
        checkAvailable("initiate");

        String code = rejectionCode;
        if (code != null) {
            throw new ProviderRejectedException("Sandbox rejected the collection request", PROVIDER_NAME, code);
        }

        String reference = "SBX-" + UUID.randomUUID();
        transactions.put(reference, new SandboxTransaction(request.getTenantId(), request.getAmount()));
        log.debug("Sandbox accepted collection: reference={}, tenant={}, amount={}",
                reference, request.getTenantId(), request.getAmount());

        return ProviderReference.builder()
                .provider(PROVIDER_NAME)
                .reference(reference)
                .build();
    }

    @Override
    public NormalizedEvent parseCallback(String rawPayload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawPayload == null ? "" : rawPayload);
        } catch (JsonProcessingException e) {
            throw new MalformedCallbackException("Callback body is not valid JSON", PROVIDER_NAME, e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedCallbackException("Callback body must be a JSON object", PROVIDER_NAME);
        }

        String eventId = root.path("eventId").asText(null);
        String reference = root.path("reference").asText(null);
        String status = root.path("status").asText(null);
        if (eventId == null || reference == null || status == null) {
            throw new MalformedCallbackException("Missing eventId, reference or status", PROVIDER_NAME);
        }

        NormalizedEvent.NormalizedEventBuilder event = NormalizedEvent.builder()
                .provider(PROVIDER_NAME)
                .providerEventId(eventId)
                .providerReference(reference);

        switch (status) {
            case "SUCCESS":
                if (!root.path("amount").canConvertToLong()) {
                    throw new MalformedCallbackException("Successful callback without amount", PROVIDER_NAME);
                }
                return event
                        .outcome(ProviderOutcome.SUCCESS)
                        .amount(root.path("amount").asLong())
                        .receiptNumber(root.path("receipt").asText(null))
                        .build();
            case "FAILED":
                return event
                        .outcome(ProviderOutcome.FAILURE)
                        .failureReason(root.path("reason").asText("Declined"))
                        .build();
            default:
                throw new MalformedCallbackException("Unknown callback status " + status, PROVIDER_NAME);
        }
    }

    @Override
    @Retryable(
            retryFor = ProviderUnavailableException.class,
            maxAttemptsExpression = "${settlement.http.retry-max-attempts:3}",
            backoff = @Backoff(delayExpression = "${settlement.http.retry-delay-ms:1000}", multiplier = 2)
    )
    public ProviderOutcome queryStatus(String tenantId, String providerReference) {
        checkAvailable("queryStatus");
        SandboxTransaction transaction = transactions.get(providerReference);
        if (transaction == null) {
            log.warn("Transaction not found in sandbox: {}", providerReference);
            return ProviderOutcome.NOT_FOUND;
        }
        return transaction.outcome;
    }

    @Override
    public ProviderOutcome reverse(String tenantId, String providerTransactionId, long amount) {
        reverseCalls.incrementAndGet();
        checkAvailable("reverse");
        log.debug("Sandbox reversed {} for tenant={}, amount={}", providerTransactionId, tenantId, amount);
        settledTotals.merge(settlementKey(tenantId, today()), -amount, Long::sum);
        return ProviderOutcome.SUCCESS;
    }

    @Override
    public OptionalLong settlementReport(String tenantId, LocalDate settlementDate) {
        checkAvailable("settlementReport");
        Long total = settledTotals.get(settlementKey(tenantId, settlementDate));
        return total == null ? OptionalLong.empty() : OptionalLong.of(total);
    }

    @Override
    public Map<String, Object> acknowledgement() {
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("received", true);
        return ack;
    }

    private void checkAvailable(String operation) {
        if (simulateOutage) {
            throw new ProviderUnavailableException("Sandbox provider is currently unavailable", PROVIDER_NAME);
        }
        if (failureRate > 0 && random.nextDouble() < failureRate) {
            throw new ProviderUnavailableException(
                    "Simulated network failure during " + operation, PROVIDER_NAME);
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static String settlementKey(String tenantId, LocalDate date) {
        return tenantId + "|" + date;
    }

    // Methods for testing/simulation control

    /**
     * Marks a pending collection as finished at the provider. A success is added to today's settlement report.
     */
    public void completeTransaction(String reference, ProviderOutcome outcome) {
        SandboxTransaction transaction = transactions.get(reference);
        if (transaction == null) {
            throw new IllegalArgumentException("Unknown sandbox reference " + reference);
        }
        if (transaction.outcome == ProviderOutcome.PENDING && outcome == ProviderOutcome.SUCCESS) {
            settledTotals.merge(settlementKey(transaction.tenantId, today()), transaction.amount, Long::sum);
        }
        transaction.outcome = outcome;
    }

    /**
     * Callback body the sandbox would post for the current state of a collection.
     */
    public String callbackPayload(String reference) {
        SandboxTransaction transaction = transactions.get(reference);
        if (transaction == null) {
            throw new IllegalArgumentException("Unknown sandbox reference " + reference);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventId", "EVT-" + reference + "-" + transaction.outcome);
        body.put("reference", reference);
        body.put("status", transaction.outcome == ProviderOutcome.SUCCESS ? "SUCCESS" : "FAILED");
        body.put("amount", transaction.amount);
        body.put("receipt", transaction.outcome == ProviderOutcome.SUCCESS ? "RCPT-" + reference : null);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sandbox callback", e);
        }
    }

    /**
     * Overrides the settlement total the sandbox reports for a day.
     */
    public void setSettledTotal(String tenantId, LocalDate date, long total) {
        settledTotals.put(settlementKey(tenantId, date), total);
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Sandbox outage simulation set to: {}", outage);
    }

    /**
     * Makes every following initiate fail with the given provider code; null restores normal behaviour.
     */
    public void setRejectionCode(String rejectionCode) {
        this.rejectionCode = rejectionCode;
    }

    public int getInitiateCalls() {
        return initiateCalls.get();
    }

    public int getReverseCalls() {
        return reverseCalls.get();
    }

    public void clearMockData() {
        transactions.clear();
        settledTotals.clear();
        initiateCalls.set(0);
        reverseCalls.set(0);
        simulateOutage = false;
        rejectionCode = null;
    }

    private static final class SandboxTransaction {
        private final String tenantId;
        private final long amount;
        private volatile ProviderOutcome outcome = ProviderOutcome.PENDING;

        private SandboxTransaction(String tenantId, long amount) {
            this.tenantId = tenantId;
            this.amount = amount;
        }
    }
}
