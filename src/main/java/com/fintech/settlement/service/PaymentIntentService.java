package com.fintech.settlement.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.InitiationRequest;
import com.fintech.settlement.dto.NormalizedEvent;
import com.fintech.settlement.dto.PaymentIntentCommand;
import com.fintech.settlement.dto.PaymentOutcomeEvent;
import com.fintech.settlement.dto.ProviderOutcome;
import com.fintech.settlement.dto.ProviderReference;
import com.fintech.settlement.dto.Reservation;
import com.fintech.settlement.dto.SweepResult;
import com.fintech.settlement.dto.WebhookOutcome;
import com.fintech.settlement.dto.WebhookResult;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.entity.PaymentIntentStatus;
import com.fintech.settlement.entity.PaymentPurpose;
import com.fintech.settlement.entity.PaymentStatus;
import com.fintech.settlement.exception.InvalidStateTransitionException;
import com.fintech.settlement.exception.MalformedCallbackException;
import com.fintech.settlement.exception.ProviderRejectedException;
import com.fintech.settlement.exception.ProviderUnavailableException;
import com.fintech.settlement.exception.RequestInProgressException;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.provider.PaymentProviderAdapter;
import com.fintech.settlement.provider.ProviderAdapterRegistry;
import com.fintech.settlement.repository.PaymentIntentRepository;
import com.fintech.settlement.repository.PaymentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.Builder;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a payment intent from creation to a terminal outcome.
 * <p>
 * Every external effect is guarded by an idempotency key:
 * <pre>
 *   intent:&lt;idempotencyKey&gt;        intent creation
 *   initiate:&lt;intentId&gt;            the single provider collection request
 *   webhook:&lt;provider&gt;:&lt;eventId&gt;  one callback delivery
 *   settle:&lt;intentId&gt;              the terminal outcome; first writer wins
 *   refund:&lt;intentId&gt;              the reversal of a settled intent
 * </pre>
 * Callbacks, manual status refreshes and the expiry sweep all settle through the same path, so
 * whichever arrives first decides the outcome and the others become no-ops or logged conflicts.
 * Provider calls are never made inside a database transaction.
 */
@Service
@Slf4j
public class PaymentIntentService {

    private final PaymentIntentRepository intentRepository;
    private final PaymentRepository paymentRepository;
    private final IdempotencyService idempotencyService;
    private final LedgerService ledgerService;
    private final ProviderAdapterRegistry adapterRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final SettlementProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private Counter webhookProcessedCounter;
    private Counter webhookDuplicateCounter;
    private Counter webhookMalformedCounter;
    private Counter webhookUnmatchedCounter;
    private Counter settlementConflictCounter;
    private Counter intentsExpiredCounter;

    public PaymentIntentService(PaymentIntentRepository intentRepository,
                                PaymentRepository paymentRepository,
                                IdempotencyService idempotencyService,
                                LedgerService ledgerService,
                                ProviderAdapterRegistry adapterRegistry,
                                ApplicationEventPublisher eventPublisher,
                                SettlementProperties properties,
                                PlatformTransactionManager transactionManager,
                                ObjectMapper objectMapper,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.intentRepository = intentRepository;
        this.paymentRepository = paymentRepository;
        this.idempotencyService = idempotencyService;
        this.ledgerService = ledgerService;
        this.adapterRegistry = adapterRegistry;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        webhookProcessedCounter = Counter.builder("settlement.webhooks.processed")
                .description("Callbacks that applied a state transition")
                .register(meterRegistry);

        webhookDuplicateCounter = Counter.builder("settlement.webhooks.duplicate")
                .description("Callback replays acknowledged without effect")
                .register(meterRegistry);

        webhookMalformedCounter = Counter.builder("settlement.webhooks.malformed")
                .description("Callbacks that failed validation")
                .register(meterRegistry);

        webhookUnmatchedCounter = Counter.builder("settlement.webhooks.unmatched")
                .description("Callbacks referencing no known payment")
                .register(meterRegistry);

        settlementConflictCounter = Counter.builder("settlement.conflicts")
                .description("Outcomes discarded because a different outcome was already recorded")
                .register(meterRegistry);

        intentsExpiredCounter = Counter.builder("settlement.intents.expired")
                .description("Intents finalized as EXPIRED by the expiry sweep")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------ creation

    /**
     * Creates an intent, or returns the one already created under the same idempotency key.
     *
     * @throws RequestInProgressException if another request with the same key is being processed
     */
    public PaymentIntent createIntent(PaymentIntentCommand command) {
        validate(command);

        Optional<PaymentIntent> existing = intentRepository.findByIdempotencyKey(command.getIdempotencyKey());
        if (existing.isPresent()) {
            log.debug("Returning existing intent {} for key={}", existing.get().getId(), command.getIdempotencyKey());
            return existing.get();
        }

        String key = "intent:" + command.getIdempotencyKey();
        Reservation reservation = idempotencyService.reserve(key, "intent");
        if (reservation.isCompleted()) {
            return findIntent(Long.valueOf(reservation.getResult()));
        }
        if (!reservation.isAcquired()) {
            throw new RequestInProgressException(command.getIdempotencyKey());
        }

        try {
            PaymentIntent created = transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                PaymentIntent intent = intentRepository.save(PaymentIntent.builder()
                        .tenantId(command.getTenantId())
                        .subjectId(command.getSubjectId())
                        .subscriptionId(command.getSubscriptionId())
                        .payerAccount(command.getPayerAccount())
                        .amount(command.getAmount())
                        .currency(command.getCurrency())
                        .idempotencyKey(command.getIdempotencyKey())
                        .purpose(command.getPurpose())
                        .status(PaymentIntentStatus.CREATED)
                        .provider(command.getProvider().toLowerCase())
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                idempotencyService.complete(key, String.valueOf(intent.getId()));
                return intent;
            });
            log.info("Created payment intent {}: tenant={}, purpose={}, amount={} {}, provider={}",
                    created.getId(), created.getTenantId(), created.getPurpose(),
                    created.getAmount(), created.getCurrency(), created.getProvider());
            return created;
        } catch (RuntimeException e) {
            idempotencyService.release(key);
            throw e;
        }
    }

    private void validate(PaymentIntentCommand command) {
        if (command.getAmount() <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + command.getAmount());
        }
        if (!properties.getCurrency().equals(command.getCurrency())) {
            throw new IllegalArgumentException("Unsupported currency " + command.getCurrency()
                    + ", only " + properties.getCurrency() + " is accepted");
        }
        if (command.getIdempotencyKey() == null || command.getIdempotencyKey().isBlank()) {
            throw new IllegalArgumentException("Idempotency key is required");
        }
        if (adapterRegistry.find(command.getProvider()).isEmpty()) {
            throw new IllegalArgumentException("Unknown payment provider " + command.getProvider());
        }
    }

    // ------------------------------------------------------------------ initiation

    /**
     * Sends the collection request to the provider. Safe to call repeatedly: only the first call for an
     * intent reaches the provider. Provider rejection, or unavailability that outlasts the retries, fails
     * the intent.
     */
    public PaymentIntent initiate(String tenantId, Long intentId) {
        PaymentIntent intent = getIntent(tenantId, intentId);
        if (intent.getStatus() != PaymentIntentStatus.CREATED) {
            return intent;
        }

        String key = "initiate:" + intentId;
        Reservation reservation = idempotencyService.reserve(key, "initiate");
        if (!reservation.isAcquired()) {
            log.debug("Initiation of intent {} already handled ({})", intentId, reservation.getKind());
            return findIntent(intentId);
        }

        PaymentProviderAdapter adapter = adapterRegistry.get(intent.getProvider());
        InitiationRequest request = InitiationRequest.builder()
                .tenantId(tenantId)
                .intentId(intentId)
                .amount(intent.getAmount())
                .currency(intent.getCurrency())
                .payerAccount(intent.getPayerAccount())
                .accountReference("PI" + intentId)
                .description(intent.getPurpose() == PaymentPurpose.SUBSCRIPTION_RENEWAL ? "Subscription" : "Payment")
                .callbackUrl(callbackUrl(intent.getProvider()))
                .build();

        ProviderReference reference;
        try {
            reference = adapter.initiate(request);
        } catch (ProviderRejectedException e) {
            log.warn("Provider {} rejected intent {}: code={}, message={}",
                    intent.getProvider(), intentId, e.getProviderCode(), e.getMessage());
            return failInitiation(intentId, key, "Rejected by provider: " + e.getMessage());
        } catch (ProviderUnavailableException e) {
            log.warn("Provider {} unavailable for intent {} after retries: {}",
                    intent.getProvider(), intentId, e.getMessage());
            return failInitiation(intentId, key, "Provider unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            idempotencyService.release(key);
            throw e;
        }

        try {
            PaymentIntent initiated = transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                PaymentIntent current = findIntent(intentId);
                current.transitionTo(PaymentIntentStatus.PROVIDER_INITIATED, now);
                paymentRepository.save(Payment.builder()
                        .intentId(intentId)
                        .tenantId(tenantId)
                        .provider(current.getProvider())
                        .providerReference(reference.getReference())
                        .status(PaymentStatus.PENDING)
                        .amount(current.getAmount())
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                idempotencyService.complete(key, reference.getReference());
                return intentRepository.save(current);
            });
            log.info("Intent {} initiated with provider={}, reference={}",
                    intentId, reference.getProvider(), reference.getReference());
            return initiated;
        } catch (RuntimeException e) {
            log.error("Provider accepted intent {} (reference={}) but recording it failed",
                    intentId, reference.getReference(), e);
            throw e;
        }
    }

    private PaymentIntent failInitiation(Long intentId, String initiateKey, String reason) {
        PaymentIntent failed = transactionTemplate.execute(status -> {
            PaymentIntent current = findIntent(intentId);
            current.transitionTo(PaymentIntentStatus.FAILED, clock.instant());
            current.setFailureReason(truncate(reason));
            idempotencyService.complete(initiateKey, PaymentIntentStatus.FAILED.name());
            return intentRepository.save(current);
        });
        publishOutcome(failed);
        return failed;
    }

    private String callbackUrl(String provider) {
        String base = properties.getCallbackBaseUrl();
        return (base.endsWith("/") ? base : base + "/") + provider;
    }

    // ------------------------------------------------------------------ callbacks

    /**
     * Handles one raw provider callback. Never throws for bad input: the result always asks for an
     * acknowledgement so the provider stops redelivering.
     */
    public WebhookResult handleCallback(String providerName, String rawPayload) {
        Optional<PaymentProviderAdapter> maybeAdapter = adapterRegistry.find(providerName);
        if (maybeAdapter.isEmpty()) {
            log.warn("Callback for unknown provider {}", providerName);
            webhookMalformedCounter.increment();
            return result(WebhookOutcome.MALFORMED, Map.of("status", "ignored"), null, null);
        }
        PaymentProviderAdapter adapter = maybeAdapter.get();

        NormalizedEvent event;
        try {
            event = adapter.parseCallback(rawPayload);
        } catch (MalformedCallbackException e) {
            log.warn("Malformed {} callback: {}", providerName, e.getMessage());
            webhookMalformedCounter.increment();
            return result(WebhookOutcome.MALFORMED, adapter.acknowledgement(), null, null);
        }

        try (MDC.MDCCloseable ignored = MDC.putCloseable("providerEventId", event.getProviderEventId())) {
            return handleEvent(adapter, event);
        }
    }

    private WebhookResult handleEvent(PaymentProviderAdapter adapter, NormalizedEvent event) {
        String provider = adapter.getProviderName();
        Map<String, Object> ack = adapter.acknowledgement();
        String webhookKey = "webhook:" + provider + ":" + event.getProviderEventId();

        Reservation reservation = idempotencyService.reserve(webhookKey, "webhook");
        if (!reservation.isAcquired()) {
            log.info("Duplicate {} callback event={} ({})", provider, event.getProviderEventId(), reservation.getKind());
            webhookDuplicateCounter.increment();
            return result(WebhookOutcome.DUPLICATE, ack, null, reservation.getResult());
        }

        Optional<Payment> payment;
        try {
            payment = paymentRepository.findByProviderAndProviderReference(provider, event.getProviderReference());
        } catch (RuntimeException e) {
            idempotencyService.release(webhookKey);
            throw e;
        }
        if (payment.isEmpty()) {
            // released so a redelivery can match once the initiating request has recorded the payment
            idempotencyService.release(webhookKey);
            log.warn("Unmatched {} callback: reference={}, event={}",
                    provider, event.getProviderReference(), event.getProviderEventId());
            webhookUnmatchedCounter.increment();
            return result(WebhookOutcome.UNMATCHED, ack, null, null);
        }

        Long intentId = payment.get().getIntentId();
        SettlementResult settlement = settle(intentId, event.getOutcome(), event, webhookKey);
        switch (settlement.getDisposition()) {
            case APPLIED:
                webhookProcessedCounter.increment();
                return result(WebhookOutcome.PROCESSED, ack, intentId, settlement.getRecordedResult());
            case CONFLICT:
                return result(WebhookOutcome.CONFLICT, ack, intentId, settlement.getRecordedResult());
            default:
                webhookDuplicateCounter.increment();
                return result(WebhookOutcome.DUPLICATE, ack, intentId, settlement.getRecordedResult());
        }
    }

    private static WebhookResult result(WebhookOutcome outcome, Map<String, Object> ack, Long intentId, String recorded) {
        return WebhookResult.builder()
                .outcome(outcome)
                .ackRequired(true)
                .acknowledgement(ack)
                .intentId(intentId)
                .result(recorded)
                .build();
    }

    // ------------------------------------------------------------------ settlement

    enum Disposition {
        APPLIED,
        ALREADY_SETTLED,
        CONFLICT
    }

    @Value
    static class SettlementResult {
        Disposition disposition;
        String recordedResult;
    }

    /**
     * Applies a final provider outcome to an intent. The first outcome recorded under
     * {@code settle:<intentId>} wins; a later, different outcome is logged as a conflict and discarded.
     *
     * @param callerKey an additional reserved key completed in the same transaction (the webhook key), or null
     */
    SettlementResult settle(Long intentId, ProviderOutcome outcome, NormalizedEvent event, String callerKey) {
        if (!outcome.isFinal()) {
            throw new IllegalArgumentException("Cannot settle intent " + intentId + " with outcome " + outcome);
        }
        String wanted = (outcome == ProviderOutcome.SUCCESS ? PaymentIntentStatus.SUCCEEDED : PaymentIntentStatus.FAILED).name();
        String settleKey = "settle:" + intentId;

        Reservation reservation = idempotencyService.reserve(settleKey, "settle");
        if (!reservation.isAcquired()) {
            return alreadySettled(intentId, wanted, reservation, callerKey);
        }

        PaymentIntent settled;
        try {
            settled = transactionTemplate.execute(status -> applyOutcome(intentId, outcome, event, settleKey, callerKey));
        } catch (RuntimeException e) {
            idempotencyService.release(settleKey);
            if (callerKey != null) {
                idempotencyService.release(callerKey);
            }
            throw e;
        }

        if (!settled.getStatus().name().equals(wanted)) {
            settlementConflictCounter.increment();
            log.warn("Settlement conflict on intent {}: status {} already final, {} discarded",
                    intentId, settled.getStatus(), wanted);
            return new SettlementResult(Disposition.CONFLICT, settled.getStatus().name());
        }
        publishOutcome(settled);
        return new SettlementResult(Disposition.APPLIED, settled.getStatus().name());
    }

    private SettlementResult alreadySettled(Long intentId, String wanted, Reservation reservation, String callerKey) {
        String recorded = reservation.getResult();
        boolean conflict = recorded != null && !recorded.equals(wanted);
        if (conflict) {
            settlementConflictCounter.increment();
            log.warn("Settlement conflict on intent {}: recorded {}, discarded {}", intentId, recorded, wanted);
        } else {
            log.debug("Intent {} already settled ({}), outcome {} ignored", intentId, reservation.getKind(), wanted);
        }

        if (callerKey != null) {
            if (reservation.isCompleted()) {
                transactionTemplate.executeWithoutResult(status ->
                        idempotencyService.complete(callerKey, conflict ? "CONFLICT" : recorded));
            } else {
                // the settling worker is still running; let a redelivery look again
                idempotencyService.release(callerKey);
            }
        }
        return new SettlementResult(conflict ? Disposition.CONFLICT : Disposition.ALREADY_SETTLED, recorded);
    }

    private PaymentIntent applyOutcome(Long intentId, ProviderOutcome outcome, NormalizedEvent event,
                                       String settleKey, String callerKey) {
        Instant now = clock.instant();
        PaymentIntent intent = findIntent(intentId);

        if (intent.getStatus() != PaymentIntentStatus.PROVIDER_INITIATED) {
            // finalized outside the settle key, e.g. cancelled before initiation
            idempotencyService.complete(settleKey, intent.getStatus().name());
            if (callerKey != null) {
                idempotencyService.complete(callerKey, "CONFLICT");
            }
            return intent;
        }

        Payment payment = pendingPayment(intentId);
        if (event != null) {
            payment.setProviderEventId(event.getProviderEventId());
            payment.setNormalizedPayload(toJson(event));
        }
        payment.setUpdatedAt(now);

        if (outcome == ProviderOutcome.SUCCESS) {
            long confirmedAmount = event != null && event.getAmount() != null ? event.getAmount() : payment.getAmount();
            if (confirmedAmount != intent.getAmount()) {
                log.warn("Intent {} confirmed for {} but requested {}; booking the confirmed amount",
                        intentId, confirmedAmount, intent.getAmount());
            }
            if (paymentRepository.countByIntentIdAndStatus(intentId, PaymentStatus.CONFIRMED) > 0) {
                throw new IllegalStateException("Intent " + intentId + " already has a confirmed payment");
            }
            payment.setStatus(PaymentStatus.CONFIRMED);
            payment.setAmount(confirmedAmount);
            if (event != null) {
                payment.setReceiptNumber(event.getReceiptNumber());
            }
            paymentRepository.save(payment);
            intent.transitionTo(PaymentIntentStatus.SUCCEEDED, now);
            ledgerService.postSettlement(payment, intent, confirmedAmount);
        } else {
            payment.setStatus(PaymentStatus.FAILED);
            paymentRepository.save(payment);
            intent.transitionTo(PaymentIntentStatus.FAILED, now);
            intent.setFailureReason(truncate(event != null && event.getFailureReason() != null
                    ? event.getFailureReason() : "Declined at provider"));
        }

        PaymentIntent saved = intentRepository.save(intent);
        idempotencyService.complete(settleKey, saved.getStatus().name());
        if (callerKey != null) {
            idempotencyService.complete(callerKey, saved.getStatus().name());
        }
        log.info("Intent {} settled as {} (payment={}, provider={})",
                intentId, saved.getStatus(), payment.getId(), payment.getProvider());
        return saved;
    }

    private Payment pendingPayment(Long intentId) {
        return paymentRepository.findByIntentIdOrderByCreatedAtAsc(intentId).stream()
                .filter(p -> p.getStatus() == PaymentStatus.PENDING)
                .max(Comparator.comparing(Payment::getCreatedAt))
                .orElseThrow(() -> new IllegalStateException("Intent " + intentId + " has no pending payment"));
    }

    // ------------------------------------------------------------------ status refresh and expiry

    /**
     * Queries the provider for an intent whose callback is overdue and settles it when the answer is final.
     */
    public PaymentIntent refreshStatus(String tenantId, Long intentId) {
        PaymentIntent intent = getIntent(tenantId, intentId);
        if (intent.getStatus() != PaymentIntentStatus.PROVIDER_INITIATED) {
            return intent;
        }

        Payment payment = pendingPayment(intentId);
        ProviderOutcome outcome = adapterRegistry.get(intent.getProvider())
                .queryStatus(tenantId, payment.getProviderReference());
        log.info("Status query for intent {} returned {}", intentId, outcome);

        if (outcome.isFinal()) {
            settle(intentId, outcome, null, null);
        }
        return findIntent(intentId);
    }

    /**
     * Finalizes intents that can no longer expect a callback. Each PROVIDER_INITIATED intent older
     * than the callback timeout gets exactly one status query; a final answer settles it, anything
     * else expires it. CREATED intents older than the intent TTL expire without a provider call.
     */
    public SweepResult expireOverdue(Instant now) {
        SweepResult result = SweepResult.builder()
                .sweep("expiry")
                .startedAt(clock.instant())
                .build();

        List<PaymentIntent> awaitingCallback = intentRepository.findStale(
                PaymentIntentStatus.PROVIDER_INITIATED, now.minus(properties.getCallbackTimeout()));
        for (PaymentIntent intent : awaitingCallback) {
            result.incrementExamined();
            try {
                if (resolveOverdue(intent)) {
                    result.incrementActed();
                } else {
                    result.incrementSkipped();
                }
            } catch (RuntimeException e) {
                log.error("Expiry sweep failed for intent {}: {}", intent.getId(), e.getMessage(), e);
                result.addError(intent.getId(), e.getMessage());
            }
        }

        List<PaymentIntent> neverInitiated = intentRepository.findStale(
                PaymentIntentStatus.CREATED, now.minus(properties.getIntentTtl()));
        for (PaymentIntent intent : neverInitiated) {
            result.incrementExamined();
            try {
                if (expireNeverInitiated(intent.getId())) {
                    result.incrementActed();
                } else {
                    result.incrementSkipped();
                }
            } catch (RuntimeException e) {
                log.error("Expiry sweep failed for intent {}: {}", intent.getId(), e.getMessage(), e);
                result.addError(intent.getId(), e.getMessage());
            }
        }

        result.setCompletedAt(clock.instant());
        log.info("Expiry sweep completed. Examined: {}, Finalized: {}, Skipped: {}, Errors: {}",
                result.getExamined(), result.getActed(), result.getSkipped(), result.getErrors());
        return result;
    }

    private boolean resolveOverdue(PaymentIntent intent) {
        ProviderOutcome outcome;
        try {
            Payment payment = pendingPayment(intent.getId());
            outcome = adapterRegistry.get(intent.getProvider())
                    .queryStatus(intent.getTenantId(), payment.getProviderReference());
        } catch (ProviderUnavailableException | ProviderRejectedException e) {
            log.warn("Status query for overdue intent {} failed: {}", intent.getId(), e.getMessage());
            outcome = ProviderOutcome.PENDING;
        }

        if (outcome.isFinal()) {
            return settle(intent.getId(), outcome, null, null).getDisposition() == Disposition.APPLIED;
        }
        return expire(intent.getId(), "No callback within " + properties.getCallbackTimeout()
                + " (provider status " + outcome + ")", null);
    }

    // the initiation key keeps a concurrent initiate() from reaching the provider for an intent being expired
    private boolean expireNeverInitiated(Long intentId) {
        String initiateKey = "initiate:" + intentId;
        Reservation initiation = idempotencyService.reserve(initiateKey, "initiate");
        if (!initiation.isAcquired()) {
            log.debug("Intent {} is being initiated, not expiring it ({})", intentId, initiation.getKind());
            return false;
        }
        return expire(intentId, "Not initiated within " + properties.getIntentTtl(), initiateKey);
    }

    /**
     * @param initiateKey initiation key already held by the caller, completed with the outcome; may be null
     */
    private boolean expire(Long intentId, String reason, String initiateKey) {
        String settleKey = "settle:" + intentId;
        Reservation reservation = idempotencyService.reserve(settleKey, "settle");
        if (!reservation.isAcquired()) {
            releaseIfHeld(initiateKey);
            return false;
        }

        PaymentIntent expired;
        try {
            expired = transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                PaymentIntent intent = findIntent(intentId);
                if (!intent.getStatus().canTransitionTo(PaymentIntentStatus.EXPIRED)) {
                    idempotencyService.complete(settleKey, intent.getStatus().name());
                    completeIfHeld(initiateKey, intent.getStatus().name());
                    return null;
                }
                paymentRepository.findByIntentIdOrderByCreatedAtAsc(intentId).stream()
                        .filter(p -> p.getStatus() == PaymentStatus.PENDING)
                        .forEach(p -> {
                            p.setStatus(PaymentStatus.FAILED);
                            p.setUpdatedAt(now);
                            paymentRepository.save(p);
                        });
                intent.transitionTo(PaymentIntentStatus.EXPIRED, now);
                intent.setFailureReason(truncate(reason));
                PaymentIntent saved = intentRepository.save(intent);
                idempotencyService.complete(settleKey, PaymentIntentStatus.EXPIRED.name());
                completeIfHeld(initiateKey, PaymentIntentStatus.EXPIRED.name());
                return saved;
            });
        } catch (RuntimeException e) {
            idempotencyService.release(settleKey);
            releaseIfHeld(initiateKey);
            throw e;
        }

        if (expired == null) {
            return false;
        }
        intentsExpiredCounter.increment();
        log.info("Intent {} expired: {}", intentId, reason);
        publishOutcome(expired);
        return true;
    }

    private void completeIfHeld(String key, String result) {
        if (key != null) {
            idempotencyService.complete(key, result);
        }
    }

    private void releaseIfHeld(String key) {
        if (key != null) {
            idempotencyService.release(key);
        }
    }

    // ------------------------------------------------------------------ cancel and refund

    /**
     * Cancels an intent that has not been sent to the provider.
     */
    public PaymentIntent cancel(String tenantId, Long intentId) {
        PaymentIntent intent = getIntent(tenantId, intentId);
        if (intent.getStatus() == PaymentIntentStatus.CANCELLED) {
            return intent;
        }
        if (intent.getStatus() != PaymentIntentStatus.CREATED) {
            throw new InvalidStateTransitionException("Intent " + intentId + " is " + intent.getStatus()
                    + " and can no longer be cancelled");
        }

        // taking the initiation key guarantees no provider request is, or will be, in flight
        String key = "initiate:" + intentId;
        Reservation reservation = idempotencyService.reserve(key, "initiate");
        if (!reservation.isAcquired()) {
            throw new InvalidStateTransitionException("Intent " + intentId + " is being initiated");
        }

        PaymentIntent cancelled;
        try {
            cancelled = transactionTemplate.execute(status -> {
                PaymentIntent current = findIntent(intentId);
                current.transitionTo(PaymentIntentStatus.CANCELLED, clock.instant());
                idempotencyService.complete(key, PaymentIntentStatus.CANCELLED.name());
                return intentRepository.save(current);
            });
        } catch (RuntimeException e) {
            idempotencyService.release(key);
            throw e;
        }
        log.info("Intent {} cancelled", intentId);
        publishOutcome(cancelled);
        return cancelled;
    }

    /**
     * Refunds a settled intent through the provider and books the offsetting ledger entries.
     *
     * @return the REVERSAL intent recording the refund
     */
    public PaymentIntent refund(String tenantId, Long intentId, String reason) {
        PaymentIntent original = getIntent(tenantId, intentId);
        if (original.getStatus() == PaymentIntentStatus.REVERSED) {
            return reversalOf(intentId);
        }
        if (original.getStatus() != PaymentIntentStatus.SUCCEEDED) {
            throw new InvalidStateTransitionException("Only SUCCEEDED intents can be refunded, intent "
                    + intentId + " is " + original.getStatus());
        }

        String key = "refund:" + intentId;
        Reservation reservation = idempotencyService.reserve(key, "refund");
        if (reservation.isCompleted()) {
            return findIntent(Long.valueOf(reservation.getResult()));
        }
        if (!reservation.isAcquired()) {
            throw new RequestInProgressException(key);
        }

        try {
            Payment payment = paymentRepository.findByIntentIdOrderByCreatedAtAsc(intentId).stream()
                    .filter(p -> p.getStatus() == PaymentStatus.CONFIRMED)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Intent " + intentId + " has no confirmed payment"));
            String providerTransactionId = payment.getReceiptNumber() != null
                    ? payment.getReceiptNumber() : payment.getProviderReference();

            ProviderOutcome outcome = adapterRegistry.get(original.getProvider())
                    .reverse(tenantId, providerTransactionId, payment.getAmount());
            if (!(outcome == ProviderOutcome.SUCCESS || outcome == ProviderOutcome.PENDING)) {
                throw new ProviderRejectedException("Provider refused the reversal with " + outcome,
                        original.getProvider(), outcome.name());
            }

            PaymentIntent reversal = transactionTemplate.execute(status ->
                    recordRefund(original.getId(), payment.getId(), reason, key));
            log.info("Intent {} refunded via reversal intent {} (provider outcome {})",
                    intentId, reversal.getId(), outcome);
            publishOutcome(findIntent(intentId));
            return reversal;
        } catch (RuntimeException e) {
            idempotencyService.release(key);
            throw e;
        }
    }

    private PaymentIntent recordRefund(Long originalId, Long paymentId, String reason, String refundKey) {
        Instant now = clock.instant();
        PaymentIntent original = findIntent(originalId);
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));

        PaymentIntent reversal = intentRepository.save(PaymentIntent.builder()
                .tenantId(original.getTenantId())
                .subjectId(original.getSubjectId())
                .subscriptionId(original.getSubscriptionId())
                .payerAccount(original.getPayerAccount())
                .amount(payment.getAmount())
                .currency(original.getCurrency())
                .idempotencyKey(refundKey)
                .purpose(PaymentPurpose.REVERSAL)
                .reversalOf(originalId)
                .status(PaymentIntentStatus.SUCCEEDED)
                .provider(original.getProvider())
                .failureReason(truncate(reason))
                .createdAt(now)
                .updatedAt(now)
                .build());

        paymentRepository.save(Payment.builder()
                .intentId(reversal.getId())
                .tenantId(original.getTenantId())
                .provider(original.getProvider())
                .status(PaymentStatus.REVERSED)
                .amount(payment.getAmount())
                .receiptNumber(payment.getReceiptNumber())
                .createdAt(now)
                .updatedAt(now)
                .build());

        payment.setStatus(PaymentStatus.REVERSED);
        payment.setUpdatedAt(now);
        paymentRepository.save(payment);

        ledgerService.postReversal(LedgerService.settlementGroup(paymentId),
                LedgerService.reversalGroup(paymentId), "refund:" + originalId);

        original.transitionTo(PaymentIntentStatus.REVERSED, now);
        intentRepository.save(original);
        idempotencyService.complete(refundKey, String.valueOf(reversal.getId()));
        return reversal;
    }

    private PaymentIntent reversalOf(Long intentId) {
        return intentRepository.findByReversalOf(intentId).stream()
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Reversal of intent", intentId));
    }

    // ------------------------------------------------------------------ queries

    public PaymentIntent getIntent(String tenantId, Long intentId) {
        return intentRepository.findByIdAndTenantId(intentId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment intent", intentId));
    }

    public List<Payment> getPayments(String tenantId, Long intentId) {
        getIntent(tenantId, intentId);
        return paymentRepository.findByIntentIdOrderByCreatedAtAsc(intentId);
    }

    public IntentStats getStats() {
        return IntentStats.builder()
                .createdCount(intentRepository.countByStatus(PaymentIntentStatus.CREATED))
                .awaitingCallbackCount(intentRepository.countByStatus(PaymentIntentStatus.PROVIDER_INITIATED))
                .succeededCount(intentRepository.countByStatus(PaymentIntentStatus.SUCCEEDED))
                .failedCount(intentRepository.countByStatus(PaymentIntentStatus.FAILED))
                .expiredCount(intentRepository.countByStatus(PaymentIntentStatus.EXPIRED))
                .build();
    }

    private PaymentIntent findIntent(Long intentId) {
        return intentRepository.findById(intentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment intent", intentId));
    }

    private void publishOutcome(PaymentIntent intent) {
        eventPublisher.publishEvent(PaymentOutcomeEvent.builder()
                .intentId(intent.getId())
                .tenantId(intent.getTenantId())
                .subjectId(intent.getSubjectId())
                .subscriptionId(intent.getSubscriptionId())
                .purpose(intent.getPurpose())
                .status(intent.getStatus())
                .amount(intent.getAmount())
                .failureReason(intent.getFailureReason())
                .occurredAt(intent.getUpdatedAt())
                .build());
    }

    private String toJson(NormalizedEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize normalized event " + event.getProviderEventId(), e);
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 500) {
            return reason;
        }
        return reason.substring(0, 500);
    }

    @Data
    @Builder
    public static class IntentStats {
        private long createdCount;
        private long awaitingCallbackCount;
        private long succeededCount;
        private long failedCount;
        private long expiredCount;
    }
}
