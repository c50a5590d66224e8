package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.CreateSubscriptionRequest;
import com.fintech.settlement.dto.DunningScheduleView;
import com.fintech.settlement.dto.NotificationKind;
import com.fintech.settlement.dto.PaymentIntentCommand;
import com.fintech.settlement.dto.PaymentOutcomeEvent;
import com.fintech.settlement.dto.Reservation;
import com.fintech.settlement.dto.SubscriptionNotification;
import com.fintech.settlement.dto.SweepResult;
import com.fintech.settlement.entity.DunningSchedule;
import com.fintech.settlement.entity.DunningStatus;
import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.entity.PaymentIntentStatus;
import com.fintech.settlement.entity.PaymentPurpose;
import com.fintech.settlement.entity.RenewalAttempt;
import com.fintech.settlement.entity.RenewalAttemptStatus;
import com.fintech.settlement.entity.Subscription;
import com.fintech.settlement.entity.SubscriptionStatus;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.notification.NotificationPublisher;
import com.fintech.settlement.provider.ProviderAdapterRegistry;
import com.fintech.settlement.repository.DunningScheduleRepository;
import com.fintech.settlement.repository.PaymentIntentRepository;
import com.fintech.settlement.repository.RenewalAttemptRepository;
import com.fintech.settlement.repository.SubscriptionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Subscription renewals and dunning.
 * <p>
 * A failed renewal at time T moves the subscription to PAST_DUE and opens a dunning schedule
 * with one retry per configured offset (T+0, T+1, T+3 days by default) and a grace deadline
 * (T+7). The first successful retry recovers the subscription; reaching the deadline without
 * one makes it UNPAID and then CANCELLED, or ACTIVE on its free downgrade plan.
 * <p>
 * Both sweeps are driven by {@code now} and persisted state only. Every charge goes through a
 * deterministic idempotency key, so reruns and concurrent sweeps never charge twice.
 */
@Service
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final DunningScheduleRepository scheduleRepository;
    private final RenewalAttemptRepository attemptRepository;
    private final PaymentIntentRepository intentRepository;
    private final PaymentIntentService paymentIntentService;
    private final IdempotencyService idempotencyService;
    private final ProviderAdapterRegistry adapterRegistry;
    private final NotificationPublisher notificationPublisher;
    private final SettlementProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private Counter renewalsInitiatedCounter;
    private Counter dunningAttemptsCounter;
    private Counter recoveredCounter;
    private Counter graceExpiredCounter;
    private Counter outcomeFailuresCounter;

    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               DunningScheduleRepository scheduleRepository,
                               RenewalAttemptRepository attemptRepository,
                               PaymentIntentRepository intentRepository,
                               PaymentIntentService paymentIntentService,
                               IdempotencyService idempotencyService,
                               ProviderAdapterRegistry adapterRegistry,
                               NotificationPublisher notificationPublisher,
                               SettlementProperties properties,
                               PlatformTransactionManager transactionManager,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.subscriptionRepository = subscriptionRepository;
        this.scheduleRepository = scheduleRepository;
        this.attemptRepository = attemptRepository;
        this.intentRepository = intentRepository;
        this.paymentIntentService = paymentIntentService;
        this.idempotencyService = idempotencyService;
        this.adapterRegistry = adapterRegistry;
        this.notificationPublisher = notificationPublisher;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        renewalsInitiatedCounter = Counter.builder("subscription.renewals.initiated")
                .description("Renewal charges sent to a provider")
                .register(meterRegistry);

        dunningAttemptsCounter = Counter.builder("subscription.dunning.attempts")
                .description("Dunning retries sent to a provider")
                .register(meterRegistry);

        recoveredCounter = Counter.builder("subscription.dunning.recovered")
                .description("PAST_DUE subscriptions recovered by a retry")
                .register(meterRegistry);

        graceExpiredCounter = Counter.builder("subscription.dunning.expired")
                .description("Dunning schedules that reached the grace deadline")
                .register(meterRegistry);

        outcomeFailuresCounter = Counter.builder("subscription.outcome.failures")
                .description("Payment outcomes that could not be applied immediately")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------ lifecycle

    public Subscription createSubscription(String tenantId, CreateSubscriptionRequest request) {
        if (request.getAmount() <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + request.getAmount());
        }
        if (!properties.getCurrency().equals(request.getCurrency())) {
            throw new IllegalArgumentException("Unsupported currency " + request.getCurrency());
        }
        if (adapterRegistry.find(request.getProvider()).isEmpty()) {
            throw new IllegalArgumentException("Unknown payment provider " + request.getProvider());
        }

        Instant now = clock.instant();
        Instant periodStart = request.getStartAt() != null ? request.getStartAt() : now;
        Instant periodEnd = request.getInterval().periodEnd(periodStart, 1);

        Subscription subscription = subscriptionRepository.save(Subscription.builder()
                .tenantId(tenantId)
                .subjectId(request.getSubjectId())
                .payerAccount(request.getPayerAccount())
                .provider(request.getProvider().toLowerCase())
                .planCode(request.getPlanCode())
                .interval(request.getInterval())
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .status(SubscriptionStatus.ACTIVE)
                .billingAnchor(periodStart)
                .currentPeriodStart(periodStart)
                .currentPeriodEnd(periodEnd)
                .nextRenewalAt(periodEnd)
                .downgradePlanCode(request.getDowngradePlanCode())
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("Created subscription {}: tenant={}, subject={}, plan={}, renews at {}",
                subscription.getId(), tenantId, subscription.getSubjectId(),
                subscription.getPlanCode(), subscription.getNextRenewalAt());
        return subscription;
    }

    public Subscription getSubscription(String tenantId, Long subscriptionId) {
        return subscriptionRepository.findByIdAndTenantId(subscriptionId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription", subscriptionId));
    }

    /**
     * Operator cancellation. Closes any open dunning schedule; an already cancelled subscription is returned as is.
     */
    public Subscription cancel(String tenantId, Long subscriptionId) {
        Subscription subscription = getSubscription(tenantId, subscriptionId);
        if (subscription.getStatus() == SubscriptionStatus.CANCELLED) {
            return subscription;
        }

        Subscription cancelled = transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            Subscription current = findSubscription(subscriptionId);
            current.transitionTo(SubscriptionStatus.CANCELLED, now);
            current.setCancelledAt(now);
            scheduleRepository.findFirstBySubscriptionIdAndStatus(subscriptionId, DunningStatus.OPEN)
                    .ifPresent(schedule -> closeSchedule(schedule, DunningStatus.CLOSED, now));
            return subscriptionRepository.save(current);
        });

        log.info("Subscription {} cancelled by operator", subscriptionId);
        notify(cancelled, NotificationKind.SUBSCRIPTION_CANCELLED, null);
        return cancelled;
    }

    public List<DunningScheduleView> getDunningSchedules(String tenantId, Long subscriptionId) {
        getSubscription(tenantId, subscriptionId);
        List<DunningScheduleView> views = new ArrayList<>();
        for (DunningSchedule schedule : scheduleRepository.findBySubscriptionIdOrderByCreatedAtDesc(subscriptionId)) {
            views.add(new DunningScheduleView(schedule,
                    attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(schedule.getId())));
        }
        return views;
    }

    // ------------------------------------------------------------------ renewals

    /**
     * Charges every ACTIVE, billable subscription whose renewal date has passed and that has no
     * renewal in flight. Also applies renewal outcomes that were missed when they happened.
     */
    public SweepResult processDueRenewals(Instant now) {
        SweepResult result = SweepResult.builder()
                .sweep("renewals")
                .startedAt(clock.instant())
                .build();

        for (Subscription awaiting : subscriptionRepository.findByStatusAndPendingRenewalIntentIdIsNotNull(SubscriptionStatus.ACTIVE)) {
            intentRepository.findById(awaiting.getPendingRenewalIntentId())
                    .filter(intent -> intent.getStatus().isTerminal())
                    .ifPresent(intent -> {
                        log.info("Applying missed outcome {} of renewal intent {}", intent.getStatus(), intent.getId());
                        applyOutcomeSafely(toEvent(intent));
                    });
        }

        for (Subscription subscription : subscriptionRepository.findDueForRenewal(SubscriptionStatus.ACTIVE, now)) {
            result.incrementExamined();
            try {
                if (renew(subscription)) {
                    result.incrementActed();
                } else {
                    result.incrementSkipped();
                }
            } catch (RuntimeException e) {
                log.error("Renewal failed for subscription {}: {}", subscription.getId(), e.getMessage(), e);
                result.addError(subscription.getId(), e.getMessage());
            }
        }

        result.setCompletedAt(clock.instant());
        log.info("Renewal sweep completed. Examined: {}, Initiated: {}, Skipped: {}, Errors: {}",
                result.getExamined(), result.getActed(), result.getSkipped(), result.getErrors());
        return result;
    }

    private boolean renew(Subscription subscription) {
        String key = "renewal:" + subscription.getId() + ":" + subscription.getCurrentPeriodEnd().toEpochMilli();

        PaymentIntent intent = paymentIntentService.createIntent(chargeFor(subscription, key));
        Boolean claimed = transactionTemplate.execute(status -> {
            Subscription current = findSubscription(subscription.getId());
            if (current.getStatus() != SubscriptionStatus.ACTIVE || current.getPendingRenewalIntentId() != null) {
                return false;
            }
            current.setPendingRenewalIntentId(intent.getId());
            current.setUpdatedAt(clock.instant());
            subscriptionRepository.save(current);
            return true;
        });
        if (!Boolean.TRUE.equals(claimed)) {
            log.debug("Subscription {} renewal already in flight", subscription.getId());
            return false;
        }

        renewalsInitiatedCounter.increment();
        log.info("Renewing subscription {} with intent {} (key={})", subscription.getId(), intent.getId(), key);
        paymentIntentService.initiate(subscription.getTenantId(), intent.getId());
        return true;
    }

    private PaymentIntentCommand chargeFor(Subscription subscription, String idempotencyKey) {
        return PaymentIntentCommand.builder()
                .tenantId(subscription.getTenantId())
                .subjectId(subscription.getSubjectId())
                .subscriptionId(subscription.getId())
                .payerAccount(subscription.getPayerAccount())
                .amount(subscription.getAmount())
                .currency(subscription.getCurrency())
                .provider(subscription.getProvider())
                .idempotencyKey(idempotencyKey)
                .purpose(PaymentPurpose.SUBSCRIPTION_RENEWAL)
                .build();
    }

    // ------------------------------------------------------------------ payment outcomes

    /**
     * Applies the outcome of a renewal or dunning charge. Failures are logged and counted; the
     * next sweep applies the outcome from persisted state.
     */
    @EventListener
    public void onPaymentOutcome(PaymentOutcomeEvent event) {
        if (event.getPurpose() != PaymentPurpose.SUBSCRIPTION_RENEWAL || event.getSubscriptionId() == null) {
            return;
        }
        applyOutcomeSafely(event);
    }

    private void applyOutcomeSafely(PaymentOutcomeEvent event) {
        try {
            applyOutcome(event);
        } catch (RuntimeException e) {
            outcomeFailuresCounter.increment();
            log.error("Could not apply outcome {} of intent {} to subscription {}: {}",
                    event.getStatus(), event.getIntentId(), event.getSubscriptionId(), e.getMessage(), e);
        }
    }

    void applyOutcome(PaymentOutcomeEvent event) {
        boolean succeeded = event.getStatus() == PaymentIntentStatus.SUCCEEDED;
        boolean failed = event.getStatus() == PaymentIntentStatus.FAILED
                || event.getStatus() == PaymentIntentStatus.EXPIRED
                || event.getStatus() == PaymentIntentStatus.CANCELLED;
        if (!succeeded && !failed) {
            return;
        }

        Optional<RenewalAttempt> attempt = attemptRepository.findByIntentId(event.getIntentId());
        if (attempt.isPresent()) {
            applyAttemptOutcome(attempt.get().getId(), event, succeeded);
        } else {
            applyRenewalOutcome(event, succeeded);
        }
    }

    private void applyRenewalOutcome(PaymentOutcomeEvent event, boolean succeeded) {
        Subscription updated = transactionTemplate.execute(status -> {
            Subscription subscription = findSubscription(event.getSubscriptionId());
            if (subscription.getStatus() != SubscriptionStatus.ACTIVE
                    || !event.getIntentId().equals(subscription.getPendingRenewalIntentId())) {
                log.debug("Renewal outcome of intent {} no longer applies to subscription {}",
                        event.getIntentId(), subscription.getId());
                return null;
            }

            Instant now = clock.instant();
            if (succeeded) {
                subscription.advancePeriod(now);
                return subscriptionRepository.save(subscription);
            }

            Instant failedAt = event.getOccurredAt() != null ? event.getOccurredAt() : now;
            subscription.transitionTo(SubscriptionStatus.PAST_DUE, now);
            subscription.setPendingRenewalIntentId(null);
            openSchedule(subscription, failedAt, now);
            return subscriptionRepository.save(subscription);
        });
        if (updated == null) {
            return;
        }

        if (succeeded) {
            log.info("Subscription {} renewed, next renewal at {}", updated.getId(), updated.getNextRenewalAt());
            notify(updated, NotificationKind.RENEWAL_SUCCEEDED, null);
        } else {
            log.info("Renewal of subscription {} failed ({}), now PAST_DUE", updated.getId(), event.getFailureReason());
            notify(updated, NotificationKind.RENEWAL_FAILED, null);
        }
    }

    private void openSchedule(Subscription subscription, Instant failedAt, Instant now) {
        SettlementProperties.Dunning dunning = properties.getDunning();
        DunningSchedule schedule = scheduleRepository.save(DunningSchedule.builder()
                .subscriptionId(subscription.getId())
                .tenantId(subscription.getTenantId())
                .failedAt(failedAt)
                .graceDeadline(failedAt.plus(Duration.ofDays(dunning.getGraceDays())))
                .status(DunningStatus.OPEN)
                .createdAt(now)
                .build());

        List<RenewalAttempt> attempts = new ArrayList<>();
        int sequence = 1;
        for (Integer offset : dunning.getAttemptOffsetsDays()) {
            attempts.add(RenewalAttempt.builder()
                    .scheduleId(schedule.getId())
                    .subscriptionId(subscription.getId())
                    .sequenceNumber(sequence++)
                    .offsetDays(offset)
                    .scheduledAt(failedAt.plus(Duration.ofDays(offset)))
                    .status(RenewalAttemptStatus.PENDING)
                    .build());
        }
        attemptRepository.saveAll(attempts);
        log.info("Opened dunning schedule {} for subscription {}: {} attempts, grace deadline {}",
                schedule.getId(), subscription.getId(), attempts.size(), schedule.getGraceDeadline());
    }

    private void applyAttemptOutcome(Long attemptId, PaymentOutcomeEvent event, boolean succeeded) {
        Subscription recovered = transactionTemplate.execute(status -> {
            RenewalAttempt attempt = attemptRepository.findById(attemptId)
                    .orElseThrow(() -> new ResourceNotFoundException("Renewal attempt", attemptId));
            if (attempt.getStatus() != RenewalAttemptStatus.SENT) {
                if (succeeded) {
                    log.warn("Intent {} succeeded after dunning attempt {} was {}; payment kept, refund manually if needed",
                            event.getIntentId(), attemptId, attempt.getStatus());
                }
                return null;
            }

            Instant now = clock.instant();
            if (!succeeded) {
                attempt.setStatus(RenewalAttemptStatus.FAILED);
                attempt.setFailureReason(event.getFailureReason());
                attemptRepository.save(attempt);
                log.info("Dunning attempt {} (#{}) for subscription {} failed",
                        attemptId, attempt.getSequenceNumber(), attempt.getSubscriptionId());
                return null;
            }

            attempt.setStatus(RenewalAttemptStatus.SUCCEEDED);
            attemptRepository.save(attempt);

            DunningSchedule schedule = scheduleRepository.findById(attempt.getScheduleId())
                    .orElseThrow(() -> new ResourceNotFoundException("Dunning schedule", attempt.getScheduleId()));
            closeSchedule(schedule, DunningStatus.RECOVERED, now);

            Subscription subscription = findSubscription(attempt.getSubscriptionId());
            if (subscription.getStatus() != SubscriptionStatus.PAST_DUE) {
                log.warn("Dunning attempt {} succeeded but subscription {} is {}",
                        attemptId, subscription.getId(), subscription.getStatus());
                return null;
            }
            subscription.transitionTo(SubscriptionStatus.ACTIVE, now);
            subscription.advancePeriod(now);
            return subscriptionRepository.save(subscription);
        });

        if (recovered != null) {
            recoveredCounter.increment();
            log.info("Subscription {} recovered by intent {}", recovered.getId(), event.getIntentId());
            notify(recovered, NotificationKind.PAYMENT_RECOVERED, null);
        }
    }

    // ------------------------------------------------------------------ dunning

    /**
     * Advances every OPEN dunning schedule: closes it when the subscription left PAST_DUE, expires
     * it at the grace deadline, otherwise fires the earliest due retry when none is in flight.
     */
    public SweepResult processDunning(Instant now) {
        SweepResult result = SweepResult.builder()
                .sweep("dunning")
                .startedAt(clock.instant())
                .build();

        for (DunningSchedule schedule : scheduleRepository.findByStatusOrderByFailedAtAsc(DunningStatus.OPEN)) {
            result.incrementExamined();
            try {
                if (advance(schedule, now)) {
                    result.incrementActed();
                } else {
                    result.incrementSkipped();
                }
            } catch (RuntimeException e) {
                log.error("Dunning failed for schedule {}: {}", schedule.getId(), e.getMessage(), e);
                result.addError(schedule.getId(), e.getMessage());
            }
        }

        result.setCompletedAt(clock.instant());
        log.info("Dunning sweep completed. Examined: {}, Acted: {}, Skipped: {}, Errors: {}",
                result.getExamined(), result.getActed(), result.getSkipped(), result.getErrors());
        return result;
    }

    private boolean advance(DunningSchedule schedule, Instant now) {
        Subscription subscription = findSubscription(schedule.getSubscriptionId());
        if (subscription.getStatus() != SubscriptionStatus.PAST_DUE) {
            transactionTemplate.executeWithoutResult(status -> scheduleRepository.findById(schedule.getId())
                    .filter(current -> current.getStatus() == DunningStatus.OPEN)
                    .ifPresent(current -> closeSchedule(current, DunningStatus.CLOSED, clock.instant())));
            log.info("Closed dunning schedule {}: subscription {} is {}",
                    schedule.getId(), subscription.getId(), subscription.getStatus());
            return true;
        }

        List<RenewalAttempt> attempts = attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(schedule.getId());
        catchUpSentAttempts(attempts);

        if (!now.isBefore(schedule.getGraceDeadline())) {
            return expireGrace(schedule.getId());
        }

        attempts = attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(schedule.getId());
        if (findSubscription(schedule.getSubscriptionId()).getStatus() != SubscriptionStatus.PAST_DUE) {
            return true;
        }
        boolean inFlight = attempts.stream().anyMatch(a -> a.getStatus() == RenewalAttemptStatus.SENT);
        if (inFlight) {
            return false;
        }

        Optional<RenewalAttempt> due = attempts.stream()
                .filter(a -> a.getStatus() == RenewalAttemptStatus.PENDING)
                .filter(a -> !a.getScheduledAt().isAfter(now))
                .findFirst();
        if (due.isEmpty()) {
            return false;
        }
        return fireAttempt(schedule, subscription, due.get());
    }

    private void catchUpSentAttempts(List<RenewalAttempt> attempts) {
        for (RenewalAttempt attempt : attempts) {
            if (attempt.getStatus() != RenewalAttemptStatus.SENT || attempt.getIntentId() == null) {
                continue;
            }
            intentRepository.findById(attempt.getIntentId())
                    .filter(intent -> intent.getStatus().isTerminal())
                    .ifPresent(intent -> {
                        log.info("Applying missed outcome {} of dunning intent {}", intent.getStatus(), intent.getId());
                        applyOutcomeSafely(toEvent(intent));
                    });
        }
    }

    private boolean fireAttempt(DunningSchedule schedule, Subscription subscription, RenewalAttempt attempt) {
        String key = "dunning:" + schedule.getId() + ":" + attempt.getSequenceNumber();
        Reservation reservation = idempotencyService.reserve(key, "dunning");
        if (!reservation.isAcquired()) {
            log.debug("Dunning attempt {} already fired ({})", key, reservation.getKind());
            return false;
        }

        PaymentIntent intent;
        try {
            intent = paymentIntentService.createIntent(chargeFor(subscription, key));
            transactionTemplate.executeWithoutResult(status -> {
                RenewalAttempt current = attemptRepository.findById(attempt.getId())
                        .orElseThrow(() -> new ResourceNotFoundException("Renewal attempt", attempt.getId()));
                current.setStatus(RenewalAttemptStatus.SENT);
                current.setIntentId(intent.getId());
                current.setAttemptedAt(clock.instant());
                attemptRepository.save(current);
                idempotencyService.complete(key, String.valueOf(intent.getId()));
            });
        } catch (RuntimeException e) {
            idempotencyService.release(key);
            throw e;
        }

        dunningAttemptsCounter.increment();
        log.info("Dunning attempt #{} for subscription {} sent as intent {}",
                attempt.getSequenceNumber(), subscription.getId(), intent.getId());
        notify(subscription, NotificationKind.DUNNING_ATTEMPT, attempt.getSequenceNumber());
        paymentIntentService.initiate(subscription.getTenantId(), intent.getId());
        return true;
    }

    private boolean expireGrace(Long scheduleId) {
        String key = "grace:" + scheduleId;
        Reservation reservation = idempotencyService.reserve(key, "grace");
        if (!reservation.isAcquired()) {
            log.debug("Grace expiry of schedule {} already handled ({})", scheduleId, reservation.getKind());
            return false;
        }

        Subscription finalState;
        try {
            finalState = transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                DunningSchedule schedule = scheduleRepository.findById(scheduleId)
                        .orElseThrow(() -> new ResourceNotFoundException("Dunning schedule", scheduleId));
                Subscription subscription = findSubscription(schedule.getSubscriptionId());
                if (schedule.getStatus() != DunningStatus.OPEN || subscription.getStatus() != SubscriptionStatus.PAST_DUE) {
                    idempotencyService.complete(key, subscription.getStatus().name());
                    return null;
                }

                closeSchedule(schedule, DunningStatus.EXPIRED, now);
                subscription.transitionTo(SubscriptionStatus.UNPAID, now);
                if (subscription.getDowngradePlanCode() != null) {
                    subscription.transitionTo(SubscriptionStatus.ACTIVE, now);
                    subscription.setPlanCode(subscription.getDowngradePlanCode());
                    subscription.setBillable(false);
                    subscription.setPendingRenewalIntentId(null);
                } else {
                    subscription.transitionTo(SubscriptionStatus.CANCELLED, now);
                    subscription.setCancelledAt(now);
                }
                Subscription saved = subscriptionRepository.save(subscription);
                idempotencyService.complete(key, saved.getStatus().name());
                return saved;
            });
        } catch (RuntimeException e) {
            idempotencyService.release(key);
            throw e;
        }

        if (finalState == null) {
            return false;
        }
        graceExpiredCounter.increment();
        log.info("Dunning schedule {} expired, subscription {} is now {} (plan {})",
                scheduleId, finalState.getId(), finalState.getStatus(), finalState.getPlanCode());
        notify(finalState, NotificationKind.SUBSCRIPTION_UNPAID, null);
        notify(finalState, finalState.getStatus() == SubscriptionStatus.CANCELLED
                ? NotificationKind.SUBSCRIPTION_CANCELLED : NotificationKind.SUBSCRIPTION_DOWNGRADED, null);
        return true;
    }

    /**
     * Closes a schedule and cancels its unfinished attempts. Must run inside a transaction.
     */
    private void closeSchedule(DunningSchedule schedule, DunningStatus closedAs, Instant now) {
        for (RenewalAttempt attempt : attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(schedule.getId())) {
            if (attempt.getStatus() == RenewalAttemptStatus.PENDING || attempt.getStatus() == RenewalAttemptStatus.SENT) {
                attempt.setStatus(RenewalAttemptStatus.CANCELLED);
                attemptRepository.save(attempt);
            }
        }
        schedule.setStatus(closedAs);
        schedule.setClosedAt(now);
        scheduleRepository.save(schedule);
    }

    // ------------------------------------------------------------------ helpers

    private Subscription findSubscription(Long subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription", subscriptionId));
    }

    private static PaymentOutcomeEvent toEvent(PaymentIntent intent) {
        return PaymentOutcomeEvent.builder()
                .intentId(intent.getId())
                .tenantId(intent.getTenantId())
                .subjectId(intent.getSubjectId())
                .subscriptionId(intent.getSubscriptionId())
                .purpose(intent.getPurpose())
                .status(intent.getStatus())
                .amount(intent.getAmount())
                .failureReason(intent.getFailureReason())
                .occurredAt(intent.getUpdatedAt())
                .build();
    }

    private void notify(Subscription subscription, NotificationKind kind, Integer attemptNumber) {
        try {
            notificationPublisher.publish(SubscriptionNotification.builder()
                    .tenantId(subscription.getTenantId())
                    .subjectId(subscription.getSubjectId())
                    .subscriptionId(subscription.getId())
                    .kind(kind)
                    .amount(subscription.getAmount())
                    .currency(subscription.getCurrency())
                    .attemptNumber(attemptNumber)
                    .occurredAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.error("Notification {} for subscription {} failed: {}", kind, subscription.getId(), e.getMessage(), e);
        }
    }
}
