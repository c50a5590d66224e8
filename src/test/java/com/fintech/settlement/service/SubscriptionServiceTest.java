package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.NotificationKind;
import com.fintech.settlement.dto.PaymentIntentCommand;
import com.fintech.settlement.dto.PaymentOutcomeEvent;
import com.fintech.settlement.dto.Reservation;
import com.fintech.settlement.dto.SubscriptionNotification;
import com.fintech.settlement.dto.SweepResult;
import com.fintech.settlement.entity.BillingInterval;
import com.fintech.settlement.entity.DunningSchedule;
import com.fintech.settlement.entity.DunningStatus;
import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.entity.PaymentIntentStatus;
import com.fintech.settlement.entity.PaymentPurpose;
import com.fintech.settlement.entity.RenewalAttempt;
import com.fintech.settlement.entity.RenewalAttemptStatus;
import com.fintech.settlement.entity.Subscription;
import com.fintech.settlement.entity.SubscriptionStatus;
import com.fintech.settlement.notification.NotificationPublisher;
import com.fintech.settlement.provider.ProviderAdapterRegistry;
import com.fintech.settlement.repository.DunningScheduleRepository;
import com.fintech.settlement.repository.PaymentIntentRepository;
import com.fintech.settlement.repository.RenewalAttemptRepository;
import com.fintech.settlement.repository.SubscriptionRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T00:00:00Z");
    private static final Instant FAILED_AT = Instant.parse("2024-03-01T00:00:00Z");
    private static final String TENANT = "tenant-a";

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private DunningScheduleRepository scheduleRepository;

    @Mock
    private RenewalAttemptRepository attemptRepository;

    @Mock
    private PaymentIntentRepository intentRepository;

    @Mock
    private PaymentIntentService paymentIntentService;

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private ProviderAdapterRegistry adapterRegistry;

    @Mock
    private NotificationPublisher notificationPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private SubscriptionService subscriptionService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        subscriptionService = new SubscriptionService(
                subscriptionRepository,
                scheduleRepository,
                attemptRepository,
                intentRepository,
                paymentIntentService,
                idempotencyService,
                adapterRegistry,
                notificationPublisher,
                new SettlementProperties(),
                transactionManager,
                Clock.fixed(NOW, ZoneOffset.UTC),
                meterRegistry
        );
        subscriptionService.initMetrics();
    }

    private Subscription subscription(SubscriptionStatus status, Long pendingRenewalIntentId) {
        return Subscription.builder()
                .id(1L)
                .tenantId(TENANT)
                .subjectId("customer-1")
                .payerAccount("254712345678")
                .provider("mpesa")
                .planCode("pro")
                .interval(BillingInterval.MONTHLY)
                .amount(100_000L)
                .currency("KES")
                .status(status)
                .billingAnchor(Instant.parse("2024-02-01T00:00:00Z"))
                .currentPeriodStart(Instant.parse("2024-02-01T00:00:00Z"))
                .currentPeriodEnd(FAILED_AT)
                .nextRenewalAt(FAILED_AT)
                .pendingRenewalIntentId(pendingRenewalIntentId)
                .createdAt(Instant.parse("2024-02-01T00:00:00Z"))
                .updatedAt(Instant.parse("2024-02-01T00:00:00Z"))
                .build();
    }

    private DunningSchedule openSchedule() {
        return DunningSchedule.builder()
                .id(100L)
                .subscriptionId(1L)
                .tenantId(TENANT)
                .failedAt(FAILED_AT)
                .graceDeadline(FAILED_AT.plus(Duration.ofDays(7)))
                .status(DunningStatus.OPEN)
                .createdAt(FAILED_AT)
                .build();
    }

    private RenewalAttempt attempt(Long id, int sequence, int offsetDays, RenewalAttemptStatus status, Long intentId) {
        return RenewalAttempt.builder()
                .id(id)
                .scheduleId(100L)
                .subscriptionId(1L)
                .sequenceNumber(sequence)
                .offsetDays(offsetDays)
                .scheduledAt(FAILED_AT.plus(Duration.ofDays(offsetDays)))
                .status(status)
                .intentId(intentId)
                .build();
    }

    private PaymentOutcomeEvent outcome(Long intentId, PaymentIntentStatus status) {
        return PaymentOutcomeEvent.builder()
                .intentId(intentId)
                .tenantId(TENANT)
                .subscriptionId(1L)
                .purpose(PaymentPurpose.SUBSCRIPTION_RENEWAL)
                .status(status)
                .amount(100_000L)
                .failureReason(status == PaymentIntentStatus.FAILED ? "1: insufficient balance" : null)
                .occurredAt(FAILED_AT)
                .build();
    }

    private List<NotificationKind> notifiedKinds() {
        ArgumentCaptor<SubscriptionNotification> captor = ArgumentCaptor.forClass(SubscriptionNotification.class);
        verify(notificationPublisher, atLeastOnce()).publish(captor.capture());
        List<NotificationKind> kinds = new ArrayList<>();
        captor.getAllValues().forEach(n -> kinds.add(n.getKind()));
        return kinds;
    }

    @Nested
    @DisplayName("Renewal Outcome Tests")
    class RenewalOutcomeTests {

        @Test
        @DisplayName("Failed renewal moves to PAST_DUE and opens a T+0/T+1/T+3 schedule with a T+7 deadline")
        void shouldOpenDunningOnFailure() {
            // Given
            Subscription subscription = subscription(SubscriptionStatus.ACTIVE, 20L);
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
            when(scheduleRepository.save(any(DunningSchedule.class))).thenAnswer(invocation -> {
                DunningSchedule saved = invocation.getArgument(0);
                saved.setId(100L);
                return saved;
            });
            when(subscriptionRepository.save(any(Subscription.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            subscriptionService.onPaymentOutcome(outcome(20L, PaymentIntentStatus.FAILED));

            // Then
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(subscription.getPendingRenewalIntentId()).isNull();

            ArgumentCaptor<DunningSchedule> scheduleCaptor = ArgumentCaptor.forClass(DunningSchedule.class);
            verify(scheduleRepository).save(scheduleCaptor.capture());
            assertThat(scheduleCaptor.getValue().getGraceDeadline()).isEqualTo(Instant.parse("2024-03-08T00:00:00Z"));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<RenewalAttempt>> attemptsCaptor = ArgumentCaptor.forClass(List.class);
            verify(attemptRepository).saveAll(attemptsCaptor.capture());
            assertThat(attemptsCaptor.getValue())
                    .extracting(RenewalAttempt::getScheduledAt)
                    .containsExactly(
                            Instant.parse("2024-03-01T00:00:00Z"),
                            Instant.parse("2024-03-02T00:00:00Z"),
                            Instant.parse("2024-03-04T00:00:00Z"));
            assertThat(attemptsCaptor.getValue())
                    .allMatch(a -> a.getStatus() == RenewalAttemptStatus.PENDING && a.getScheduleId() == 100L);
            assertThat(notifiedKinds()).containsExactly(NotificationKind.RENEWAL_FAILED);
        }

        @Test
        @DisplayName("Successful renewal advances the period and clears the pending intent")
        void shouldAdvanceOnSuccess() {
            // Given
            Subscription subscription = subscription(SubscriptionStatus.ACTIVE, 20L);
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
            when(subscriptionRepository.save(any(Subscription.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            subscriptionService.onPaymentOutcome(outcome(20L, PaymentIntentStatus.SUCCEEDED));

            // Then
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(subscription.getCurrentPeriodStart()).isEqualTo(FAILED_AT);
            assertThat(subscription.getNextRenewalAt()).isEqualTo(Instant.parse("2024-04-01T00:00:00Z"));
            assertThat(subscription.getPendingRenewalIntentId()).isNull();
            verifyNoInteractions(scheduleRepository);
            assertThat(notifiedKinds()).containsExactly(NotificationKind.RENEWAL_SUCCEEDED);
        }

        @Test
        @DisplayName("An outcome for an intent the subscription no longer waits on is ignored")
        void shouldIgnoreStaleOutcome() {
            // Given
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription(SubscriptionStatus.ACTIVE, 21L)));

            // When
            subscriptionService.onPaymentOutcome(outcome(20L, PaymentIntentStatus.FAILED));

            // Then
            verify(subscriptionRepository, never()).save(any());
            verifyNoInteractions(scheduleRepository, notificationPublisher);
        }

        @Test
        @DisplayName("One-off payment outcomes are not subscription business")
        void shouldIgnoreOneOff() {
            // Given
            PaymentOutcomeEvent event = outcome(20L, PaymentIntentStatus.FAILED);
            event.setPurpose(PaymentPurpose.ONE_OFF);

            // When
            subscriptionService.onPaymentOutcome(event);

            // Then
            verifyNoInteractions(subscriptionRepository, attemptRepository);
        }

        @Test
        @DisplayName("A failure while applying an outcome is counted, not thrown")
        void shouldCountApplyFailures() {
            // Given
            when(subscriptionRepository.findById(1L)).thenThrow(new IllegalStateException("connection reset"));

            // When
            subscriptionService.onPaymentOutcome(outcome(20L, PaymentIntentStatus.FAILED));

            // Then
            assertThat(meterRegistry.counter("subscription.outcome.failures").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Dunning Sweep Tests")
    class DunningSweepTests {

        @Test
        @DisplayName("Should fire the earliest due attempt under its dunning key")
        void shouldFireDueAttempt() {
            // Given
            Subscription subscription = subscription(SubscriptionStatus.PAST_DUE, null);
            RenewalAttempt first = attempt(7L, 1, 0, RenewalAttemptStatus.PENDING, null);
            List<RenewalAttempt> attempts = List.of(first,
                    attempt(8L, 2, 1, RenewalAttemptStatus.PENDING, null),
                    attempt(9L, 3, 3, RenewalAttemptStatus.PENDING, null));
            Instant beforeDeadline = Instant.parse("2024-03-01T06:00:00Z");

            when(scheduleRepository.findByStatusOrderByFailedAtAsc(DunningStatus.OPEN)).thenReturn(List.of(openSchedule()));
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
            when(attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(100L)).thenReturn(attempts);
            when(idempotencyService.reserve("dunning:100:1", "dunning")).thenReturn(Reservation.acquired("dunning:100:1"));
            when(paymentIntentService.createIntent(any(PaymentIntentCommand.class)))
                    .thenReturn(PaymentIntent.builder().id(30L).build());
            when(attemptRepository.findById(7L)).thenReturn(Optional.of(first));

            // When
            SweepResult result = subscriptionService.processDunning(beforeDeadline);

            // Then
            assertThat(result.getActed()).isEqualTo(1);
            assertThat(first.getStatus()).isEqualTo(RenewalAttemptStatus.SENT);
            assertThat(first.getIntentId()).isEqualTo(30L);

            ArgumentCaptor<PaymentIntentCommand> commandCaptor = ArgumentCaptor.forClass(PaymentIntentCommand.class);
            verify(paymentIntentService).createIntent(commandCaptor.capture());
            assertThat(commandCaptor.getValue().getIdempotencyKey()).isEqualTo("dunning:100:1");
            assertThat(commandCaptor.getValue().getPurpose()).isEqualTo(PaymentPurpose.SUBSCRIPTION_RENEWAL);
            assertThat(commandCaptor.getValue().getAmount()).isEqualTo(100_000L);

            verify(idempotencyService).complete("dunning:100:1", "30");
            verify(paymentIntentService).initiate(TENANT, 30L);
            assertThat(notifiedKinds()).containsExactly(NotificationKind.DUNNING_ATTEMPT);
        }

        @Test
        @DisplayName("Should not fire when another sweep already holds the dunning key")
        void shouldSkipWhenKeyTaken() {
            // Given
            when(scheduleRepository.findByStatusOrderByFailedAtAsc(DunningStatus.OPEN)).thenReturn(List.of(openSchedule()));
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription(SubscriptionStatus.PAST_DUE, null)));
            when(attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(100L))
                    .thenReturn(List.of(attempt(7L, 1, 0, RenewalAttemptStatus.PENDING, null)));
            when(idempotencyService.reserve("dunning:100:1", "dunning"))
                    .thenReturn(Reservation.inFlight("dunning:100:1", null));

            // When
            SweepResult result = subscriptionService.processDunning(Instant.parse("2024-03-01T06:00:00Z"));

            // Then
            assertThat(result.getSkipped()).isEqualTo(1);
            verifyNoInteractions(paymentIntentService);
        }

        @Test
        @DisplayName("Should wait until the next attempt is due")
        void shouldWaitForOutcome() {
            // Given
            when(scheduleRepository.findByStatusOrderByFailedAtAsc(DunningStatus.OPEN)).thenReturn(List.of(openSchedule()));
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription(SubscriptionStatus.PAST_DUE, null)));
            when(attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(100L)).thenReturn(List.of(
                    attempt(7L, 1, 0, RenewalAttemptStatus.FAILED, 30L),
                    attempt(8L, 2, 1, RenewalAttemptStatus.PENDING, null)));

            // When
            SweepResult result = subscriptionService.processDunning(Instant.parse("2024-03-01T12:00:00Z"));

            // Then
            assertThat(result.getSkipped()).isEqualTo(1);
            verifyNoInteractions(idempotencyService, paymentIntentService);
        }

        @Test
        @DisplayName("At the grace deadline a subscription without a downgrade plan ends CANCELLED")
        void shouldCancelAtGraceDeadline() {
            // Given
            Subscription subscription = subscription(SubscriptionStatus.PAST_DUE, null);
            DunningSchedule schedule = openSchedule();
            RenewalAttempt last = attempt(9L, 3, 3, RenewalAttemptStatus.FAILED, 32L);
            when(scheduleRepository.findByStatusOrderByFailedAtAsc(DunningStatus.OPEN)).thenReturn(List.of(schedule));
            when(scheduleRepository.findById(100L)).thenReturn(Optional.of(schedule));
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
            when(attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(100L)).thenReturn(List.of(last));
            when(idempotencyService.reserve("grace:100", "grace")).thenReturn(Reservation.acquired("grace:100"));
            when(subscriptionRepository.save(any(Subscription.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            SweepResult result = subscriptionService.processDunning(NOW);

            // Then
            assertThat(result.getActed()).isEqualTo(1);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
            assertThat(subscription.getCancelledAt()).isEqualTo(NOW);
            assertThat(schedule.getStatus()).isEqualTo(DunningStatus.EXPIRED);
            verify(idempotencyService).complete("grace:100", "CANCELLED");
            assertThat(notifiedKinds()).containsExactly(
                    NotificationKind.SUBSCRIPTION_UNPAID, NotificationKind.SUBSCRIPTION_CANCELLED);
        }

        @Test
        @DisplayName("At the grace deadline a subscription with a downgrade plan stays ACTIVE on it, unbilled")
        void shouldDowngradeAtGraceDeadline() {
            // Given
            Subscription subscription = subscription(SubscriptionStatus.PAST_DUE, null);
            subscription.setDowngradePlanCode("free");
            DunningSchedule schedule = openSchedule();
            when(scheduleRepository.findByStatusOrderByFailedAtAsc(DunningStatus.OPEN)).thenReturn(List.of(schedule));
            when(scheduleRepository.findById(100L)).thenReturn(Optional.of(schedule));
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
            when(attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(100L)).thenReturn(List.of());
            when(idempotencyService.reserve("grace:100", "grace")).thenReturn(Reservation.acquired("grace:100"));
            when(subscriptionRepository.save(any(Subscription.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            subscriptionService.processDunning(NOW);

            // Then
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(subscription.getPlanCode()).isEqualTo("free");
            assertThat(subscription.isBillable()).isFalse();
            assertThat(notifiedKinds()).containsExactly(
                    NotificationKind.SUBSCRIPTION_UNPAID, NotificationKind.SUBSCRIPTION_DOWNGRADED);
        }

        @Test
        @DisplayName("Should close the schedule when the subscription left PAST_DUE")
        void shouldCloseWhenNoLongerPastDue() {
            // Given
            DunningSchedule schedule = openSchedule();
            when(scheduleRepository.findByStatusOrderByFailedAtAsc(DunningStatus.OPEN)).thenReturn(List.of(schedule));
            when(scheduleRepository.findById(100L)).thenReturn(Optional.of(schedule));
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription(SubscriptionStatus.CANCELLED, null)));

            // When
            subscriptionService.processDunning(NOW);

            // Then
            assertThat(schedule.getStatus()).isEqualTo(DunningStatus.CLOSED);
            verifyNoInteractions(idempotencyService);
        }
    }

    @Nested
    @DisplayName("Dunning Outcome Tests")
    class DunningOutcomeTests {

        @Test
        @DisplayName("A successful retry recovers the subscription and cancels the remaining attempts")
        void shouldRecover() {
            // Given
            Subscription subscription = subscription(SubscriptionStatus.PAST_DUE, null);
            DunningSchedule schedule = openSchedule();
            RenewalAttempt sent = attempt(8L, 2, 1, RenewalAttemptStatus.SENT, 31L);
            RenewalAttempt later = attempt(9L, 3, 3, RenewalAttemptStatus.PENDING, null);
            when(attemptRepository.findByIntentId(31L)).thenReturn(Optional.of(sent));
            when(attemptRepository.findById(8L)).thenReturn(Optional.of(sent));
            when(scheduleRepository.findById(100L)).thenReturn(Optional.of(schedule));
            when(attemptRepository.findByScheduleIdOrderBySequenceNumberAsc(100L)).thenReturn(List.of(sent, later));
            when(subscriptionRepository.findById(1L)).thenReturn(Optional.of(subscription));
            when(subscriptionRepository.save(any(Subscription.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            subscriptionService.onPaymentOutcome(outcome(31L, PaymentIntentStatus.SUCCEEDED));

            // Then
            assertThat(sent.getStatus()).isEqualTo(RenewalAttemptStatus.SUCCEEDED);
            assertThat(later.getStatus()).isEqualTo(RenewalAttemptStatus.CANCELLED);
            assertThat(schedule.getStatus()).isEqualTo(DunningStatus.RECOVERED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(subscription.getNextRenewalAt()).isEqualTo(Instant.parse("2024-04-01T00:00:00Z"));
            assertThat(notifiedKinds()).containsExactly(NotificationKind.PAYMENT_RECOVERED);
        }

        @Test
        @DisplayName("A failed retry only marks its attempt")
        void shouldMarkFailedAttempt() {
            // Given
            RenewalAttempt sent = attempt(7L, 1, 0, RenewalAttemptStatus.SENT, 30L);
            when(attemptRepository.findByIntentId(30L)).thenReturn(Optional.of(sent));
            when(attemptRepository.findById(7L)).thenReturn(Optional.of(sent));

            // When
            subscriptionService.onPaymentOutcome(outcome(30L, PaymentIntentStatus.FAILED));

            // Then
            assertThat(sent.getStatus()).isEqualTo(RenewalAttemptStatus.FAILED);
            assertThat(sent.getFailureReason()).isEqualTo("1: insufficient balance");
            verifyNoInteractions(subscriptionRepository, notificationPublisher);
        }

        @Test
        @DisplayName("A success arriving after its attempt was cancelled changes nothing")
        void shouldIgnoreLateSuccess() {
            // Given
            RenewalAttempt cancelled = attempt(9L, 3, 3, RenewalAttemptStatus.CANCELLED, 32L);
            when(attemptRepository.findByIntentId(32L)).thenReturn(Optional.of(cancelled));
            when(attemptRepository.findById(9L)).thenReturn(Optional.of(cancelled));

            // When
            subscriptionService.onPaymentOutcome(outcome(32L, PaymentIntentStatus.SUCCEEDED));

            // Then
            assertThat(cancelled.getStatus()).isEqualTo(RenewalAttemptStatus.CANCELLED);
            verifyNoInteractions(subscriptionRepository, scheduleRepository, notificationPublisher);
        }
    }
}
