package com.fintech.settlement.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionTest {

    private static final Instant UPDATED_AT = Instant.parse("2024-06-01T00:00:00Z");

    private Subscription subscription(BillingInterval interval, Instant anchor) {
        return Subscription.builder()
                .id(1L)
                .interval(interval)
                .status(SubscriptionStatus.ACTIVE)
                .billingAnchor(anchor)
                .currentPeriodStart(anchor)
                .currentPeriodEnd(interval.periodEnd(anchor, 1))
                .nextRenewalAt(interval.periodEnd(anchor, 1))
                .build();
    }

    @Nested
    @DisplayName("Period Advancement Tests")
    class PeriodTests {

        @Test
        @DisplayName("Monthly periods anchored on the 31st return to the 31st after a short month")
        void monthEndAnchorDoesNotDrift() {
            // Given
            Subscription subscription = subscription(BillingInterval.MONTHLY, Instant.parse("2024-01-31T10:00:00Z"));
            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(Instant.parse("2024-02-29T10:00:00Z"));

            // When
            subscription.advancePeriod(UPDATED_AT);

            // Then
            assertThat(subscription.getCurrentPeriodStart()).isEqualTo(Instant.parse("2024-02-29T10:00:00Z"));
            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(Instant.parse("2024-03-31T10:00:00Z"));
            assertThat(subscription.getNextRenewalAt()).isEqualTo(Instant.parse("2024-03-31T10:00:00Z"));

            // When
            subscription.advancePeriod(UPDATED_AT);
            subscription.advancePeriod(UPDATED_AT);

            // Then
            assertThat(subscription.getPeriodNumber()).isEqualTo(3);
            assertThat(subscription.getCurrentPeriodStart()).isEqualTo(Instant.parse("2024-04-30T10:00:00Z"));
            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(Instant.parse("2024-05-31T10:00:00Z"));
        }

        @Test
        @DisplayName("Yearly periods anchored on Feb 29 land on Feb 29 again in the next leap year")
        void leapDayAnchorReturns() {
            // Given
            Subscription subscription = subscription(BillingInterval.YEARLY, Instant.parse("2024-02-29T00:00:00Z"));

            // When
            subscription.advancePeriod(UPDATED_AT);
            subscription.advancePeriod(UPDATED_AT);
            subscription.advancePeriod(UPDATED_AT);

            // Then
            assertThat(subscription.getCurrentPeriodStart()).isEqualTo(Instant.parse("2027-02-28T00:00:00Z"));
            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(Instant.parse("2028-02-29T00:00:00Z"));
        }

        @Test
        @DisplayName("Advancing clears the pending renewal intent")
        void advanceClearsPendingIntent() {
            // Given
            Subscription subscription = subscription(BillingInterval.MONTHLY, Instant.parse("2024-03-01T00:00:00Z"));
            subscription.setPendingRenewalIntentId(42L);

            // When
            subscription.advancePeriod(UPDATED_AT);

            // Then
            assertThat(subscription.getPendingRenewalIntentId()).isNull();
            assertThat(subscription.getUpdatedAt()).isEqualTo(UPDATED_AT);
        }
    }
}
