package com.fintech.settlement.entity;

/**
 * Subscription billing state.
 * <p>
 * ACTIVE -> PAST_DUE -> {UNPAID | CANCELLED}, PAST_DUE -> ACTIVE on a successful retry,
 * UNPAID -> CANCELLED or UNPAID -> ACTIVE (downgraded to a free plan). Any non-cancelled
 * subscription can also be cancelled by an operator.
 */
public enum SubscriptionStatus {
    ACTIVE,
    PAST_DUE,
    UNPAID,
    CANCELLED;

    public boolean canTransitionTo(SubscriptionStatus target) {
        return switch (this) {
            case ACTIVE -> target == PAST_DUE || target == CANCELLED;
            case PAST_DUE -> target == ACTIVE || target == UNPAID || target == CANCELLED;
            case UNPAID -> target == CANCELLED || target == ACTIVE;
            case CANCELLED -> false;
        };
    }
}
