package com.fintech.settlement.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a payment intent.
 * <p>
 * CREATED -> PROVIDER_INITIATED -> {SUCCEEDED | FAILED | EXPIRED}, CREATED -> CANCELLED,
 * and SUCCEEDED -> REVERSED through an explicit refund.
 */
public enum PaymentIntentStatus {
    /**
     * Intent recorded, provider not contacted yet.
     */
    CREATED,

    /**
     * Provider accepted the collection request; waiting for the callback.
     */
    PROVIDER_INITIATED,

    SUCCEEDED,

    FAILED,

    /**
     * No callback arrived within the policy window and the status query did not confirm an outcome.
     */
    EXPIRED,

    CANCELLED,

    /**
     * A refund was posted against this intent. Only reachable from SUCCEEDED.
     */
    REVERSED;

    private static final Set<PaymentIntentStatus> TERMINAL = EnumSet.of(SUCCEEDED, FAILED, EXPIRED, CANCELLED, REVERSED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(PaymentIntentStatus target) {
        return switch (this) {
            case CREATED -> target == PROVIDER_INITIATED || target == FAILED
                    || target == EXPIRED || target == CANCELLED;
            case PROVIDER_INITIATED -> target == SUCCEEDED || target == FAILED || target == EXPIRED;
            case SUCCEEDED -> target == REVERSED;
            case FAILED, EXPIRED, CANCELLED, REVERSED -> false;
        };
    }
}
