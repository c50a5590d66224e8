package com.fintech.settlement.dto;

public enum NotificationKind {
    RENEWAL_SUCCEEDED,
    RENEWAL_FAILED,
    DUNNING_ATTEMPT,
    PAYMENT_RECOVERED,
    SUBSCRIPTION_UNPAID,
    SUBSCRIPTION_CANCELLED,
    SUBSCRIPTION_DOWNGRADED
}
