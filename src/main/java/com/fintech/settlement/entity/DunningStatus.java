package com.fintech.settlement.entity;

public enum DunningStatus {
    /**
     * Retries still running.
     */
    OPEN,

    /**
     * A retry succeeded and the subscription went back to ACTIVE.
     */
    RECOVERED,

    /**
     * The grace deadline passed without a successful retry.
     */
    EXPIRED,

    /**
     * The subscription left PAST_DUE by other means, e.g. an operator cancellation.
     */
    CLOSED
}
