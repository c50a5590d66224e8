package com.fintech.settlement.dto;

public enum WebhookOutcome {
    /**
     * State transition applied.
     */
    PROCESSED,
    /**
     * Same provider event id seen before; cached result returned.
     */
    DUPLICATE,
    MALFORMED,
    /**
     * No payment matches the provider reference.
     */
    UNMATCHED,
    /**
     * A different outcome was already recorded for the intent; this one was discarded.
     */
    CONFLICT
}
