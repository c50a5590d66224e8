package com.fintech.settlement.entity;

import java.time.Instant;
import java.time.ZoneOffset;

public enum BillingInterval {
    MONTHLY,
    YEARLY;

    /**
     * Boundary {@code periods} intervals after {@code anchor}, computed on the UTC calendar from the anchor
     * itself so a month-end anchor keeps its day: Jan 31 gives Feb 29, then Mar 31.
     */
    public Instant periodEnd(Instant anchor, long periods) {
        var start = anchor.atZone(ZoneOffset.UTC);
        return switch (this) {
            case MONTHLY -> start.plusMonths(periods).toInstant();
            case YEARLY -> start.plusYears(periods).toInstant();
        };
    }
}
