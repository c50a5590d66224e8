package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of reserving an idempotency key.
 * <p>
 * ALREADY_IN_FLIGHT and ALREADY_COMPLETED are expected concurrency outcomes, not errors:
 * callers adopt the recorded result instead of repeating the effect.
 */
@Getter
@ToString
@AllArgsConstructor
public class Reservation {

    public enum Kind {
        ACQUIRED,
        ALREADY_IN_FLIGHT,
        ALREADY_COMPLETED
    }

    private final Kind kind;
    private final String key;
    private final String result;

    public static Reservation acquired(String key) {
        return new Reservation(Kind.ACQUIRED, key, null);
    }

    public static Reservation inFlight(String key, String result) {
        return new Reservation(Kind.ALREADY_IN_FLIGHT, key, result);
    }

    public static Reservation completed(String key, String result) {
        return new Reservation(Kind.ALREADY_COMPLETED, key, result);
    }

    public boolean isAcquired() {
        return kind == Kind.ACQUIRED;
    }

    public boolean isCompleted() {
        return kind == Kind.ALREADY_COMPLETED;
    }
}
