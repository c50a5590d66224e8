package com.fintech.settlement.exception;

/**
 * Base exception for settlement engine errors.
 */
public class SettlementException extends RuntimeException {

    public SettlementException(String message) {
        super(message);
    }

    public SettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
