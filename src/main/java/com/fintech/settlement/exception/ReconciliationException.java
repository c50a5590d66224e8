package com.fintech.settlement.exception;

/**
 * Raised when a reconciliation run cannot start or complete, e.g. another run is in progress.
 */
public class ReconciliationException extends SettlementException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
