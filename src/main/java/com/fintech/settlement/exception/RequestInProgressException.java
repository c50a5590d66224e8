package com.fintech.settlement.exception;

/**
 * Another worker currently holds the idempotency key of this operation. The caller should
 * retry later with the same key.
 */
public class RequestInProgressException extends SettlementException {

    private final String idempotencyKey;

    public RequestInProgressException(String idempotencyKey) {
        super("Operation " + idempotencyKey + " is already in progress");
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
