package com.fintech.settlement.exception;

public class InvalidStateTransitionException extends SettlementException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
