package com.fintech.settlement.exception;

public class UnbalancedTransactionException extends LedgerInvariantException {

    public UnbalancedTransactionException(String message, String transactionGroupId) {
        super(message, transactionGroupId);
    }
}
