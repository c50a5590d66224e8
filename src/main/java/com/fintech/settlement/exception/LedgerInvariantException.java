package com.fintech.settlement.exception;

/**
 * A posting violated a ledger invariant. These indicate programming errors: the offending
 * operation is halted and operators are alerted, they are never swallowed.
 */
public abstract class LedgerInvariantException extends SettlementException {

    private final String transactionGroupId;

    protected LedgerInvariantException(String message, String transactionGroupId) {
        super(message);
        this.transactionGroupId = transactionGroupId;
    }

    public String getTransactionGroupId() {
        return transactionGroupId;
    }
}
