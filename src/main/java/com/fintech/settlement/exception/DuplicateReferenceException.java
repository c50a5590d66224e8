package com.fintech.settlement.exception;

/**
 * The transaction group, or the reference within it, already has journal lines.
 */
public class DuplicateReferenceException extends LedgerInvariantException {

    private final String reference;

    public DuplicateReferenceException(String message, String transactionGroupId, String reference) {
        super(message, transactionGroupId);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
