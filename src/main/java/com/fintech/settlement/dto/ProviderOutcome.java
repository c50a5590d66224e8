package com.fintech.settlement.dto;

/**
 * Provider view of a collection or reversal, normalized across providers.
 */
public enum ProviderOutcome {
    SUCCESS,
    FAILURE,
    /**
     * Still processing at the provider, e.g. the customer has not answered the prompt yet.
     */
    PENDING,
    NOT_FOUND;

    public boolean isFinal() {
        return this == SUCCESS || this == FAILURE;
    }
}
