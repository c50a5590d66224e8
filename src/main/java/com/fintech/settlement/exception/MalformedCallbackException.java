package com.fintech.settlement.exception;

/**
 * A callback body that cannot be validated into a normalized event. The callback is still
 * acknowledged so the provider stops retrying, but it has no ledger effect.
 */
public class MalformedCallbackException extends SettlementException {

    private final String providerName;

    public MalformedCallbackException(String message, String providerName) {
        super(message);
        this.providerName = providerName;
    }

    public MalformedCallbackException(String message, String providerName, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
