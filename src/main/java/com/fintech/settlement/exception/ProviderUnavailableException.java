package com.fintech.settlement.exception;

/**
 * Thrown when a payment provider cannot be reached or answers with a transient error.
 * This could be due to network issues, timeouts, throttling or provider downtime.
 * Callers may retry with backoff.
 */
public class ProviderUnavailableException extends SettlementException {

    private final String providerName;
    private final String providerReference;

    public ProviderUnavailableException(String message, String providerName) {
        this(message, providerName, null, null);
    }

    public ProviderUnavailableException(String message, String providerName, Throwable cause) {
        this(message, providerName, null, cause);
    }

    public ProviderUnavailableException(String message, String providerName, String providerReference,
                                        Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.providerReference = providerReference;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getProviderReference() {
        return providerReference;
    }
}
