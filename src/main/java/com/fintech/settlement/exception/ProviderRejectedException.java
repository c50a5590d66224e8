package com.fintech.settlement.exception;

/**
 * The provider refused the request outright (invalid subscriber, bad credentials, business rule).
 * Never retried.
 */
public class ProviderRejectedException extends SettlementException {

    private final String providerName;
    private final String providerCode;

    public ProviderRejectedException(String message, String providerName, String providerCode) {
        super(message);
        this.providerName = providerName;
        this.providerCode = providerCode;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getProviderCode() {
        return providerCode;
    }
}
