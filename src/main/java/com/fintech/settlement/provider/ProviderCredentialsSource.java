package com.fintech.settlement.provider;

/**
 * Supplies provider credentials per tenant. Secret storage lives behind this interface.
 */
public interface ProviderCredentialsSource {

    /**
     * @throws com.fintech.settlement.exception.ProviderRejectedException if the tenant has no
     *                                                                    credentials for the provider
     */
    ProviderCredentials credentialsFor(String tenantId, String providerName);
}
