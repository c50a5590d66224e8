package com.fintech.settlement.provider;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.config.SettlementProperties.ProviderSettings;
import com.fintech.settlement.exception.ProviderRejectedException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads credentials from {@code settlement.tenants.<tenant>.<provider>}, falling back to
 * {@code settlement.providers.<provider>}.
 */
@Component
public class PropertiesCredentialsSource implements ProviderCredentialsSource {

    private final SettlementProperties properties;

    public PropertiesCredentialsSource(SettlementProperties properties) {
        this.properties = properties;
    }

    @Override
    public ProviderCredentials credentialsFor(String tenantId, String providerName) {
        ProviderSettings settings = null;
        Map<String, ProviderSettings> tenantSettings = properties.getTenants().get(tenantId);
        if (tenantSettings != null) {
            settings = tenantSettings.get(providerName);
        }
        if (settings == null) {
            settings = properties.getProviders().get(providerName);
        }
        if (settings == null || settings.getClientId() == null) {
            throw new ProviderRejectedException(
                    "No " + providerName + " credentials configured for tenant " + tenantId,
                    providerName, "NO_CREDENTIALS");
        }

        return ProviderCredentials.builder()
                .baseUrl(settings.getBaseUrl())
                .clientId(settings.getClientId())
                .clientSecret(settings.getClientSecret())
                .shortcode(settings.getShortcode())
                .passkey(settings.getPasskey())
                .transactionType(settings.getTransactionType())
                .initiator(settings.getInitiator())
                .securityCredential(settings.getSecurityCredential())
                .country(settings.getCountry())
                .currency(settings.getCurrency() != null ? settings.getCurrency() : properties.getCurrency())
                .build();
    }
}
