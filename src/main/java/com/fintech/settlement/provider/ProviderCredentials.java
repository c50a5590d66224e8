package com.fintech.settlement.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Credentials and endpoint for one tenant at one provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderCredentials {

    private String baseUrl;
    private String clientId;

    @ToString.Exclude
    private String clientSecret;

    private String shortcode;

    @ToString.Exclude
    private String passkey;

    private String transactionType;
    private String initiator;

    @ToString.Exclude
    private String securityCredential;

    private String country;
    private String currency;
}
