package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a provider hands back when it accepts a collection request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderReference {

    private String provider;

    /**
     * e.g. M-Pesa CheckoutRequestID, Airtel transaction id.
     */
    private String reference;

    /**
     * Secondary provider id kept for support lookups (M-Pesa MerchantRequestID).
     */
    private String secondaryReference;
}
