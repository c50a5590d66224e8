package com.fintech.settlement.provider;

import com.fintech.settlement.dto.InitiationRequest;
import com.fintech.settlement.dto.NormalizedEvent;
import com.fintech.settlement.dto.ProviderOutcome;
import com.fintech.settlement.dto.ProviderReference;
import com.fintech.settlement.exception.MalformedCallbackException;
import com.fintech.settlement.exception.ProviderRejectedException;
import com.fintech.settlement.exception.ProviderUnavailableException;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Contract every payment provider integration fulfils.
 * <p>
 * Implementations own the provider wire format. Nothing provider-specific leaves an adapter:
 * callers only ever see {@link NormalizedEvent}, {@link ProviderReference} and
 * {@link ProviderOutcome}.
 */
public interface PaymentProviderAdapter {

    /**
     * Registry key, also the path segment of the webhook URL and the suffix of the cash account.
     */
    String getProviderName();

    CollectionMode collectionMode();

    /**
     * Asks the provider to collect the amount from the payer.
     *
     * @throws ProviderUnavailableException if the provider cannot be reached; the caller may retry
     * @throws ProviderRejectedException    if the provider refused the request
     */
    ProviderReference initiate(InitiationRequest request)
            throws ProviderUnavailableException, ProviderRejectedException;

    /**
     * Validates a raw callback body and converts it to the common event shape.
     *
     * @throws MalformedCallbackException if required fields are missing or unparseable
     */
    NormalizedEvent parseCallback(String rawPayload) throws MalformedCallbackException;

    ProviderOutcome queryStatus(String tenantId, String providerReference)
            throws ProviderUnavailableException;

    /**
     * Requests a refund of a settled collection.
     *
     * @param providerTransactionId the provider's id of the settled transaction (receipt number)
     * @return SUCCESS when reversed synchronously, PENDING when accepted for asynchronous processing
     */
    ProviderOutcome reverse(String tenantId, String providerTransactionId, long amount)
            throws ProviderUnavailableException, ProviderRejectedException;

    /**
     * Total the provider reports as settled for the tenant on the given day, in minor units.
     * Empty when the provider offers no settlement report API.
     */
    default OptionalLong settlementReport(String tenantId, LocalDate settlementDate) {
        return OptionalLong.empty();
    }

    /**
     * Body returned to the provider for every callback, whatever the outcome.
     */
    Map<String, Object> acknowledgement();
}
