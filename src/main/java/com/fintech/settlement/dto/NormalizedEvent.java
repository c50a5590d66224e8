package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider callback after validation at the adapter boundary. This is the only shape of
 * callback data the payment state machine ever sees.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedEvent {

    /**
     * Name of the adapter that produced the event; tags the variant.
     */
    private String provider;

    /**
     * Unique per provider; the dedup key for webhook replays.
     */
    private String providerEventId;

    /**
     * Reference returned by initiate, used to find the payment.
     */
    private String providerReference;

    /**
     * SUCCESS or FAILURE only.
     */
    private ProviderOutcome outcome;

    /**
     * Confirmed amount in minor units; null when the provider omits it (failures).
     */
    private Long amount;

    private String receiptNumber;

    private String failureReason;
}
