package com.fintech.settlement.dto;

import com.fintech.settlement.entity.BillingInterval;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSubscriptionRequest {

    @NotBlank
    private String subjectId;

    @NotBlank
    private String payerAccount;

    @NotBlank
    private String provider;

    @NotBlank
    private String planCode;

    @NotNull
    private BillingInterval interval;

    /**
     * Price per period in minor units.
     */
    @Positive
    private long amount;

    @NotBlank
    @Size(min = 3, max = 3)
    private String currency;

    /**
     * Free plan to fall back to when dunning is exhausted; omit to cancel instead.
     */
    private String downgradePlanCode;

    /**
     * Start of the first (already paid) period. Defaults to now.
     */
    private Instant startAt;
}
