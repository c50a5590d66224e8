package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitiationRequest {

    private String tenantId;
    private Long intentId;
    private long amount;
    private String currency;

    /**
     * Account to charge: the subscriber MSISDN for mobile money.
     */
    private String payerAccount;

    private String accountReference;
    private String description;
    private String callbackUrl;
}
