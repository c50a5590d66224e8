package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {

    private String tenantId;
    private String account;
    private Instant asOf;

    /**
     * Natural balance in minor units: debit-normal for cash and receivable accounts, credit-normal otherwise.
     */
    private long balance;

    private String currency;
}
