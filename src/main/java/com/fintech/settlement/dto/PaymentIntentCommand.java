package com.fintech.settlement.dto;

import com.fintech.settlement.entity.PaymentPurpose;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntentCommand {

    private String tenantId;
    private String subjectId;
    private Long subscriptionId;
    private String payerAccount;
    private long amount;
    private String currency;
    private String provider;

    /**
     * Caller-supplied for one-off payments, derived deterministically for renewals and dunning attempts.
     */
    private String idempotencyKey;

    @Builder.Default
    private PaymentPurpose purpose = PaymentPurpose.ONE_OFF;
}
