package com.fintech.settlement.dto;

import com.fintech.settlement.entity.PaymentIntentStatus;
import com.fintech.settlement.entity.PaymentPurpose;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published whenever a payment intent reaches a terminal status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentOutcomeEvent {

    private Long intentId;
    private String tenantId;
    private String subjectId;
    private Long subscriptionId;
    private PaymentPurpose purpose;
    private PaymentIntentStatus status;
    private long amount;
    private String failureReason;
    private Instant occurredAt;
}
