package com.fintech.settlement.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePaymentIntentRequest {

    @NotBlank
    private String subjectId;

    @NotBlank
    private String payerAccount;

    /**
     * Minor units.
     */
    @Positive
    private long amount;

    @NotBlank
    @Size(min = 3, max = 3)
    private String currency;

    @NotBlank
    private String provider;

    @NotBlank
    @Size(max = 100)
    private String idempotencyKey;
}
